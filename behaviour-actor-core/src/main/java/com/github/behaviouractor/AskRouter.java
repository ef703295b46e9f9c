package com.github.behaviouractor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.behaviouractor.DeadLetters.DeadLetter;
import com.github.behaviouractor.EventBus.SubscribeAck;
import com.github.behaviouractor.dsl.Base;
import com.github.behaviouractor.dsl.Behaviours;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;


/**
 * Bridges request-response interaction from outside the actor system. Every ask is handed to a
 * routee which sends the question as itself and completes the future with the first reply. Idle
 * routees are reused. The router listens to the dead letters, so when a question cannot be
 * delivered the waiting routee fails its future and becomes free again.
 */
class AskRouter extends Actor implements Base {

	private static final Logger LOG = LoggerFactory.getLogger(AskRouter.class);

	static final class Ask<R> {

		final CompletableFuture<R> completion = new CompletableFuture<>();
		final Object message;
		final ActorRef target;

		public Ask(final Object message, final ActorRef target) {
			this.message = message;
			this.target = target;
		}

		@SuppressWarnings("unchecked")
		void complete(final Object result) {
			completion.complete((R) result);
		}

		void fail(final DeadLetter letter) {
			completion.completeExceptionally(new IllegalStateException("Unable to deliver " + message + " to " + letter.getTarget()));
		}

		boolean isAbout(final DeadLetter letter) {
			return letter.getMessage() == message && target.equals(letter.getTarget());
		}
	}

	static final AskDone I_AM_DONE = new AskDone();

	final Deque<ActorRef> free = new ArrayDeque<>();
	final LongOpenHashSet busy = new LongOpenHashSet();
	final ActorRef eventBus;

	AskRouter(final ActorRef eventBus) {
		this.eventBus = eventBus;
	}

	@Override
	public void preStart() {
		tell(new EventBus.Subscribe(DeadLetter.class, self()), eventBus);
	}

	@Override
	public Receive receive() {
		return behaviour("ask-router")
			.match(Ask.class, this::onAsk)
			.match(AskDone.class, this::onAskDone)
			.match(DeadLetter.class, this::onDeadLetter)
			.match(SubscribeAck.class, ack -> LOG.debug("Ask router {} listens to dead letters", self()))
			.build();
	}

	private void onAsk(final Ask<?> ask) {

		final var ref = getFreeOrCreateNewRoutee();

		busy.add(ref.uuid());

		tell(ask, ref);
	}

	private void onAskDone(final AskDone done) {

		final var routee = sender();

		if (busy.remove(routee.uuid())) {
			free.push(routee);
		}
	}

	private void onDeadLetter(final DeadLetter letter) {
		final var sender = letter.getSender();
		if (busy.contains(sender.uuid())) {
			tell(new Undelivered(letter), sender);
		}
	}

	private ActorRef getFreeOrCreateNewRoutee() {

		if (free.isEmpty()) {
			final var router = self();
			return context().actorOf(Props.create(() -> new AskRoutee(router)));
		}

		return free.pop();
	}

	static final class AskDone {
	}

	/**
	 * Tells the routee that its question went to the dead letters.
	 */
	static final class Undelivered {

		final DeadLetter letter;

		Undelivered(final DeadLetter letter) {
			this.letter = letter;
		}
	}

	/**
	 * Waits for a question in the idle behaviour and for the answer in the awaiting one.
	 */
	static final class AskRoutee extends Actor implements Base, Behaviours {

		private final ActorRef router;
		private final Receive awaiting = behaviour("awaiting")
			.match(Undelivered.class, this::onUndelivered)
			.matchAny(this::onResponse)
			.build();

		private Ask<?> ask;

		AskRoutee(final ActorRef router) {
			this.router = router;
		}

		@Override
		public Receive receive() {
			return behaviour("idle")
				.match(Ask.class, this::onAsk)
				.match(Undelivered.class, u -> LOG.debug("Routee {} ignores late {}", self(), u.letter))
				.build();
		}

		public void onAsk(final Ask<?> ask) {

			this.ask = ask;

			tell(ask.message, ask.target);
			becomeStacked(awaiting);
		}

		public void onResponse(final Object result) {
			ask.complete(result);
			done();
		}

		private void onUndelivered(final Undelivered undelivered) {

			// letter left by a previous question
			if (!ask.isAbout(undelivered.letter)) {
				return;
			}

			ask.fail(undelivered.letter);
			done();
		}

		private void done() {

			ask = null;

			unbecome();
			tell(I_AM_DONE, router);
		}
	}
}
