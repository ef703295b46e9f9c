package com.github.behaviouractor;

import static com.github.behaviouractor.ActorCell.DeliveryStatus.ACCEPTED;
import static com.github.behaviouractor.ActorCell.DeliveryStatus.REJECTED;
import static com.github.behaviouractor.ActorCell.ProcessingStatus.COMPLETE;
import static com.github.behaviouractor.ActorCell.ProcessingStatus.CONTINUE;
import static com.github.behaviouractor.Directive.ExecutionMode.RUN_IMMEDIATELY;
import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Queue;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.behaviouractor.ActorThreadPool.ActorCellInfo;
import com.github.behaviouractor.Dispatcher.Outcome;
import com.github.behaviouractor.message.BehaviourSnapshot;
import com.github.behaviouractor.message.Failure;
import com.github.behaviouractor.message.Unhandled;


/**
 * The runtime shell of a single actor. It owns the actor instance, its mailbox and its
 * {@link BehaviourStack}. Cell is docked on exactly one {@link ActorThread} and all its methods
 * except {@link #setup()} are invoked by that thread only, so at most one message is processed at
 * any time and no locking is necessary.
 * <p>
 *
 * Behaviour switches requested by the actor while a handler (or a lifecycle hook) is running are
 * queued and applied in request order right after the handler returns. If the handler fails, the
 * queued switches are dropped.
 *
 * @param <A> the actor type
 */
public class ActorCell<A extends Actor> implements ActorContext {

	private static final Logger LOG = LoggerFactory.getLogger(ActorCell.class);

	static final ThreadLocal<Deque<ActorContext>> CONTEXT = ThreadLocal.withInitial(ArrayDeque::new);

	private final Queue<Envelope> inbox = new ArrayDeque<>();
	private final BehaviourStack behaviours = new BehaviourStack();
	private final Queue<Consumer<BehaviourStack>> switches = new ArrayDeque<>(2);

	private final ActorSystem system;
	private final Props<A> props;
	private final ActorRef self;

	private boolean started = false;
	private boolean restarting = false;
	private boolean dead = false;
	private A actor;
	private Receive initial;
	private ActorRef sender;

	ActorCell(final ActorSystem system, final Props<A> props, final ActorCellInfo info) {
		this.system = system;
		this.props = props;
		this.self = new ActorRef(system, info);
	}

	static ActorContext getActiveContext() {
		return CONTEXT
			.get()
			.peek();
	}

	static void withActiveContext(final ActorContext context, final Runnable runnable) {

		CONTEXT
			.get()
			.push(context);

		try {
			runnable.run();
		} finally {
			CONTEXT
				.get()
				.pop();
		}
	}

	/**
	 * Setup the cell before actor is started. This method is invoked from the other threads and
	 * thus must not touch anything but the immutable properties.
	 *
	 * @return This cell's {@link ActorRef}
	 */
	ActorRef setup() {
		system.tell(InternalDirectives.START, self, self);
		return self;
	}

	void start() {

		if (started || dead) {
			return;
		}

		started = true;

		if (invokeActorConstructor()) {
			behaviours.reset(initial);
			LOG.debug("Actor {} started with behaviour {}", self, initial.name());
			runHook(actor::preStart);
		}
	}

	private boolean invokeActorConstructor() {
		try {
			withActiveContext(this, () -> actor = props.newActor());
			initial = requireNonNull(actor.receive(), "Initial behaviour must not be null");
			return true;
		} catch (RuntimeException e) {
			LOG.error("Unable to create actor {}", self, e);
			system.emitEvent(new Failure(self, null, e, FaultDirective.STOP), self);
			stop();
			return false;
		}
	}

	/**
	 * Reset the behaviours to the initial one and run the start hook again. The actor instance is
	 * kept, and so are the messages waiting in the mailbox.
	 *
	 * @param cause the failure which caused restart, or null if restart has been requested
	 */
	void restart(final Throwable cause) {

		if (dead || !started) {
			return;
		}

		LOG.debug("Restarting actor {} with behaviours {}", self, behaviours.names());

		restarting = true;
		try {
			switches.clear();
			runHook(() -> actor.preRestart(cause));
			if (dead) {
				return;
			}
			behaviours.reset(initial);
			runHook(actor::preStart);
		} finally {
			restarting = false;
		}
	}

	static enum DeliveryStatus {
		ACCEPTED,
		REJECTED,
	}

	DeliveryStatus deliver(final Envelope envelope) {

		if (dead) {
			return REJECTED;
		}

		if (envelope.message instanceof Directive) {
			final var directive = (Directive) envelope.message;
			if (directive.mode() == RUN_IMMEDIATELY) {
				processItem(envelope);
				return ACCEPTED;
			}
		}

		inbox.offer(envelope);

		return ACCEPTED;
	}

	static enum ProcessingStatus {
		COMPLETE,
		CONTINUE,
	}

	/**
	 * @param throughput how many items in inbox should be processed
	 * @return Return {@link ProcessingStatus#COMPLETE} if inbox is empty, or
	 *         {@link ProcessingStatus#CONTINUE} otherwise
	 */
	ProcessingStatus process(final int throughput) {

		// Do not process messages from inbox when actor cell has not yet been started. The start
		// directive will activate the cell again.

		if (!started || dead) {
			return COMPLETE;
		}

		for (int i = 0; i < throughput; i++) {

			final var envelope = inbox.poll();
			if (envelope == null) {
				return COMPLETE;
			}

			processItem(envelope);

			if (dead) {
				return COMPLETE;
			}
		}

		return inbox.isEmpty() ? COMPLETE : CONTINUE;
	}

	private void processItem(final Envelope envelope) {

		this.sender = envelope.sender;

		try {
			if (envelope.message instanceof Directive) {
				((Directive) envelope.message).execute(this);
			} else {
				onMessage(envelope.message);
			}
		} finally {
			this.sender = null;
		}
	}

	private void onMessage(final Object message) {

		final Receive receive = behaviours.current();
		final Outcome outcome;

		try {
			outcome = Dispatcher.dispatch(receive, message);
		} catch (RuntimeException | AssertionError e) {
			switches.clear();
			onFailure(message, receive.name(), e);
			return;
		}

		applySwitches();

		if (outcome == Outcome.UNHANDLED) {
			unhandled(message, receive);
		}
	}

	private void runHook(final Runnable hook) {
		try {
			hook.run();
		} catch (RuntimeException | AssertionError e) {
			switches.clear();
			onFailure(null, null, e);
			return;
		}
		applySwitches();
	}

	private void applySwitches() {

		if (dead) {
			switches.clear();
			return;
		}

		for (;;) {
			final var change = switches.poll();
			if (change == null) {
				return;
			}
			change.accept(behaviours);
		}
	}

	/**
	 * @param message the message being processed or null when a lifecycle hook failed
	 * @param behaviour the name of behaviour which processed the message, the stack itself may be
	 *            already cleared when the actor stopped itself before failing
	 * @param cause the failure
	 */
	private void onFailure(final Object message, final String behaviour, final Throwable cause) {

		final var directive = decide(cause);

		if (message == null) {
			LOG.warn("Actor {} failed in lifecycle hook, applying {}", self, directive, cause);
		} else {
			LOG.warn("Actor {} failed to process {} in behaviour {}, applying {}", self, message.getClass().getName(), behaviour, directive, cause);
		}

		system.emitEvent(new Failure(self, message, cause, directive), self);

		switch (directive) {
			case RESTART:
				restart(cause);
				break;
			case STOP:
				stop();
				break;
			case RESUME:
			default:
				break;
		}
	}

	private FaultDirective decide(final Throwable cause) {

		// failure during restart would restart the actor again and again

		if (restarting) {
			return FaultDirective.STOP;
		}

		try {
			return requireNonNull(props.faultPolicy.decide(cause), "Fault directive must not be null");
		} catch (RuntimeException e) {
			LOG.error("Fault policy of actor {} failed", self, e);
			return FaultDirective.STOP;
		}
	}

	private void unhandled(final Object message, final Receive receive) {

		final var policy = unhandledPolicy();

		switch (policy) {
			case PUBLISH:
				LOG.debug("Actor {} did not handle {} in behaviour {}", self, message.getClass().getName(), receive.name());
				if (!(message instanceof Unhandled)) {
					system.emitEvent(new Unhandled(message, self, sender(), receive.name()), self);
				}
				break;
			case LOG:
				LOG.warn("Actor {} did not handle {} in behaviour {}", self, message.getClass().getName(), receive.name());
				break;
			case DEAD_LETTERS:
				system.forwardToDeadLetters(new Envelope(message, self, sender()));
				break;
			case DISCARD:
			default:
				break;
		}
	}

	private UnhandledPolicy unhandledPolicy() {
		if (props.unhandledPolicy == null) {
			return system.configuration.getUnhandledPolicy();
		} else {
			return props.unhandledPolicy;
		}
	}

	@Override
	public void become(final Receive receive) {
		become(receive, true);
	}

	@Override
	public void become(final Receive receive, final boolean discardPrevious) {

		requireNonNull(receive, "Behaviour must not be null");

		switches.add(stack -> {
			stack.become(receive, discardPrevious);
			LOG.debug("Actor {} became {}, depth is {}", self, receive.name(), stack.depth());
		});
	}

	@Override
	public void unbecome() {
		switches.add(stack -> {
			if (stack.unbecome()) {
				LOG.debug("Actor {} reverted to {}, depth is {}", self, stack.current().name(), stack.depth());
			}
		});
	}

	@Override
	public Receive behaviour() {
		return behaviours.current();
	}

	@Override
	public int behaviourDepth() {
		return behaviours.depth();
	}

	BehaviourSnapshot snapshot() {
		return new BehaviourSnapshot(self, behaviours.names());
	}

	/**
	 * Mark cell as stopped so it won't accept more messages. Messages left in the inbox are
	 * forwarded to the dead letters.
	 */
	@Override
	public void stop() {

		if (dead) {
			return;
		}

		dead = true;

		LOG.debug("Stopping actor {}", self);

		invokeActorPostStop();
		discardInbox();

		behaviours.clear();
		switches.clear();
		actor = null;

		system.discard(self.uuid);
	}

	private void invokeActorPostStop() {
		if (actor != null) {
			try {
				actor.postStop();
			} catch (RuntimeException e) {
				LOG.warn("Actor {} failed in post stop", self, e);
			}
		}
	}

	private void discardInbox() {
		for (;;) {
			final var envelope = inbox.poll();
			if (envelope == null) {
				return;
			}
			system.forwardToDeadLetters(envelope);
		}
	}

	@Override
	public <X extends Actor> ActorRef actorOf(final Props<X> props) {
		return system.actorOf(props);
	}

	@Override
	public ActorRef self() {
		return self;
	}

	@Override
	public ActorRef sender() {
		return sender == null ? system.noSender() : sender;
	}

	@Override
	public ActorSystem system() {
		return system;
	}

	@Override
	public long uuid() {
		return self.uuid;
	}

	boolean isDead() {
		return dead;
	}

	void reply(final Object message) {
		sender().tell(message, self);
	}
}
