package com.github.behaviouractor.util;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.github.behaviouractor.Actor;
import com.github.behaviouractor.ActorRef;
import com.github.behaviouractor.ActorSystem;
import com.github.behaviouractor.EventBus;
import com.github.behaviouractor.EventBus.SubscribeAck;
import com.github.behaviouractor.Props;
import com.github.behaviouractor.Receive;
import com.github.behaviouractor.message.BehaviourSnapshot;


/**
 * Test helper which collects everything sent to {@link #ref()} in a blocking queue read from the
 * test thread. It also subscribes to the event bus and looks into the behaviour stacks of other
 * actors. All waiting methods fail with {@link AssertionError} when the time is up.
 */
public class Probe {

	private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3);
	private static final Duration INSPECT_INTERVAL = Duration.ofMillis(10);

	final BlockingQueue<Object> messages = new LinkedBlockingQueue<>();
	final ActorSystem system;
	final ActorRef ref;

	public Probe(final ActorSystem system) {
		this.system = system;
		this.ref = system.actorOf(Props.create(ProbeActor::new));
	}

	/**
	 * @return {@link ActorRef} to be used to receive messages
	 */
	public ActorRef ref() {
		return ref;
	}

	/**
	 * Subscribe this probe to events of a given type and wait for the acknowledgement, so events
	 * emitted after this method returns are received.
	 *
	 * @param type the event type
	 */
	public void subscribe(final Class<?> type) {
		system
			.refForEventBus()
			.tell(new EventBus.Subscribe(type, ref), ref);
		receiveInstanceOf(SubscribeAck.class);
	}

	/**
	 * Take a snapshot of actor's behaviour stack after it processed messages sent to it before.
	 *
	 * @param target the actor to inspect
	 * @return The {@link BehaviourSnapshot}
	 */
	public BehaviourSnapshot inspect(final ActorRef target) {
		try {
			return system
				.inspect(target)
				.toCompletableFuture()
				.get(DEFAULT_TIMEOUT.toMillis(), MILLISECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException(e);
		} catch (ExecutionException e) {
			throw new AssertionError("Unable to inspect " + target, e.getCause());
		} catch (TimeoutException e) {
			throw new AssertionError("Inspection of " + target + " timed out", e);
		}
	}

	/**
	 * Wait until the behaviour with a given name is on top of the actor's stack.
	 *
	 * @param target the actor to watch
	 * @param behaviour the expected behaviour name
	 * @return The first {@link BehaviourSnapshot} with the expected behaviour on top
	 */
	public BehaviourSnapshot awaitBehaviour(final ActorRef target, final String behaviour) {

		final var deadline = System.nanoTime() + DEFAULT_TIMEOUT.toNanos();

		for (;;) {

			final var snapshot = inspect(target);

			if (behaviour.equals(snapshot.getCurrent())) {
				return snapshot;
			}
			if (System.nanoTime() > deadline) {
				throw new AssertionError("Expected behaviour " + behaviour + " but stack of " + target + " is " + snapshot.getBehaviours());
			}

			sleep(INSPECT_INTERVAL);
		}
	}

	public <T> T receiveInstanceOf(final Class<T> clazz) {
		return receiveInstanceOf(clazz, DEFAULT_TIMEOUT);
	}

	public <T> T receiveInstanceOf(final Class<T> clazz, final Duration duration) {
		return cast(receive(duration), clazz);
	}

	public <T> List<T> receiveNInstanceOf(final int n, final Class<T> clazz) {

		final List<T> received = new ArrayList<>(n);

		for (final Object message : receiveN(n, DEFAULT_TIMEOUT)) {
			received.add(cast(message, clazz));
		}

		return received;
	}

	public List<Object> receiveN(final int n) {
		return receiveN(n, DEFAULT_TIMEOUT);
	}

	/**
	 * Receive N messages, all of them within a given {@link Duration}.
	 *
	 * @param n the number of messages to be received
	 * @param duration the max time to wait for all messages
	 * @return The {@link List} of messages in the order of arrival
	 */
	public List<Object> receiveN(final int n, final Duration duration) {

		final var deadline = System.nanoTime() + duration.toNanos();
		final List<Object> received = new ArrayList<>(n);

		while (received.size() < n) {
			final var left = deadline - System.nanoTime();
			final var message = poll(left, NANOSECONDS);
			if (message == null) {
				throw new AssertionError("Received " + received.size() + " of " + n + " messages in " + duration);
			}
			received.add(message);
		}

		return received;
	}

	public Object receive() {
		return receive(DEFAULT_TIMEOUT);
	}

	public Object receive(final Duration duration) {

		final Object received = poll(duration.toMillis(), MILLISECONDS);

		if (received == null) {
			throw new AssertionError("Receive duration " + duration + " has been exceeded");
		}

		return received;
	}

	/**
	 * Make sure nothing arrives within a given {@link Duration}.
	 *
	 * @param duration how long to wait
	 */
	public void expectNoMessage(final Duration duration) {

		final Object received = poll(duration.toMillis(), MILLISECONDS);

		if (received != null) {
			throw new AssertionError("Expected no message but got " + received);
		}
	}

	private Object poll(final long timeout, final TimeUnit unit) {
		try {
			return messages.poll(Math.max(0, timeout), unit);
		} catch (InterruptedException e) {
			throw new IllegalStateException(e);
		}
	}

	private static void sleep(final Duration duration) {
		try {
			Thread.sleep(duration.toMillis());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException(e);
		}
	}

	@SuppressWarnings("unchecked")
	private static <T> T cast(final Object received, final Class<T> clazz) {
		if (clazz.isInstance(received)) {
			return (T) received;
		} else {
			throw new AssertionError("Expected message of " + clazz + " but got " + received.getClass());
		}
	}

	class ProbeActor extends Actor {

		@Override
		public Receive receive() {
			return behaviour("probe")
				.matchAny(messages::offer)
				.build();
		}
	}
}
