package com.github.behaviouractor;

import static com.github.behaviouractor.ActorCell.DeliveryStatus.ACCEPTED;
import static com.github.behaviouractor.ActorCell.ProcessingStatus.COMPLETE;
import static com.github.behaviouractor.ActorSystem.ZERO_UUID;
import static java.util.concurrent.locks.LockSupport.unpark;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;

import org.jctools.maps.NonBlockingHashMapLong;
import org.jctools.queues.MpscUnboundedArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;


/**
 * Worker thread running the docked {@link ActorCell}s. A cell is docked on exactly one thread for
 * its whole life, which makes this thread the only one ever touching the cell's mailbox, actor and
 * behaviours.
 */
public class ActorThread extends Thread {

	private static final Logger LOG = LoggerFactory.getLogger(ActorThread.class);

	/**
	 * How many idle loops {@link ActorThread} should perform before thread is parked.
	 */
	static final int MAX_IDLE_LOOPS_COUNT = 1024;

	/**
	 * Upper bound of a single park, a missed wake up cannot delay delivery more than that.
	 */
	static final long PARK_NANOS = Duration.ofMillis(100).toNanos();

	/**
	 * Mapping between cell UUID and corresponding {@link ActorCell} instance.
	 */
	final NonBlockingHashMapLong<ActorCell<? extends Actor>> dockedCells = new NonBlockingHashMapLong<>();

	/**
	 * The active cells are the ones which have at least one message in the inbox. This map is not
	 * thread-safe, so please do not use outside the {@link ActorThread} it's referenced on.
	 */
	final Long2ObjectOpenHashMap<ActorCell<? extends Actor>> activeCells = new Long2ObjectOpenHashMap<>();

	/**
	 * Queue to store messages from cells docked on this thread (internal communication).
	 */
	final Queue<Envelope> internalQueue = new ArrayDeque<>();

	/**
	 * Queue to store messages from cells docked on other threads (interthread communication).
	 */
	final MpscUnboundedArrayQueue<Envelope> externalQueue = new MpscUnboundedArrayQueue<>(4096);

	final AtomicBoolean parked = new AtomicBoolean(false);

	/**
	 * The {@link ActorSystem} this {@link ActorThread} lives in.
	 */
	final ActorSystem system;

	/**
	 * The {@link ActorThreadPool} stores {@link ActorThread} instances in the array. This is a
	 * positional index of this {@link ActorThread} in the array.
	 */
	final int index;

	/**
	 * How many messages should be processed by a single actor before moving to the next one.
	 */
	final int throughput;

	ActorThread(final ThreadGroup group, final ActorSystem system, final String name, final int index) {
		super(group, name);
		this.system = system;
		this.index = index;
		this.throughput = system.configuration.getThroughput();
	}

	@Override
	public void run() {
		LOG.debug("Thread {} started", getName());
		try {
			onRun();
		} finally {
			onComplete();
		}
	}

	private void onRun() {

		final var queue = new ArrayDeque<Envelope>();
		final var idler = new IdleLoopCounter(MAX_IDLE_LOOPS_COUNT);

		while (!isInterrupted()) {

			// move external messages to the temporary queue to avoid contention
			// move internal messages to the temporary queue to avoid concurrent modification

			var busy = 0;

			busy += drain(externalQueue, queue);
			busy += drain(internalQueue, queue);
			deliver(queue);
			busy += process();

			if (busy == 0) {
				if (idler.shouldBeParked()) {
					park();
				} else {
					Thread.onSpinWait();
				}
			} else {
				idler.reset();
			}
		}
	}

	private void park() {

		parked.set(true);

		if (externalQueue.isEmpty() && internalQueue.isEmpty()) {
			LockSupport.parkNanos(this, PARK_NANOS);
		}

		parked.set(false);
	}

	private static <T> int drain(final Queue<T> source, final Queue<T> target) {
		int count = 0;
		for (;;) {
			final T element = source.poll();
			if (element == null) {
				return count;
			}
			if (target.offer(element)) {
				count++;
			}
		}
	}

	private void deliver(final Queue<Envelope> queue) {
		for (;;) {

			final var envelope = queue.poll();
			if (envelope == null) {
				return;
			}

			final var uuid = envelope.target.uuid;
			if (uuid == ZERO_UUID) {
				system.forwardToDeadLetters(envelope);
				continue;
			}

			deliver(envelope, uuid);
		}
	}

	private void deliver(final Envelope envelope, final long uuid) {

		var cell = activeCells.get(uuid);

		if (cell == null) {
			cell = dockedCells.get(uuid);
		}
		if (cell == null) {
			system.forwardToDeadLetters(envelope);
			return;
		}

		if (cell.deliver(envelope) == ACCEPTED) {
			activeCells.put(uuid, cell);
		} else {
			system.forwardToDeadLetters(envelope);
		}
	}

	/**
	 * Iterates over the active cells and process up to {@link #throughput} messages. When inbox is
	 * empty after processing completion, the cell becomes inactive and can be removed from the
	 * active cells map.
	 */
	private int process() {

		final var iterator = activeCells.values().iterator();

		var i = 0;

		while (iterator.hasNext()) {

			final var cell = iterator.next();

			try {
				if (cell.process(throughput) == COMPLETE) {
					iterator.remove();
				} else {
					i++; // more iterations required
				}
			} catch (RuntimeException e) {
				LOG.error("Unexpected failure of cell {} on thread {}, cell is deactivated", cell.self(), getName(), e);
				iterator.remove();
			}
		}

		return i;
	}

	public void dock(final ActorCell<? extends Actor> cell) {

		final var uuid = cell.uuid();
		final var overwritten = dockedCells.putIfAbsent(uuid, cell) != null;

		if (overwritten) {
			throw new IllegalStateException("Cell with ID " + uuid + " already docked on thread " + getName());
		}
	}

	/**
	 * Undock cell with a given ID from this {@link ActorThread}. If the cell was active this
	 * operation will not make it inactive, it is removed from active cells after it reports
	 * processing completion.
	 *
	 * @param uuid the {@link ActorCell} ID
	 * @return The removed {@link ActorCell} or null when no cell with a given ID was docked here
	 */
	public ActorCell<? extends Actor> remove(final long uuid) {
		return dockedCells.remove(uuid);
	}

	/**
	 * Deposit envelope with a message into the queue. This method will wake up the
	 * {@link ActorThread} if it was parked.
	 *
	 * @param envelope the envelope with message
	 */
	void deposit(final Envelope envelope) {
		if (this == currentThread()) {
			internalQueue.offer(envelope);
		} else {
			externalQueue.offer(envelope);
			wakeUp();
		}
	}

	private void wakeUp() {
		if (parked.compareAndSet(true, false)) {
			unpark(this);
		}
	}

	private void onComplete() {
		LOG.debug("Thread {} completed", getName());
	}

	/**
	 * Counts idle loops to decide if {@link ActorThread} should be parked. The thread is not
	 * parked immediately after it's free, but only after it burned
	 * {@value ActorThread#MAX_IDLE_LOOPS_COUNT} idle loops, because unparking is expensive.
	 */
	private static class IdleLoopCounter {

		final int max;
		int counter;

		IdleLoopCounter(final int max) {
			this.max = max;
		}

		void reset() {
			counter = 0;
		}

		boolean shouldBeParked() {
			if (++counter < max) {
				return false;
			}
			counter = 0;
			return true;
		}
	}
}
