package com.github.behaviouractor;

import static com.github.behaviouractor.Props.RUN_ON_ANY_THREAD;

import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Named group of {@link ActorThread}s. Cells created with {@link Props#inThreadPool(String)} are
 * docked on one of these threads for their whole life. Unless given explicitly, the number of
 * threads is taken from the system configuration when the pool is started.
 */
public class ActorThreadPool extends ThreadGroup {

	private static final Logger LOG = LoggerFactory.getLogger(ActorThreadPool.class);

	/**
	 * Take the parallelism from {@link ActorSystem.Configuration}.
	 */
	public static final int CONFIGURED_PARALLELISM = 0;

	private final ActorThreadFactory factory;
	private final AtomicInteger shift = new AtomicInteger(0);
	private final int requested;

	private int parallelism;
	private ActorThread[] threads;

	public ActorThreadPool(final String name) {
		this(name, CONFIGURED_PARALLELISM);
	}

	public ActorThreadPool(final String name, final int parallelism) {
		super(name);
		if (parallelism < 0) {
			throw new IllegalArgumentException("Parallelism must not be negative, got " + parallelism);
		}
		this.factory = new ActorThreadFactory(name);
		this.requested = parallelism;
	}

	void start(final ActorSystem system) {

		if (threads != null) {
			throw new IllegalStateException("Thread pool " + getName() + " has already been started");
		}

		this.parallelism = requested == CONFIGURED_PARALLELISM
			? system.configuration.getParallelism()
			: requested;
		this.threads = new ActorThread[parallelism];

		for (int index = 0; index < parallelism; index++) {
			threads[index] = factory.newThread(this, system, index);
		}
		for (final var thread : threads) {
			thread.start();
		}

		LOG.debug("Thread pool {} started with {} thread(s)", getName(), parallelism);
	}

	/**
	 * @return Number of threads, zero until the pool is started
	 */
	public int getParallelism() {
		return parallelism;
	}

	/**
	 * @return Threads of this pool in index order, null until the pool is started
	 */
	ActorThread[] getThreads() {
		return threads;
	}

	public Shutdown shutdown() {
		return new Shutdown().execute();
	}

	ActorCellInfo prepareCellInfo(final ActorSystem system, final Props<? extends Actor> props) {

		if (threads == null) {
			throw new IllegalStateException("Thread pool " + getName() + " has not been started");
		}

		final var uuid = system.generateNextUuid();
		final var index = getThreadIndex(props);
		final var thread = threads[index];

		return new ActorCellInfo(this, thread, uuid);
	}

	private int getThreadIndex(final Props<? extends Actor> props) {

		final var i = props.threadIndex;
		final var p = parallelism;

		if (i == RUN_ON_ANY_THREAD) {
			return Math.floorMod(shift.getAndIncrement(), p);
		} else {
			return i % p;
		}
	}

	static class ActorCellInfo {

		final ActorThreadPool pool;
		final ActorThread thread;
		final long uuid;

		public ActorCellInfo(final ActorThreadPool pool, final ActorThread thread, final long uuid) {
			this.pool = pool;
			this.thread = thread;
			this.uuid = uuid;
		}

		public ActorThreadPool getPool() {
			return pool;
		}

		public String getPoolName() {
			return pool.getName();
		}

		public int getThreadIndex() {
			return thread.index;
		}

		public long getUuid() {
			return uuid;
		}

		@Override
		public String toString() {
			return new StringBuilder()
				.append(getClass().getSimpleName())
				.append("[ pool = ")
				.append(getPoolName())
				.append(", thread = ")
				.append(thread.getName())
				.append(", index = ")
				.append(thread.index)
				.append(", uuid = ")
				.append(uuid)
				.append(" ]")
				.toString();
		}
	}

	public class Shutdown {

		public Shutdown execute() {
			if (threads == null) {
				return this;
			}
			for (final var thread : threads) {
				thread.interrupt();
			}
			return this;
		}

		public void awaitTermination() {
			if (threads == null) {
				return;
			}
			try {
				for (final var thread : threads) {
					thread.join();
				}
				LOG.debug("Thread pool {} terminated", getName());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
	}
}
