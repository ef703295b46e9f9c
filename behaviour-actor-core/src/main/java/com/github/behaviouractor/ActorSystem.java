package com.github.behaviouractor;

import static java.util.Objects.requireNonNull;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import org.jctools.maps.NonBlockingHashMapLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.behaviouractor.ActorThreadPool.ActorCellInfo;
import com.github.behaviouractor.AskRouter.Ask;
import com.github.behaviouractor.DeadLetters.DeadLetter;
import com.github.behaviouractor.message.BehaviourSnapshot;


public class ActorSystem {

	private static final Logger LOG = LoggerFactory.getLogger(ActorSystem.class);

	/**
	 * Non-existing UUID.
	 */
	public static final long ZERO_UUID = 0;

	public static final String DEFAULT_THREAD_POOL_NAME = "default-thread-pool";

	final Map<String, ActorThreadPool> pools = new HashMap<>(1);
	final NonBlockingHashMapLong<ActorCellInfo> cells = new NonBlockingHashMapLong<>();
	final ActorRef zero = new ActorRef(this, new ActorCellInfo(null, null, ZERO_UUID));
	final AtomicLong uuidGenerator = new AtomicLong(0);

	final String name;
	final Configuration configuration;

	private volatile InternalActors internal;

	public ActorSystem(final String name, final Configuration configuration) {
		this.name = requireNonNull(name, "Actor system name must not be null");
		this.configuration = requireNonNull(configuration, "Configuration must not be null");
	}

	public static ActorSystem create(final String name) {
		return create(name, new Configuration());
	}

	public static ActorSystem create(final String name, final Configuration configuration) {
		return new ActorSystem(name, configuration)
			.withPool(new ActorThreadPool(DEFAULT_THREAD_POOL_NAME))
			.start();
	}

	public ActorSystem start() {

		for (final var pool : pools.values()) {
			pool.start(this);
		}

		internal = new InternalActors();

		LOG.debug("Actor system {} started with {} pool(s)", name, pools.size());

		return this;
	}

	public String getName() {
		return name;
	}

	public Configuration getConfiguration() {
		return configuration;
	}

	public ActorSystem withPool(final ActorThreadPool pool) {

		if (pool == null) {
			throw new IllegalArgumentException("Pool must not be null");
		}
		if (pools.putIfAbsent(pool.getName(), pool) != null) {
			throw new IllegalArgumentException("Pool with name " + pool.getName() + " already exists in this actor system");
		}

		return this;
	}

	/**
	 * Public actor creation facility. System consumers should use this method to spawn new actors.
	 *
	 * @param <A> the actor class.
	 * @param props the actor {@link Props}
	 * @return New {@link ActorRef} which should be used to communicate with the actor
	 */
	public <A extends Actor> ActorRef actorOf(final Props<A> props) {

		final var pool = getPoolFor(props).orElseThrow(poolNotFoundError(props));
		final var info = pool.prepareCellInfo(this, props);
		final var cell = new ActorCell<A>(this, props, info);
		final var uuid = info.uuid;

		if (cells.putIfAbsent(uuid, info) != null) {
			throw new IllegalStateException("Cell with ID " + uuid + " already exists in the system");
		}

		info.thread.dock(cell);

		return cell.setup();
	}

	/**
	 * Return the {@link ActorRef} if the actor with a given uuid exists in the actor system,
	 * otherwise return dead letters reference.
	 *
	 * @param uuid the actor uuid
	 * @return {@link ActorRef} of the actor or dead letters
	 */
	public ActorRef find(final long uuid) {
		return getDockingInfoFor(uuid)
			.map(info -> new ActorRef(this, info))
			.orElse(refForDeadLetters());
	}

	/**
	 * @param ref the actor reference
	 * @return True if actor has not been stopped yet
	 */
	public boolean isAlive(final ActorRef ref) {
		return cells.containsKey(ref.uuid);
	}

	void discard(final long uuid) {

		final var info = getDockingInfoFor(uuid).orElseThrow(cellNotFoundError(uuid));

		info.thread.remove(uuid);
		cells.remove(uuid);
	}

	long generateNextUuid() {
		return uuidGenerator.incrementAndGet();
	}

	/**
	 * Send and forget. The {@link #noSender()} is used as a sender so if the target actor replies
	 * the reply will be delivered to the dead-letters.
	 *
	 * @param message the message
	 * @param target the target {@link ActorRef}
	 */
	public void tell(final Object message, final ActorRef target) {
		tell(message, target, noSender());
	}

	/**
	 * Send and forget. Messages sent by the same sender to the same target are delivered in the
	 * order they were sent.
	 *
	 * @param message the message
	 * @param target the target {@link ActorRef}
	 * @param sender the sender {@link ActorRef}
	 */
	public void tell(final Object message, final ActorRef target, final ActorRef sender) {

		requireNonNull(message, "Message must not be null");

		final var envelope = new Envelope(message, target, sender);
		final var thread = target.thread();

		if (thread == null) {
			forwardToDeadLetters(envelope);
		} else {
			thread.deposit(envelope);
		}
	}

	public <R> CompletionStage<R> ask(final Object message, final ActorRef target) {

		final var ask = new Ask<R>(message, target);

		tell(ask, refForAskRouter());

		return ask.completion;
	}

	/**
	 * Take a snapshot of the actor's behaviour stack. The snapshot is taken after all messages sent
	 * to the actor before are processed.
	 *
	 * @param target the actor to inspect
	 * @return Completion stage with {@link BehaviourSnapshot}
	 */
	public CompletionStage<BehaviourSnapshot> inspect(final ActorRef target) {
		return ask(Directive.INSPECT, target);
	}

	void forwardToDeadLetters(final Envelope envelope) {

		final var message = envelope.message;

		final var actors = internal;

		if (actors == null || message instanceof DeadLetter || isDroppable(message)) {
			LOG.debug("Dropping undeliverable {}", envelope);
			return;
		}

		actors.deadLetters.tell(new DeadLetter(message, envelope.target, envelope.sender));
	}

	private static boolean isDroppable(final Object message) {
		return message instanceof Directive && !((Directive) message).expectsReply();
	}

	public void emitEvent(final Object event) {
		emitEvent(event, noSender());
	}

	public void emitEvent(final Object event, final ActorRef emitter) {
		final var msg = new EventBus.Event(event, emitter);
		final var bus = refForEventBus();
		tell(msg, bus, emitter);
	}

	/**
	 * Stops the actor pointed by the {@link ActorRef} provided in the argument. This is
	 * asynchronous operation and therefore actor may be still alive when this method completes.
	 * Messages which are waiting in the actor's mailbox are forwarded to the dead letters.
	 *
	 * @param target the target to be stopped
	 */
	public void stop(final ActorRef target) {
		tell(InternalDirectives.STOP, target, noSender());
	}

	/**
	 * Restarts the actor pointed by the {@link ActorRef} provided in the argument. Restart happens
	 * after all messages sent to this actor before are processed. The actor is brought back to its
	 * initial behaviour and its start hook is invoked again.
	 *
	 * @param target the target to be restarted
	 */
	public void restart(final ActorRef target) {
		tell(Directive.RESTART, target, noSender());
	}

	private Optional<ActorCellInfo> getDockingInfoFor(final long uuid) {
		return Optional.ofNullable(cells.get(uuid));
	}

	private Optional<ActorThreadPool> getPoolFor(final Props<? extends Actor> props) {
		return Optional.ofNullable(pools.get(props.getThreadPool()));
	}

	private static Supplier<RuntimeException> poolNotFoundError(final Props<? extends Actor> props) {
		return () -> new IllegalStateException("Thread pool with name " + props.getThreadPool() + " has not been found in the system");
	}

	private static Supplier<RuntimeException> cellNotFoundError(final long uuid) {
		return () -> new IllegalStateException("Cell with UUID " + uuid + " has not been found in the system");
	}

	public ActorRef refForAskRouter() {
		return internal.askRouter;
	}

	public ActorRef refForDeadLetters() {
		return internal.deadLetters;
	}

	public ActorRef refForEventBus() {
		return internal.eventBus;
	}

	public ActorRef noSender() {
		return zero;
	}

	public void shutdown() {

		pools
			.values()
			.stream()
			.map(ActorThreadPool::shutdown)
			.forEach(ActorThreadPool.Shutdown::awaitTermination);

		LOG.debug("Actor system {} has been shut down", name);
	}

	class InternalActors {

		final ActorRef deadLetters;
		final ActorRef eventBus;
		final ActorRef askRouter;

		InternalActors() {

			final var bus = actorOf(Props.create(EventBusActor::new));

			this.eventBus = bus;
			this.deadLetters = actorOf(Props.create(DeadLettersActor::new));
			this.askRouter = actorOf(Props.create(() -> new AskRouter(bus)));
		}
	}

	public static class Configuration {

		/**
		 * Default throughput (up to how many messages to process from the same actor before
		 * switching to the next one).
		 */
		public static final int DEFAULT_THROUGHPUT = 100;

		public static final int DEFAULT_PARALLELISM = Runtime.getRuntime().availableProcessors();

		public static final UnhandledPolicy DEFAULT_UNHANDLED_POLICY = UnhandledPolicy.PUBLISH;

		private int throughput = DEFAULT_THROUGHPUT;
		private int parallelism = DEFAULT_PARALLELISM;
		private UnhandledPolicy unhandledPolicy = DEFAULT_UNHANDLED_POLICY;

		public int getThroughput() {
			return throughput;
		}

		public void setThroughput(final int throughput) {
			if (throughput < 1) {
				throw new IllegalArgumentException("Throughput must be positive, got " + throughput);
			}
			this.throughput = throughput;
		}

		public int getParallelism() {
			return parallelism;
		}

		public void setParallelism(final int parallelism) {
			if (parallelism < 1) {
				throw new IllegalArgumentException("Parallelism must be positive, got " + parallelism);
			}
			this.parallelism = parallelism;
		}

		/**
		 * @return What to do with messages the actors did not handle, unless overridden in
		 *         {@link Props}
		 */
		public UnhandledPolicy getUnhandledPolicy() {
			return unhandledPolicy;
		}

		public void setUnhandledPolicy(final UnhandledPolicy unhandledPolicy) {
			this.unhandledPolicy = requireNonNull(unhandledPolicy, "Unhandled policy must not be null");
		}
	}
}
