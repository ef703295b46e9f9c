package com.github.behaviouractor;

import static com.github.behaviouractor.ActorSystem.DEFAULT_THREAD_POOL_NAME;
import static java.util.Objects.requireNonNull;


/**
 * This class represents immutable {@link Actor} properties required by the {@link ActorSystem} to
 * construct the {@link Actor} instance and run it. Since this class is immutable, it is thread-safe
 * and can be safely shared between the actors of the actor system and external threads.
 *
 * @param <A> the actor type
 */
public class Props<A extends Actor> {

	public static final int RUN_ON_ANY_THREAD = -1;

	final ActorCreator<A> actorCreator;
	final String threadPool;
	final int threadIndex;
	final UnhandledPolicy unhandledPolicy;
	final FaultPolicy faultPolicy;

	private Props(final ActorCreator<A> creator, final String threadPool, final int threadIndex, final UnhandledPolicy unhandledPolicy, final FaultPolicy faultPolicy) {
		this.actorCreator = creator;
		this.threadPool = threadPool;
		this.threadIndex = threadIndex;
		this.unhandledPolicy = unhandledPolicy;
		this.faultPolicy = faultPolicy;
	}

	public static <A extends Actor> Props<A> create(final ActorCreator<A> creator) {
		return new Props<A>(requireNonNull(creator), DEFAULT_THREAD_POOL_NAME, RUN_ON_ANY_THREAD, null, FaultPolicy.resume());
	}

	public Props<A> inThreadPool(final String threadPool) {
		return new Props<A>(actorCreator, threadPool, threadIndex, unhandledPolicy, faultPolicy);
	}

	public Props<A> onThreadWithIndex(final int threadIndex) {
		return new Props<A>(actorCreator, threadPool, threadIndex, unhandledPolicy, faultPolicy);
	}

	/**
	 * Override the system-wide {@link UnhandledPolicy} for this actor.
	 *
	 * @param unhandledPolicy the policy to use
	 * @return New {@link Props}
	 */
	public Props<A> withUnhandledPolicy(final UnhandledPolicy unhandledPolicy) {
		return new Props<A>(actorCreator, threadPool, threadIndex, requireNonNull(unhandledPolicy), faultPolicy);
	}

	/**
	 * @param faultPolicy the policy to decide what to do when actor fails
	 * @return New {@link Props}
	 */
	public Props<A> withFaultPolicy(final FaultPolicy faultPolicy) {
		return new Props<A>(actorCreator, threadPool, threadIndex, unhandledPolicy, requireNonNull(faultPolicy));
	}

	public A newActor() {
		return actorCreator.create();
	}

	public String getThreadPool() {
		return threadPool;
	}

	public int getThreadIndex() {
		return threadIndex;
	}

	/**
	 * @return The {@link UnhandledPolicy} or null when system default should be used
	 */
	public UnhandledPolicy getUnhandledPolicy() {
		return unhandledPolicy;
	}

	public FaultPolicy getFaultPolicy() {
		return faultPolicy;
	}
}
