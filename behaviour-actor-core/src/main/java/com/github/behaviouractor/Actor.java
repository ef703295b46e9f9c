package com.github.behaviouractor;

/**
 * Base class of all actors. Subclasses declare their initial behaviour in {@link #receive()} and
 * may declare any number of other behaviours (built with {@link #behaviour(String)}) to switch
 * between with {@link ActorContext#become(Receive, boolean)} and {@link ActorContext#unbecome()}.
 */
public abstract class Actor {

	private final ActorContext context = ActorCell.getActiveContext();

	/**
	 * Initial behaviour. Invoked once, when actor is started. The very same {@link Receive}
	 * instance is restored whenever the actor is restarted.
	 *
	 * @return The initial {@link Receive}
	 */
	public Receive receive() {
		return Receive.empty("receive");
	}

	/**
	 * @param name the behaviour name
	 * @return New {@link ReceiveBuilder} to declare behaviour registrations
	 */
	protected ReceiveBuilder behaviour(final String name) {
		return Receive.builder(name);
	}

	public ActorContext context() {
		return context;
	}

	public void preStart() {
		// please override when necessary
	}

	/**
	 * Invoked before the behaviours are reset and {@link #preStart()} is invoked again.
	 *
	 * @param reason the failure which caused restart or null when restart was requested
	 */
	public void preRestart(final Throwable reason) {
		// please override when necessary
	}

	public void postStop() {
		// please override when necessary
	}
}
