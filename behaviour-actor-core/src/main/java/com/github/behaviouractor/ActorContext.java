package com.github.behaviouractor;

/**
 * The actor context representing the {@link ActorCell} this actor is running in. All the methods
 * must be invoked from the actor's own handlers or lifecycle hooks only.
 */
public interface ActorContext {

	/**
	 * Get self actor-reference, i.e. the {@link ActorRef} which can be used to send message to self
	 * (this very {@link Actor}).
	 *
	 * @return Self {@link ActorRef} which can be used to send message to self
	 */
	ActorRef self();

	/**
	 * Get message sender actor-reference, i.e. the {@link ActorRef} which can be used to send
	 * message to actor which sent current message to us.
	 *
	 * @return Sender {@link ActorRef} which can be used to reply to message originator
	 */
	ActorRef sender();

	/**
	 * Spawn new actor from {@link Props}.
	 *
	 * @param <A> the type of the new actor
	 * @param props the {@link Props} object used to create actor
	 * @return The {@link ActorRef} which can be used to send message to newly created actor
	 */
	<A extends Actor> ActorRef actorOf(final Props<A> props);

	/**
	 * Replace the active behaviour. Same as {@code become(receive, true)}.
	 *
	 * @param receive the new behaviour
	 */
	void become(final Receive receive);

	/**
	 * Switch to the new behaviour. The switch takes effect after the currently running handler
	 * returns, before the next message is taken from the mailbox.
	 *
	 * @param receive the new behaviour
	 * @param discardPrevious true to replace the active behaviour, false to stack on top of it
	 */
	void become(final Receive receive, final boolean discardPrevious);

	/**
	 * Revert back to the previous behaviour. Has no effect when only the initial behaviour is
	 * left. Like {@link #become(Receive, boolean)} it takes effect after the handler returns.
	 */
	void unbecome();

	/**
	 * @return The active behaviour, switches requested by the running handler are not yet visible
	 */
	Receive behaviour();

	/**
	 * @return How many behaviours are stacked
	 */
	int behaviourDepth();

	/**
	 * Immediately stops the actor. After the actor is stopped it will not accept any more messages.
	 * Both {@link Actor}, {@link ActorCell} and all corresponding resources will be dereferences
	 * shortly after. This will cause {@link Actor} to be removed from the {@link ActorSystem}.
	 */
	void stop();

	/**
	 * @return The {@link ActorSystem} this {@link Actor} resides in.
	 */
	ActorSystem system();

	long uuid();
}
