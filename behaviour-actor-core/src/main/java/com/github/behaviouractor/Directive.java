package com.github.behaviouractor;

import static com.github.behaviouractor.Directive.ExecutionMode.RUN_IMMEDIATELY;


/**
 * A directive is a very special kind of message. It is never dispatched to the actor's behaviours,
 * instead it executes a piece of code directly on the target {@link ActorCell}, by the very same
 * thread that processes ordinary messages. A directive sent to an actor which does not exist or is
 * already dead is dropped, unless the sender waits for its reply, in which case it goes to the
 * dead letters like any other undelivered message.
 */
public interface Directive {

	/**
	 * A execution mode defines how a {@link Directive} should be executed when approved by the
	 * {@link ActorCell}. The execution can be done in two ways. It can either be executed
	 * immediately, or it can wait in the inbox queue for its own turn to be processed.
	 */
	public enum ExecutionMode {

		/**
		 * Run directive immediately.
		 */
		RUN_IMMEDIATELY,

		/**
		 * Put directive at the inbox tail (will be run in the order of messages processing).
		 */
		RUN_IN_ORDER,
	}

	/**
	 * Execute this directive on the {@link ActorCell} provided in the argument. Execution will
	 * always be done by the {@link ActorThread} where given {@link ActorCell} is docked.
	 *
	 * @param cell the {@link ActorCell} to execute this directive on
	 */
	default void execute(final ActorCell<? extends Actor> cell) {
		// do nothing by default, but feel free to override
	}

	/**
	 * @return True if the sender waits for the reply, so the undelivered directive must be reported
	 *         to the dead letters
	 */
	default boolean expectsReply() {
		return false;
	}

	/**
	 * A {@link Directive} can be executed immediately or in the order of incoming messages. The
	 * {@link ExecutionMode#RUN_IMMEDIATELY} mode will cause {@link Directive} to be run
	 * immediately, without moving it to the inbox. The {@link ExecutionMode#RUN_IN_ORDER} will
	 * cause {@link Directive} to be run after messages which came to the {@link ActorCell} first.
	 * Even the immediate directive is never run while the actor is processing a message.
	 *
	 * @return A {@link Directive} execution order
	 */
	default ExecutionMode mode() {
		return RUN_IMMEDIATELY;
	}

	/**
	 * Replies with the {@link com.github.behaviouractor.message.ActorIdentity}.
	 */
	final Directive IDENTIFY = new InternalDirectives.Identify();

	/**
	 * Replies with the {@link com.github.behaviouractor.message.BehaviourSnapshot}.
	 */
	final Directive INSPECT = new InternalDirectives.Inspect();

	/**
	 * Restarts the actor after all messages received before it have been processed.
	 */
	final Directive RESTART = new InternalDirectives.Restart();

	/**
	 * Stops the actor after all messages received before it have been processed.
	 */
	final Directive POISON_PILL = new InternalDirectives.PoisonPill();
}
