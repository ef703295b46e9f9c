package com.github.behaviouractor;

import com.github.behaviouractor.DeadLetters.DeadLetter;
import com.github.behaviouractor.message.Unhandled;


/**
 * What {@link ActorCell} does with a message which has not been matched by the active behaviour.
 * Unhandled message never faults the actor, regardless of the policy.
 */
public enum UnhandledPolicy {

	/**
	 * Emit {@link Unhandled} event into the {@link EventBus}.
	 */
	PUBLISH,

	/**
	 * Log a warning and drop the message.
	 */
	LOG,

	/**
	 * Forward message to the dead letters, it will be emitted as {@link DeadLetter} event.
	 */
	DEAD_LETTERS,

	/**
	 * Drop the message silently.
	 */
	DISCARD,
}
