package com.github.behaviouractor;

/**
 * Decision taken by the {@link FaultPolicy} after an actor failed to process a message.
 */
public enum FaultDirective {

	/**
	 * Keep the actor and its behaviours as they are and continue with the next message.
	 */
	RESUME,

	/**
	 * Reset behaviours to the initial one and run start hook again.
	 */
	RESTART,

	/**
	 * Stop the actor.
	 */
	STOP,
}
