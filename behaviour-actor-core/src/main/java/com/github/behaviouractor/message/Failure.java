package com.github.behaviouractor.message;

import com.github.behaviouractor.ActorRef;
import com.github.behaviouractor.FaultDirective;


/**
 * Event emitted when actor failed to process a message or to run one of its lifecycle hooks. The
 * message is null when the failure happened in a hook.
 */
public class Failure {

	private final ActorRef actor;
	private final Object message;
	private final Throwable cause;
	private final FaultDirective directive;

	public Failure(final ActorRef actor, final Object message, final Throwable cause, final FaultDirective directive) {
		this.actor = actor;
		this.message = message;
		this.cause = cause;
		this.directive = directive;
	}

	public ActorRef getActor() {
		return actor;
	}

	public Object getMessage() {
		return message;
	}

	public Throwable getCause() {
		return cause;
	}

	/**
	 * @return What has been done with the failed actor
	 */
	public FaultDirective getDirective() {
		return directive;
	}

	@Override
	public String toString() {
		return new StringBuilder(getClass().getSimpleName())
			.append("[ actor = ")
			.append(actor)
			.append(", cause = ")
			.append(cause)
			.append(", directive = ")
			.append(directive)
			.append(" ]")
			.toString();
	}
}
