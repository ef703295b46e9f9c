package com.github.behaviouractor.message;

import com.github.behaviouractor.ActorRef;


/**
 * Event emitted when the active behaviour of the target actor did not match the message.
 */
public class Unhandled {

	private final Object message;
	private final ActorRef target;
	private final ActorRef sender;
	private final String behaviour;

	public Unhandled(final Object message, final ActorRef target, final ActorRef sender, final String behaviour) {
		this.message = message;
		this.target = target;
		this.sender = sender;
		this.behaviour = behaviour;
	}

	public Object getMessage() {
		return message;
	}

	public ActorRef getTarget() {
		return target;
	}

	public ActorRef getSender() {
		return sender;
	}

	/**
	 * @return Name of the behaviour which was active when message arrived
	 */
	public String getBehaviour() {
		return behaviour;
	}

	@Override
	public String toString() {
		return new StringBuilder(getClass().getSimpleName())
			.append("[ message = ")
			.append(message.getClass().getName())
			.append(", behaviour = ")
			.append(behaviour)
			.append(", from = ")
			.append(sender)
			.append(", to = ")
			.append(target)
			.append(" ]")
			.toString();
	}
}
