package com.github.behaviouractor;

class Envelope {

	/**
	 * Value to be delivered.
	 */
	final Object message;

	/**
	 * Target reference.
	 */
	final ActorRef target;

	/**
	 * Sender reference.
	 */
	final ActorRef sender;

	Envelope(final Object message, final ActorRef target, final ActorRef sender) {
		this.message = message;
		this.target = target;
		this.sender = sender;
	}

	@Override
	public String toString() {
		return new StringBuilder(getClass().getSimpleName())
			.append("[ message = ")
			.append(message.getClass().getName())
			.append(", from = ")
			.append(sender)
			.append(", to = ")
			.append(target)
			.append(" ]")
			.toString();
	}
}
