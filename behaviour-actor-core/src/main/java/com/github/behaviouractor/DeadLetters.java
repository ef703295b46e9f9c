package com.github.behaviouractor;

import com.github.behaviouractor.DeadLetters.DeadLetter;
import com.github.behaviouractor.dsl.Events;


public interface DeadLetters {

	/**
	 * Message which could not be delivered, because the target actor does not exist, has been
	 * stopped, or because it did not handle the message and its {@link UnhandledPolicy} is
	 * {@link UnhandledPolicy#DEAD_LETTERS}.
	 */
	final class DeadLetter {

		private final Object message;
		private final ActorRef target;
		private final ActorRef sender;

		public DeadLetter(final Object message, final ActorRef target, final ActorRef sender) {
			this.message = message;
			this.target = target;
			this.sender = sender;
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
}

class DeadLettersActor extends Actor implements Events {

	@Override
	public Receive receive() {
		return behaviour("dead-letters")
			.match(DeadLetter.class, this::emitEvent)
			.build();
	}
}
