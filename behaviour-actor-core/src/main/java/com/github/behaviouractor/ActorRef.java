package com.github.behaviouractor;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

import com.github.behaviouractor.ActorThreadPool.ActorCellInfo;
import com.github.behaviouractor.message.BehaviourSnapshot;


/**
 * The class representing the basic actor communication channel.
 */
public class ActorRef {

	final ActorSystem system;
	final ActorThread thread;
	final long uuid;

	ActorRef(final ActorSystem system, final ActorCellInfo info) {
		this.system = system;
		this.thread = info.thread;
		this.uuid = info.uuid;
	}

	public long uuid() {
		return uuid;
	}

	/**
	 * @return The {@link ActorThread} the target cell is docked on or null for no-sender reference
	 */
	ActorThread thread() {
		return thread;
	}

	/**
	 * Send message to the actor represented by this actor-reference. Use no-sender actor-reference
	 * as the sender. Recipient will be unable to reply to this message. Or to be more clear - it
	 * can reply, but the replied message will be forwarded to dead-letters.
	 *
	 * @param message the message
	 */
	public void tell(final Object message) {
		tell(message, system.noSender());
	}

	public void tell(final Object message, final ActorRef sender) {
		system.tell(message, this, sender);
	}

	public <R> CompletionStage<R> ask(final Object message) {
		return system.ask(message, this);
	}

	/**
	 * @return Completion stage with the snapshot of the actor's behaviour stack
	 */
	public CompletionStage<BehaviourSnapshot> inspect() {
		return system.inspect(this);
	}

	@Override
	public String toString() {
		return "ba://" + system.getName() + "/" + uuid;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + system.name.hashCode();
		result = prime * result + Long.hashCode(uuid);
		return result;
	}

	@Override
	public boolean equals(Object obj) {

		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}

		return equals0((ActorRef) obj);
	}

	private boolean equals0(final ActorRef ref) {
		return Objects.equals(system.name, ref.system.name) && uuid == ref.uuid;
	}
}
