package com.github.behaviouractor.message;

import com.github.behaviouractor.ActorRef;


/**
 * Reply to the identify directive.
 */
public class ActorIdentity {

	private final ActorRef ref;

	public ActorIdentity(final ActorRef ref) {
		this.ref = ref;
	}

	public ActorRef getRef() {
		return ref;
	}
}
