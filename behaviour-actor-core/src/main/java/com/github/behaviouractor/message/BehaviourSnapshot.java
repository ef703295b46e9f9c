package com.github.behaviouractor.message;

import java.util.List;

import com.github.behaviouractor.ActorRef;


/**
 * Diagnostic view of the actor's behaviour stack taken between two messages.
 */
public class BehaviourSnapshot {

	private final ActorRef actor;
	private final List<String> behaviours;

	public BehaviourSnapshot(final ActorRef actor, final List<String> behaviours) {
		this.actor = actor;
		this.behaviours = List.copyOf(behaviours);
	}

	public ActorRef getActor() {
		return actor;
	}

	/**
	 * @return Name of the active behaviour
	 */
	public String getCurrent() {
		return behaviours.get(0);
	}

	public int getDepth() {
		return behaviours.size();
	}

	/**
	 * @return Names of all stacked behaviours, the active one first
	 */
	public List<String> getBehaviours() {
		return behaviours;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[ actor = " + actor + ", behaviours = " + behaviours + " ]";
	}
}
