package com.github.behaviouractor;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.behaviouractor.dsl.Base;
import com.github.behaviouractor.dsl.Behaviours;
import com.github.behaviouractor.util.Probe;


public class BehaviourSwitchingTest {

	static final String SWITCH = "switch";
	static final String PUSH = "push";
	static final String POP = "pop";
	static final String FAIL = "fail";

	ActorSystem system;
	Probe probe;

	@BeforeEach
	public void setup() {
		system = ActorSystem.create("BehaviourSwitchingTest");
		probe = new Probe(system);
	}

	@AfterEach
	public void teardown() {
		system.shutdown();
	}

	static class SwitchingActor extends Actor implements Base, Behaviours {

		final AtomicInteger starts;
		int handled = 0;

		final Receive stacked = behaviour("stacked")
			.matchEquals(PUSH, this::onPush)
			.matchEquals(POP, this::onPop)
			.match(String.class, s -> reply("stacked:" + s + ":" + ++handled))
			.build();

		final Receive other = behaviour("other")
			.matchEquals(PUSH, this::onPush)
			.matchEquals(POP, this::onPop)
			.match(String.class, s -> reply("other:" + s + ":" + ++handled))
			.build();

		SwitchingActor(final AtomicInteger starts) {
			this.starts = starts;
		}

		@Override
		public void preStart() {
			starts.incrementAndGet();
		}

		@Override
		public Receive receive() {
			return behaviour("initial")
				.matchEquals(SWITCH, this::onSwitch)
				.matchEquals(PUSH, this::onPush)
				.matchEquals(POP, this::onPop)
				.matchEquals(FAIL, this::onFail)
				.match(String.class, s -> reply("initial:" + s + ":" + ++handled))
				.build();
		}

		private void onSwitch(final String s) {
			become(other);
			reply(context().behaviour().name());
		}

		private void onPush(final String s) {
			becomeStacked(stacked);
		}

		private void onPop(final String s) {
			unbecome();
		}

		private void onFail(final String s) {
			become(other);
			throw new IllegalStateException("requested failure");
		}
	}

	private ActorRef newSwitchingActor(final AtomicInteger starts) {
		return system.actorOf(Props.create(() -> new SwitchingActor(starts)));
	}

	@Test
	public void test_startsWithInitialBehaviour() throws Exception {

		final var ref = newSwitchingActor(new AtomicInteger());
		final var snapshot = probe.inspect(ref);

		assertEquals("initial", snapshot.getCurrent());
		assertEquals(1, snapshot.getDepth());
		assertEquals(ref, snapshot.getActor());
	}

	@Test
	public void test_becomeTakesEffectAfterHandlerReturns() {

		final var ref = newSwitchingActor(new AtomicInteger());

		ref.tell(SWITCH, probe.ref());
		ref.tell("hello", probe.ref());

		assertEquals("initial", probe.receive());
		assertEquals("other:hello:1", probe.receive());
	}

	@Test
	public void test_becomeDiscardingKeepsDepth() throws Exception {

		final var ref = newSwitchingActor(new AtomicInteger());

		ref.tell(SWITCH, probe.ref());
		probe.receive();

		final var snapshot = probe.inspect(ref);

		assertEquals("other", snapshot.getCurrent());
		assertEquals(1, snapshot.getDepth());
	}

	@Test
	public void test_stackedBecomeAndUnbecome() throws Exception {

		final var ref = newSwitchingActor(new AtomicInteger());

		ref.tell(PUSH);
		ref.tell(PUSH);

		assertEquals(List.of("stacked", "stacked", "initial"), probe.inspect(ref).getBehaviours());

		ref.tell("a", probe.ref());
		assertEquals("stacked:a:1", probe.receive());

		ref.tell(POP);
		ref.tell(POP);

		assertEquals(List.of("initial"), probe.inspect(ref).getBehaviours());

		ref.tell("b", probe.ref());
		assertEquals("initial:b:2", probe.receive());
	}

	@Test
	public void test_unbecomeOnInitialIsIgnored() throws Exception {

		final var ref = newSwitchingActor(new AtomicInteger());

		ref.tell(POP);
		ref.tell(POP);
		ref.tell(POP);

		final var snapshot = probe.inspect(ref);

		assertEquals("initial", snapshot.getCurrent());
		assertEquals(1, snapshot.getDepth());
	}

	@Test
	public void test_failedHandlerDropsRequestedSwitches() throws Exception {

		final var ref = newSwitchingActor(new AtomicInteger());

		ref.tell(FAIL);
		ref.tell("x", probe.ref());

		assertEquals("initial:x:1", probe.receive());
		assertEquals("initial", probe.inspect(ref).getCurrent());
	}

	@Test
	public void test_restartResetsToInitialBehaviourAndKeepsState() throws Exception {

		final var starts = new AtomicInteger();
		final var ref = newSwitchingActor(starts);

		await().untilAtomic(starts, is(1));

		ref.tell("a", probe.ref());
		assertEquals("initial:a:1", probe.receive());

		ref.tell(PUSH);
		ref.tell(PUSH);
		ref.tell(PUSH);

		assertEquals(4, probe.inspect(ref).getDepth());

		system.restart(ref);

		final var snapshot = probe.inspect(ref);

		assertEquals("initial", snapshot.getCurrent());
		assertEquals(1, snapshot.getDepth());
		assertEquals(2, starts.get());

		// actor fields are not touched by the restart

		ref.tell("b", probe.ref());
		assertEquals("initial:b:2", probe.receive());
	}

	@Test
	public void test_restartAfterDiscardingBecomeBringsBackInitialInstance() throws Exception {

		final var ref = newSwitchingActor(new AtomicInteger());

		ref.tell(SWITCH, probe.ref());
		probe.receive();

		system.restart(ref);

		ref.tell("c", probe.ref());
		assertEquals("initial:c:1", probe.receive());
	}

	@Test
	public void test_becomeInPreStartAppliedBeforeFirstMessage() {

		class EagerActor extends Actor implements Base, Behaviours {

			@Override
			public void preStart() {
				becomeStacked(behaviour("ready")
					.matchAny(m -> reply("ready"))
					.build());
			}

			@Override
			public Receive receive() {
				return behaviour("waiting")
					.matchAny(m -> reply("waiting"))
					.build();
			}
		}

		final var ref = system.actorOf(Props.create(EagerActor::new));

		ref.tell("anything", probe.ref());

		assertEquals("ready", probe.receive());
	}

	@Test
	public void test_identify() {

		final var ref = newSwitchingActor(new AtomicInteger());

		ref.tell(Directive.IDENTIFY, probe.ref());

		assertEquals(ref, probe.receiveInstanceOf(com.github.behaviouractor.message.ActorIdentity.class).getRef());
	}
}
