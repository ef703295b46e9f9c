package com.github.behaviouractor.util;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.behaviouractor.Actor;
import com.github.behaviouractor.ActorSystem;
import com.github.behaviouractor.Props;
import com.github.behaviouractor.Receive;
import com.github.behaviouractor.dsl.Behaviours;


public class ProbeTest {

	static final String SLEEP = "sleep";
	static final String WAKE_UP = "wake-up";

	static class SleepyActor extends Actor implements Behaviours {

		final Receive sleeping = behaviour("sleeping")
			.matchEquals(WAKE_UP, w -> unbecome())
			.build();

		@Override
		public Receive receive() {
			return behaviour("awake")
				.matchEquals(SLEEP, s -> becomeStacked(sleeping))
				.build();
		}
	}

	static class TestEvent {
	}

	private ActorSystem system;
	private Probe probe;

	@BeforeEach
	public void setup() {
		system = ActorSystem.create("ProbeTest");
		probe = new Probe(system);
	}

	@AfterEach
	public void teardown() {
		system.shutdown();
	}

	@Test
	public void test_receive() {

		final var expected = new Object();
		probe.ref().tell(expected);

		assertSame(expected, probe.receive());
	}

	@Test
	public void test_receiveInterrupted() {
		Thread.currentThread().interrupt();
		assertThrows(IllegalStateException.class, () -> probe.receive());
	}

	@Test
	public void test_receiveWithDurationExceeded() {
		assertThrows(AssertionError.class, () -> probe.receive(Duration.ofMillis(10)));
	}

	@Test
	public void test_receiveNKeepsArrivalOrder() {

		List.of(1, 2, 3).forEach(probe.ref()::tell);

		assertEquals(List.of(1, 2, 3), probe.receiveN(3));
	}

	@Test
	public void test_receiveNCountsTimeForAllMessages() {

		List.of(1, 2).forEach(probe.ref()::tell);

		assertThrows(AssertionError.class, () -> probe.receiveN(3, Duration.ofMillis(100)));
	}

	@Test
	public void test_receiveInstanceOfWithWrongType() {
		probe.ref().tell("not a number");
		assertThrows(AssertionError.class, () -> probe.receiveInstanceOf(Integer.class));
	}

	@Test
	public void test_receiveNInstanceOfWithWrongType() {

		List.of(1, "not a number").forEach(probe.ref()::tell);

		assertThrows(AssertionError.class, () -> probe.receiveNInstanceOf(2, Integer.class));
	}

	@Test
	public void test_expectNoMessageFailsWhenMessageArrives() {
		probe.ref().tell("unexpected");
		assertThrows(AssertionError.class, () -> probe.expectNoMessage(Duration.ofSeconds(1)));
	}

	@Test
	public void test_subscribe() {

		probe.subscribe(TestEvent.class);

		final var event = new TestEvent();
		system.emitEvent(event);

		assertSame(event, probe.receive());
	}

	@Test
	public void test_inspect() {

		final var ref = system.actorOf(Props.create(SleepyActor::new));

		ref.tell(SLEEP);

		final var snapshot = probe.inspect(ref);

		assertEquals(List.of("sleeping", "awake"), snapshot.getBehaviours());
		assertEquals(ref, snapshot.getActor());
	}

	@Test
	public void test_awaitBehaviour() {

		final var ref = system.actorOf(Props.create(SleepyActor::new));

		ref.tell(SLEEP);
		assertEquals(2, probe.awaitBehaviour(ref, "sleeping").getDepth());

		ref.tell(WAKE_UP);
		assertEquals(1, probe.awaitBehaviour(ref, "awake").getDepth());
	}

	@Test
	public void test_awaitBehaviourNeverReached() {

		final var ref = system.actorOf(Props.create(SleepyActor::new));

		assertThrows(AssertionError.class, () -> probe.awaitBehaviour(ref, "sleeping"));
	}

	@Test
	public void test_inspectStoppedActorFails() {

		final var ref = system.actorOf(Props.create(SleepyActor::new));

		system.stop(ref);

		await().until(() -> !system.isAlive(ref));

		assertThrows(AssertionError.class, () -> probe.inspect(ref));
	}
}
