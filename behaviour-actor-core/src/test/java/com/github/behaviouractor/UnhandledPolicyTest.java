package com.github.behaviouractor;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.github.behaviouractor.ActorSystem.Configuration;
import com.github.behaviouractor.DeadLetters.DeadLetter;
import com.github.behaviouractor.dsl.Base;
import com.github.behaviouractor.message.Unhandled;
import com.github.behaviouractor.util.Probe;


@SuppressWarnings("boxing")
public class UnhandledPolicyTest {

	ActorSystem system;
	Probe probe;

	@AfterEach
	public void teardown() {
		system.shutdown();
	}

	private void start(final Configuration configuration) {
		system = ActorSystem.create("UnhandledPolicyTest", configuration);
		probe = new Probe(system);
	}

	static class StringOnlyActor extends Actor implements Base {

		@Override
		public Receive receive() {
			return behaviour("strings")
				.match(String.class, this::reply)
				.build();
		}
	}

	@Test
	public void test_publishByDefault() {

		start(new Configuration());
		probe.subscribe(Unhandled.class);

		final var ref = system.actorOf(Props.create(StringOnlyActor::new));

		ref.tell(42, probe.ref());

		final var unhandled = probe.receiveInstanceOf(Unhandled.class);

		assertEquals(42, unhandled.getMessage());
		assertEquals(ref, unhandled.getTarget());
		assertEquals(probe.ref(), unhandled.getSender());
		assertEquals("strings", unhandled.getBehaviour());
	}

	@Test
	public void test_unhandledDoesNotFaultActor() {

		start(new Configuration());

		final var ref = system.actorOf(Props.create(StringOnlyActor::new));

		ref.tell(1, probe.ref());
		ref.tell(2, probe.ref());
		ref.tell("still alive", probe.ref());

		assertEquals("still alive", probe.receive());
	}

	@Test
	public void test_deadLettersFromConfiguration() {

		final var configuration = new Configuration();
		configuration.setUnhandledPolicy(UnhandledPolicy.DEAD_LETTERS);

		start(configuration);
		probe.subscribe(DeadLetter.class);

		final var ref = system.actorOf(Props.create(StringOnlyActor::new));

		ref.tell(7, probe.ref());

		final var letter = probe.receiveInstanceOf(DeadLetter.class);

		assertEquals(7, letter.getMessage());
		assertEquals(ref, letter.getTarget());
	}

	@Test
	public void test_propsOverrideConfiguration() {

		start(new Configuration());
		probe.subscribe(Unhandled.class);

		final var ref = system.actorOf(Props
			.create(StringOnlyActor::new)
			.withUnhandledPolicy(UnhandledPolicy.DISCARD));

		ref.tell(1, probe.ref());
		ref.tell("handled", probe.ref());

		assertEquals("handled", probe.receive());

		probe.expectNoMessage(Duration.ofMillis(300));
	}

	@Test
	public void test_logPolicyDoesNotPublish() {

		start(new Configuration());
		probe.subscribe(Unhandled.class);

		final var ref = system.actorOf(Props
			.create(StringOnlyActor::new)
			.withUnhandledPolicy(UnhandledPolicy.LOG));

		ref.tell(1, probe.ref());
		ref.tell("handled", probe.ref());

		assertEquals("handled", probe.receive());

		probe.expectNoMessage(Duration.ofMillis(300));
	}
}
