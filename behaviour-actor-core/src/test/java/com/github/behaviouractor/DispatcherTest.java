package com.github.behaviouractor;

import static com.github.behaviouractor.Dispatcher.Outcome.HANDLED;
import static com.github.behaviouractor.Dispatcher.Outcome.UNHANDLED;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;


@SuppressWarnings("boxing")
public class DispatcherTest {

	final List<String> invoked = new ArrayList<>();

	@Test
	public void test_firstMatchingTypeWins() {

		final var r = Receive.builder("test")
			.match(Number.class, n -> invoked.add("number"))
			.match(Integer.class, i -> invoked.add("integer"))
			.build();

		assertEquals(HANDLED, Dispatcher.dispatch(r, 1));
		assertEquals(List.of("number"), invoked);
	}

	@Test
	public void test_guardTieBreak() {

		final var r = Receive.builder("test")
			.match(Integer.class, i -> false, i -> invoked.add("first"))
			.match(Integer.class, i -> true, i -> invoked.add("second"))
			.build();

		assertEquals(HANDLED, Dispatcher.dispatch(r, 7));
		assertEquals(List.of("second"), invoked);
	}

	@Test
	public void test_guardReceivesMessage() {

		final var r = Receive.builder("test")
			.match(Integer.class, i -> i > 10, i -> invoked.add("big"))
			.match(Integer.class, i -> invoked.add("small"))
			.build();

		Dispatcher.dispatch(r, 11);
		Dispatcher.dispatch(r, 3);

		assertEquals(List.of("big", "small"), invoked);
	}

	@Test
	public void test_guardNotEvaluatedForDifferentType() {

		final var evaluations = new AtomicInteger();
		final var r = Receive.builder("test")
			.match(String.class, s -> evaluations.incrementAndGet() > 0, s -> invoked.add("string"))
			.match(Integer.class, i -> invoked.add("integer"))
			.build();

		Dispatcher.dispatch(r, 1);

		assertEquals(0, evaluations.get());
		assertEquals(List.of("integer"), invoked);
	}

	@Test
	public void test_unhandledWhenNothingMatches() {

		final var r = Receive.builder("test")
			.match(String.class, s -> invoked.add("string"))
			.match(Integer.class, i -> i < 0, i -> invoked.add("negative"))
			.build();

		assertEquals(UNHANDLED, Dispatcher.dispatch(r, 5));
		assertEquals(UNHANDLED, Dispatcher.dispatch(r, 5L));
		assertEquals(List.of(), invoked);
	}

	@Test
	public void test_unhandledOnEmpty() {
		assertEquals(UNHANDLED, Dispatcher.dispatch(Receive.empty("empty"), "message"));
	}

	@Test
	public void test_matchAnyCatchesRest() {

		final var r = Receive.builder("test")
			.match(String.class, s -> invoked.add("string"))
			.matchAny(o -> invoked.add("any"))
			.build();

		Dispatcher.dispatch(r, "a");
		Dispatcher.dispatch(r, 1);

		assertEquals(List.of("string", "any"), invoked);
	}

	@Test
	public void test_actionReceivesSameMessage() {

		final var message = new Object();
		final var received = new ArrayList<Object>();
		final var r = Receive.builder("test")
			.matchAny(received::add)
			.build();

		Dispatcher.dispatch(r, message);

		assertSame(message, received.get(0));
	}

	@Test
	public void test_actionFailurePropagates() {

		final var r = Receive.builder("test")
			.match(String.class, s -> {
				throw new IllegalStateException(s);
			})
			.build();

		final var e = assertThrows(IllegalStateException.class, () -> Dispatcher.dispatch(r, "boom"));

		assertEquals("boom", e.getMessage());
	}
}
