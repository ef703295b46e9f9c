package com.github.behaviouractor.examples.session;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.behaviouractor.ActorRef;
import com.github.behaviouractor.ActorSystem;
import com.github.behaviouractor.Props;
import com.github.behaviouractor.examples.session.SessionProtocol.AuthenticationFailure;
import com.github.behaviouractor.examples.session.SessionProtocol.AuthenticationRequest;
import com.github.behaviouractor.examples.session.SessionProtocol.AuthenticationSuccess;
import com.github.behaviouractor.examples.session.SessionProtocol.IncomingMessage;
import com.github.behaviouractor.examples.session.SessionProtocol.MessageRejected;
import com.github.behaviouractor.message.BehaviourSnapshot;
import com.github.behaviouractor.util.Probe;


public class SessionActorTest {

	static final String USER = "alice";
	static final String TOKEN = "secret";

	ActorSystem system;
	Probe authenticator;
	Probe chatRoom;
	Probe client;

	@BeforeEach
	public void setup() {
		system = ActorSystem.create("SessionActorTest");
		authenticator = new Probe(system);
		chatRoom = new Probe(system);
		client = new Probe(system);
	}

	@AfterEach
	public void teardown() {
		system.shutdown();
	}

	private ActorRef newSession() {

		final var session = system.actorOf(Props.create(() -> new SessionActor(USER, TOKEN, authenticator.ref(), chatRoom.ref())));
		final var request = authenticator.receiveInstanceOf(AuthenticationRequest.class);

		assertEquals(USER, request.getUserId());
		assertEquals(TOKEN, request.getToken());

		return session;
	}

	private BehaviourSnapshot inspect(final ActorRef ref) throws Exception {
		return ref
			.inspect()
			.toCompletableFuture()
			.get(3, SECONDS);
	}

	@Test
	public void test_startsAuthenticating() throws Exception {

		final var snapshot = inspect(newSession());

		assertEquals(SessionActor.AUTHENTICATING, snapshot.getCurrent());
		assertEquals(1, snapshot.getDepth());
	}

	@Test
	public void test_messagesAreHeldBackUntilAuthenticated() throws Exception {

		final var session = newSession();
		final var first = new IncomingMessage(USER, "first");
		final var second = new IncomingMessage(USER, "second");

		session.tell(first, client.ref());
		session.tell(second, client.ref());

		chatRoom.expectNoMessage(Duration.ofMillis(200));

		session.tell(new AuthenticationSuccess(USER), authenticator.ref());

		assertSame(first, chatRoom.receive());
		assertSame(second, chatRoom.receive());

		final var snapshot = inspect(session);

		assertEquals(SessionActor.AUTHENTICATED, snapshot.getCurrent());
		assertEquals(1, snapshot.getDepth());
	}

	@Test
	public void test_authenticatedSessionPostsToChatRoom() throws Exception {

		final var session = newSession();

		session.tell(new AuthenticationSuccess(USER), authenticator.ref());

		final var message = new IncomingMessage(USER, "hello");

		session.tell(message, client.ref());

		assertSame(message, chatRoom.receive());
	}

	@Test
	public void test_deferredMessagesGoAheadOfLaterOnes() {

		final var session = newSession();
		final var early = new IncomingMessage(USER, "early");
		final var late = new IncomingMessage(USER, "late");

		session.tell(early, client.ref());
		session.tell(new AuthenticationSuccess(USER), authenticator.ref());
		session.tell(late, client.ref());

		assertSame(early, chatRoom.receive());
		assertSame(late, chatRoom.receive());
	}

	@Test
	public void test_rejectedWhenAuthenticationFails() throws Exception {

		final var session = newSession();
		final var deferred = new IncomingMessage(USER, "deferred");

		session.tell(deferred, client.ref());
		session.tell(new AuthenticationFailure(USER, "invalid token"), authenticator.ref());

		final var rejected = client.receiveInstanceOf(MessageRejected.class);

		assertSame(deferred, rejected.getMessage());
		assertEquals("invalid token", rejected.getReason());

		session.tell(new IncomingMessage(USER, "later"), client.ref());

		assertEquals("later", client.receiveInstanceOf(MessageRejected.class).getMessage().getText());
		assertEquals(SessionActor.UNAUTHENTICATED, inspect(session).getCurrent());

		chatRoom.expectNoMessage(Duration.ofMillis(200));
	}

	@Test
	public void test_verdictForOtherUserIsIgnored() throws Exception {

		final var session = newSession();

		session.tell(new AuthenticationSuccess("bob"), authenticator.ref());

		assertEquals(SessionActor.AUTHENTICATING, inspect(session).getCurrent());
	}

	@Test
	public void test_withAuthenticator() throws Exception {

		final var auth = system.actorOf(Props.create(() -> new AuthenticatorActor(Map.of(USER, TOKEN, "bob", "other"))));
		final var good = system.actorOf(Props.create(() -> new SessionActor(USER, TOKEN, auth, chatRoom.ref())));
		final var bad = system.actorOf(Props.create(() -> new SessionActor("bob", "wrong", auth, chatRoom.ref())));

		final var hello = new IncomingMessage(USER, "hello");

		good.tell(hello, client.ref());
		bad.tell(new IncomingMessage("bob", "hi"), client.ref());

		assertSame(hello, chatRoom.receive());
		assertEquals("invalid token", client.receiveInstanceOf(MessageRejected.class).getReason());
	}
}
