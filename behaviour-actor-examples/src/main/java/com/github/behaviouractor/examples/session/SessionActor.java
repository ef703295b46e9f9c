package com.github.behaviouractor.examples.session;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.behaviouractor.Actor;
import com.github.behaviouractor.ActorRef;
import com.github.behaviouractor.Receive;
import com.github.behaviouractor.dsl.Base;
import com.github.behaviouractor.dsl.Behaviours;
import com.github.behaviouractor.examples.session.SessionProtocol.AuthenticationFailure;
import com.github.behaviouractor.examples.session.SessionProtocol.AuthenticationRequest;
import com.github.behaviouractor.examples.session.SessionProtocol.AuthenticationSuccess;
import com.github.behaviouractor.examples.session.SessionProtocol.IncomingMessage;
import com.github.behaviouractor.examples.session.SessionProtocol.MessageRejected;


/**
 * Chat session of a single user. The session asks the authenticator for a verdict when started
 * and holds back the user's messages until the verdict arrives. Once authenticated, the messages
 * are passed to the chat room, otherwise they are rejected.
 */
public class SessionActor extends Actor implements Base, Behaviours {

	private static final Logger LOG = LoggerFactory.getLogger(SessionActor.class);

	public static final String AUTHENTICATING = "authenticating";
	public static final String AUTHENTICATED = "authenticated";
	public static final String UNAUTHENTICATED = "unauthenticated";

	private final String userId;
	private final String token;
	private final ActorRef authenticator;
	private final ActorRef chatRoom;

	/**
	 * Messages received while authenticating, in arrival order.
	 */
	private final List<Deferred> deferred = new ArrayList<>();

	private String rejection;

	public SessionActor(final String userId, final String token, final ActorRef authenticator, final ActorRef chatRoom) {
		this.userId = requireNonNull(userId, "User ID must not be null");
		this.token = requireNonNull(token, "Token must not be null");
		this.authenticator = requireNonNull(authenticator, "Authenticator must not be null");
		this.chatRoom = requireNonNull(chatRoom, "Chat room must not be null");
	}

	@Override
	public void preStart() {
		authenticator.tell(new AuthenticationRequest(userId, token), self());
	}

	@Override
	public Receive receive() {
		return behaviour(AUTHENTICATING)
			.match(IncomingMessage.class, this::isOwn, this::defer)
			.match(AuthenticationSuccess.class, s -> userId.equals(s.getUserId()), this::onSuccess)
			.match(AuthenticationFailure.class, f -> userId.equals(f.getUserId()), this::onFailure)
			.build();
	}

	private Receive authenticated() {
		return behaviour(AUTHENTICATED)
			.match(IncomingMessage.class, this::isOwn, this::post)
			.build();
	}

	private Receive unauthenticated() {
		return behaviour(UNAUTHENTICATED)
			.match(IncomingMessage.class, this::reject)
			.build();
	}

	private boolean isOwn(final IncomingMessage message) {
		return userId.equals(message.getUserId());
	}

	private void defer(final IncomingMessage message) {
		deferred.add(new Deferred(message, sender()));
	}

	private void post(final IncomingMessage message) {
		forward(message, chatRoom);
	}

	private void reject(final IncomingMessage message) {
		reply(new MessageRejected(message, rejection));
	}

	private void onSuccess(final AuthenticationSuccess success) {

		LOG.debug("User {} authenticated, passing {} deferred message(s)", userId, deferred.size());

		become(authenticated());

		// authenticated behaviour is not active until this handler returns

		for (final var d : deferred) {
			chatRoom.tell(d.message, d.sender);
		}

		deferred.clear();
	}

	private void onFailure(final AuthenticationFailure failure) {

		LOG.debug("User {} not authenticated: {}", userId, failure.getReason());

		rejection = failure.getReason();

		become(unauthenticated());

		for (final var d : deferred) {
			d.sender.tell(new MessageRejected(d.message, rejection), self());
		}

		deferred.clear();
	}

	private static final class Deferred {

		final IncomingMessage message;
		final ActorRef sender;

		Deferred(final IncomingMessage message, final ActorRef sender) {
			this.message = message;
			this.sender = sender;
		}
	}
}
