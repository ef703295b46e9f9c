package com.github.behaviouractor.examples.session;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.behaviouractor.Actor;
import com.github.behaviouractor.Receive;
import com.github.behaviouractor.dsl.Base;
import com.github.behaviouractor.examples.session.SessionProtocol.AuthenticationFailure;
import com.github.behaviouractor.examples.session.SessionProtocol.AuthenticationRequest;
import com.github.behaviouractor.examples.session.SessionProtocol.AuthenticationSuccess;


/**
 * Checks the tokens presented by sessions against a fixed user to token map.
 */
public class AuthenticatorActor extends Actor implements Base {

	private static final Logger LOG = LoggerFactory.getLogger(AuthenticatorActor.class);

	private final Map<String, String> tokens;

	public AuthenticatorActor(final Map<String, String> tokens) {
		this.tokens = Map.copyOf(tokens);
	}

	@Override
	public Receive receive() {
		return behaviour("authenticator")
			.match(AuthenticationRequest.class, this::onRequest)
			.build();
	}

	private void onRequest(final AuthenticationRequest request) {

		final var userId = request.getUserId();
		final var expected = tokens.get(userId);

		if (expected == null) {
			LOG.debug("Unknown user {}", userId);
			reply(new AuthenticationFailure(userId, "unknown user"));
		} else if (expected.equals(request.getToken())) {
			reply(new AuthenticationSuccess(userId));
		} else {
			LOG.debug("Invalid token presented by user {}", userId);
			reply(new AuthenticationFailure(userId, "invalid token"));
		}
	}
}
