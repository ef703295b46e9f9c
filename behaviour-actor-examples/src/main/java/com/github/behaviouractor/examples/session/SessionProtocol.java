package com.github.behaviouractor.examples.session;

import static java.util.Objects.requireNonNull;


/**
 * Messages exchanged between the session, the authenticator and the chat room.
 */
public interface SessionProtocol {

	final class AuthenticationRequest {

		private final String userId;
		private final String token;

		public AuthenticationRequest(final String userId, final String token) {
			this.userId = requireNonNull(userId, "User ID must not be null");
			this.token = requireNonNull(token, "Token must not be null");
		}

		public String getUserId() {
			return userId;
		}

		public String getToken() {
			return token;
		}

		@Override
		public String toString() {
			return new StringBuilder()
				.append(getClass().getSimpleName())
				.append('[')
				.append(userId)
				.append(']')
				.toString();
		}
	}

	final class AuthenticationSuccess {

		private final String userId;

		public AuthenticationSuccess(final String userId) {
			this.userId = requireNonNull(userId, "User ID must not be null");
		}

		public String getUserId() {
			return userId;
		}

		@Override
		public String toString() {
			return new StringBuilder()
				.append(getClass().getSimpleName())
				.append('[')
				.append(userId)
				.append(']')
				.toString();
		}
	}

	final class AuthenticationFailure {

		private final String userId;
		private final String reason;

		public AuthenticationFailure(final String userId, final String reason) {
			this.userId = requireNonNull(userId, "User ID must not be null");
			this.reason = requireNonNull(reason, "Reason must not be null");
		}

		public String getUserId() {
			return userId;
		}

		public String getReason() {
			return reason;
		}

		@Override
		public String toString() {
			return new StringBuilder()
				.append(getClass().getSimpleName())
				.append('[')
				.append(userId)
				.append(", ")
				.append(reason)
				.append(']')
				.toString();
		}
	}

	final class IncomingMessage {

		private final String userId;
		private final String text;

		public IncomingMessage(final String userId, final String text) {
			this.userId = requireNonNull(userId, "User ID must not be null");
			this.text = requireNonNull(text, "Text must not be null");
		}

		public String getUserId() {
			return userId;
		}

		public String getText() {
			return text;
		}

		@Override
		public String toString() {
			return new StringBuilder()
				.append(getClass().getSimpleName())
				.append('[')
				.append(userId)
				.append(": ")
				.append(text)
				.append(']')
				.toString();
		}
	}

	final class MessageRejected {

		private final IncomingMessage message;
		private final String reason;

		public MessageRejected(final IncomingMessage message, final String reason) {
			this.message = message;
			this.reason = reason;
		}

		public IncomingMessage getMessage() {
			return message;
		}

		public String getReason() {
			return reason;
		}

		@Override
		public String toString() {
			return new StringBuilder()
				.append(getClass().getSimpleName())
				.append('[')
				.append(message)
				.append(", ")
				.append(reason)
				.append(']')
				.toString();
		}
	}
}
