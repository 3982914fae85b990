package uk.gegc.aianswers.features.auth.infra.security;

import lombok.Getter;

@Getter
public class InvalidIdTokenException extends RuntimeException {

    public enum Reason {
        INVALID("Invalid authentication token"),
        EXPIRED("Authentication token has expired"),
        REVOKED("Authentication token has been revoked"),
        UNVERIFIABLE("Authentication failed");

        private final String clientMessage;

        Reason(String clientMessage) {
            this.clientMessage = clientMessage;
        }

        public String clientMessage() {
            return clientMessage;
        }
    }

    private final Reason reason;

    public InvalidIdTokenException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public InvalidIdTokenException(Reason reason, String message) {
        this(reason, message, null);
    }
}
