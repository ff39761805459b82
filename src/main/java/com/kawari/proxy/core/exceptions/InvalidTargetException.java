package com.kawari.proxy.core.exceptions;

/**
 * Raised by the frontend when a request is rejected before dispatch. Never retried.
 */
public class InvalidTargetException extends ProxyException {

    /**
     * Why the request was rejected, with the HTTP status it maps to.
     */
    public enum Reason {
        MALFORMED(400),
        UNSUPPORTED_SCHEME(400),
        FORBIDDEN_ADDRESS(403),
        METHOD_NOT_ALLOWED(405),
        BODY_TOO_LARGE(413);

        private final int status;

        Reason(int status) {
            this.status = status;
        }

        public int getStatus() {
            return status;
        }
    }

    private final Reason reason;

    /**
     * Constructs a new InvalidTargetException.
     *
     * @param reason  the rejection category.
     * @param message the detail message.
     */
    public InvalidTargetException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidTargetException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
