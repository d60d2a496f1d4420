package io.generativeai.core;

/**
 * Base class for every failure raised by the generative language client.
 *
 * <p>Each public client operation either returns a fully decoded response or throws exactly one
 * subclass of this type. Subclasses preserve the original cause when one exists.
 */
public abstract class GenerativeAIException extends RuntimeException {

    protected GenerativeAIException(String message) {
        super(message);
    }

    protected GenerativeAIException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a payload cannot be encoded or decoded, including a stream that ends mid-element.
     */
    public static class SerializationException extends GenerativeAIException {
        public SerializationException(String message) {
            super(message);
        }

        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the service could not be reached, the call was interrupted, or the client was misused.
     */
    public static class ClientException extends GenerativeAIException {
        public ClientException(String message) {
            super(message);
        }

        public ClientException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the call deadline elapses before the response (or the whole stream) arrives.
     */
    public static class RequestTimeoutException extends GenerativeAIException {
        public RequestTimeoutException(String message) {
            super(message);
        }

        public RequestTimeoutException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the service reports an error.
     *
     * <p>{@link #status()} and {@link #serverMessage()} are populated when the error body could be parsed;
     * otherwise they are {@code null} and the message carries the raw body.
     */
    public static class ServerException extends GenerativeAIException {
        private final int httpStatus;
        private final String status;
        private final String serverMessage;

        public ServerException(String message, int httpStatus) {
            this(message, httpStatus, null, null);
        }

        public ServerException(String message, int httpStatus, String status, String serverMessage) {
            super(message);
            this.httpStatus = httpStatus;
            this.status = status;
            this.serverMessage = serverMessage;
        }

        /** HTTP status code of the response, or the code carried by an in-band error. */
        public int httpStatus() {
            return httpStatus;
        }

        /** Canonical status name reported by the server (e.g. {@code INVALID_ARGUMENT}). */
        public String status() {
            return status;
        }

        public String serverMessage() {
            return serverMessage;
        }
    }

    /**
     * Raised when the service rejects the API key.
     */
    public static class InvalidAPIKeyException extends ServerException {
        public InvalidAPIKeyException(String message, int httpStatus, String status, String serverMessage) {
            super(message, httpStatus, status, serverMessage);
        }
    }

    /**
     * Raised when the project has run out of quota.
     */
    public static class QuotaExceededException extends ServerException {
        public QuotaExceededException(String message, int httpStatus, String status, String serverMessage) {
            super(message, httpStatus, status, serverMessage);
        }
    }

    /**
     * Raised when the API is not enabled for the project owning the key.
     */
    public static class ServiceDisabledException extends ServerException {
        public ServiceDisabledException(String message, int httpStatus, String status, String serverMessage) {
            super(message, httpStatus, status, serverMessage);
        }
    }

    /**
     * Raised when the service is not available in the caller's region.
     */
    public static class UnsupportedUserLocationException extends ServerException {
        public UnsupportedUserLocationException(String message, int httpStatus, String status, String serverMessage) {
            super(message, httpStatus, status, serverMessage);
        }
    }
}
