package io.tracedb.core;

public class TraceDbException extends RuntimeException {

    public TraceDbException(Throwable cause) {
        super(cause);
    }

    public TraceDbException(String message, Throwable cause) {
        super(message, cause);
    }

    public TraceDbException(String message) {
        super(message);
    }

}
