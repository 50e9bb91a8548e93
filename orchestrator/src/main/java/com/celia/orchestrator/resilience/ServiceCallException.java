package com.celia.orchestrator.resilience;

/**
 * Failure reported by an external capability (the text generator, an executor).
 *
 * The kind tells the retry layer whether another attempt can help:
 * TRANSIENT for network hiccups, throttling and 5xx responses; FATAL for
 * authentication, unknown model and content-policy rejections.
 */
public class ServiceCallException extends RuntimeException {

    public enum Kind { TRANSIENT, FATAL }

    private final Kind kind;
    private final int  statusCode;

    public ServiceCallException(Kind kind, String message) {
        this(kind, -1, message, null);
    }

    public ServiceCallException(Kind kind, String message, Throwable cause) {
        this(kind, -1, message, cause);
    }

    public ServiceCallException(Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind       = kind;
        this.statusCode = statusCode;
    }

    public Kind getKind()        { return kind; }
    public int  getStatusCode()  { return statusCode; }
    public boolean isFatal()     { return kind == Kind.FATAL; }
}
