package net.spookly.livecheck.probe;

/**
 * A request id was reused while the operation registered under it is still active.
 * This is caller misuse and is not meant to be caught and retried.
 */
public final class DuplicateRequestIdException extends IllegalStateException {
    private final long requestId;

    public DuplicateRequestIdException(long requestId) {
        super("duplicate request id: " + Long.toUnsignedString(requestId));
        this.requestId = requestId;
    }

    public long requestId() {
        return requestId;
    }
}
