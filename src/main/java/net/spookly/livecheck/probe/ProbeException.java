package net.spookly.livecheck.probe;

/**
 * Outcome of a probe that ended without the target becoming live.
 */
public abstract class ProbeException extends Exception {
    private final String address;

    protected ProbeException(String address, String message) {
        super(message);
        this.address = address;
    }

    protected ProbeException(String address, String message, Throwable cause) {
        super(message, cause);
        this.address = address;
    }

    /**
     * Address the probe was started for, as supplied by the caller.
     */
    public String address() {
        return address;
    }
}
