package net.spookly.livecheck.probe;

/**
 * The probe address is not a literal {@code ip:port}. Never retried.
 */
public final class MalformedAddressException extends ProbeException {
    public MalformedAddressException(String address, String reason) {
        super(address, reason + ": " + address);
    }

    public MalformedAddressException(String address, String reason, Throwable cause) {
        super(address, reason + ": " + address, cause);
    }
}
