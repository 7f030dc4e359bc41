package net.spookly.livecheck.probe;

/**
 * The probe scope was cancelled before the address became live.
 */
public final class ProbeCancelledException extends ProbeException {
    public ProbeCancelledException(String address) {
        super(address, "probe cancelled: " + address);
    }
}
