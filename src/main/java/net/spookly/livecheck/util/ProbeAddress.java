package net.spookly.livecheck.util;

import java.net.InetAddress;
import java.net.InetSocketAddress;

import io.netty.util.NetUtil;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.livecheck.probe.MalformedAddressException;

/**
 * Parsed {@code ip:port} probe target. Hosts must be IP literals; names are never resolved.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProbeAddress {
    private static final int MAX_PORT = 65535;

    private final String host;
    private final int port;

    /**
     * Parse a {@code host:port} address. IPv6 hosts are written in brackets, e.g. {@code [::1]:8080}.
     */
    public static ProbeAddress parse(String raw) throws MalformedAddressException {
        if (raw == null || raw.isEmpty()) {
            throw new MalformedAddressException(String.valueOf(raw), "address is required");
        }
        String host;
        String portRaw;
        if (raw.startsWith("[")) {
            int close = raw.indexOf(']');
            if (close < 0) {
                throw new MalformedAddressException(raw, "missing ']' in address");
            }
            if (close + 1 >= raw.length() || raw.charAt(close + 1) != ':') {
                throw new MalformedAddressException(raw, "missing port in address");
            }
            host = raw.substring(1, close);
            portRaw = raw.substring(close + 2);
        } else {
            int lastColon = raw.lastIndexOf(':');
            if (lastColon < 0) {
                throw new MalformedAddressException(raw, "missing port in address");
            }
            host = raw.substring(0, lastColon);
            portRaw = raw.substring(lastColon + 1);
            if (host.indexOf(':') >= 0) {
                throw new MalformedAddressException(raw, "too many colons in address");
            }
        }
        if (!isIpLiteral(host)) {
            throw new MalformedAddressException(raw, "invalid IP");
        }
        return new ProbeAddress(host, parsePort(raw, portRaw));
    }

    /**
     * Socket address built from the literal host, without any name lookup.
     */
    public InetSocketAddress toSocketAddress() {
        InetAddress address = NetUtil.createInetAddressFromIpAddressString(host);
        return new InetSocketAddress(address, port);
    }

    @Override
    public String toString() {
        return NetUtil.isValidIpV6Address(host) ? "[" + host + "]:" + port : host + ":" + port;
    }

    private static boolean isIpLiteral(String host) {
        if (host.isEmpty() || host.indexOf('%') >= 0 || host.indexOf('[') >= 0) {
            return false;
        }
        if (hasLeadingZeroOctet(host)) {
            return false;
        }
        return NetUtil.isValidIpV4Address(host) || NetUtil.isValidIpV6Address(host);
    }

    // Dotted quads, including the tail of an IPv4-mapped IPv6 address, allow no leading zeros.
    private static boolean hasLeadingZeroOctet(String host) {
        if (host.indexOf('.') < 0) {
            return false;
        }
        String quad = host.substring(host.lastIndexOf(':') + 1);
        for (String octet : quad.split("\\.", -1)) {
            if (octet.length() > 1 && octet.charAt(0) == '0') {
                return true;
            }
        }
        return false;
    }

    private static int parsePort(String raw, String portRaw) throws MalformedAddressException {
        if (portRaw.isEmpty()) {
            throw new MalformedAddressException(raw, "invalid port");
        }
        long value = 0;
        for (int i = 0; i < portRaw.length(); i++) {
            char c = portRaw.charAt(i);
            if (c < '0' || c > '9') {
                throw new MalformedAddressException(raw, "invalid port");
            }
            value = value * 10 + (c - '0');
            if (value > MAX_PORT) {
                throw new MalformedAddressException(raw, "invalid port");
            }
        }
        return (int) value;
    }
}
