package net.spookly.livecheck.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.InetSocketAddress;

import net.spookly.livecheck.probe.MalformedAddressException;
import org.junit.jupiter.api.Test;

class ProbeAddressTest {
    @Test
    void parsesIpv4HostAndPort() throws MalformedAddressException {
        ProbeAddress address = ProbeAddress.parse("127.0.0.1:9000");
        assertEquals("127.0.0.1", address.host());
        assertEquals(9000, address.port());
        assertEquals("127.0.0.1:9000", address.toString());
    }

    @Test
    void parsesBracketedIpv6() throws MalformedAddressException {
        ProbeAddress address = ProbeAddress.parse("[::1]:8545");
        assertEquals("::1", address.host());
        assertEquals(8545, address.port());
        InetSocketAddress socketAddress = address.toSocketAddress();
        assertTrue(socketAddress.getAddress().isLoopbackAddress());
        assertEquals("[::1]:8545", address.toString());
    }

    @Test
    void acceptsPortBounds() throws MalformedAddressException {
        assertEquals(0, ProbeAddress.parse("10.0.0.1:0").port());
        assertEquals(65535, ProbeAddress.parse("10.0.0.1:65535").port());
        assertEquals(80, ProbeAddress.parse("10.0.0.1:0080").port());
        assertEquals("10.0.0.0", ProbeAddress.parse("10.0.0.0:80").host());
    }

    @Test
    void rejectsHostNames() {
        MalformedAddressException e = assertThrows(MalformedAddressException.class,
                () -> ProbeAddress.parse("not-an-ip:80"));
        assertTrue(e.getMessage().contains("invalid IP"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("localhost:80"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("01.2.3.4:80"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("127.000.0.1:80"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("[::ffff:127.0.0.01]:80"));
    }

    @Test
    void rejectsPortsOutsideSixteenBits() {
        MalformedAddressException e = assertThrows(MalformedAddressException.class,
                () -> ProbeAddress.parse("127.0.0.1:99999"));
        assertTrue(e.getMessage().contains("invalid port"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("127.0.0.1:65536"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("127.0.0.1:-1"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("127.0.0.1:+80"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("127.0.0.1:http"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("127.0.0.1:"));
    }

    @Test
    void rejectsMissingPortAndBadSyntax() {
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("127.0.0.1"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse(""));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse(null));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse(":80"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("::1:80"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("[::1]80"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("[::1:80"));
        assertThrows(MalformedAddressException.class, () -> ProbeAddress.parse("[fe80::1%eth0]:80"));
    }
}
