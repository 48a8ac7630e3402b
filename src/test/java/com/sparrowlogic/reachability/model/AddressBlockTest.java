package com.sparrowlogic.reachability.model;

import com.sparrowlogic.reachability.exception.CidrParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class AddressBlockTest {

    @Test
    void shouldContainNarrowerBlockInsideNetwork() {
        var vpc = AddressBlock.parse("172.31.0.0/16");

        assertTrue(vpc.contains(AddressBlock.parse("172.31.0.10/32")));
        assertTrue(vpc.contains(AddressBlock.parse("172.31.128.0/20")));
        assertTrue(vpc.contains(vpc));
    }

    @Test
    void shouldNotContainWiderOrDisjointBlock() {
        var subnet = AddressBlock.parse("172.31.0.0/18");

        assertFalse(subnet.contains(AddressBlock.parse("172.31.128.10/32")));
        assertFalse(subnet.contains(AddressBlock.parse("172.31.0.0/16")));
        assertFalse(subnet.contains(AddressBlock.parse("10.0.0.0/8")));
    }

    @Test
    void shouldTreatZeroPrefixAsEverything() {
        var any = AddressBlock.parse("0.0.0.0/0");

        assertTrue(any.contains(AddressBlock.parse("255.255.255.255/32")));
        assertTrue(any.contains(AddressBlock.parse("10.1.2.3/32")));
    }

    @Test
    void shouldHandleHighAddresses() {
        var block = AddressBlock.parse("192.168.0.0/16");

        assertTrue(block.contains(AddressBlock.parse("192.168.255.1/32")));
        assertFalse(block.contains(AddressBlock.parse("192.169.0.1/32")));
    }

    @Test
    void shouldMaskHostBitsAndDefaultToSingleAddress() {
        var block = AddressBlock.parse("10.1.2.3/16");
        var single = AddressBlock.parse("10.1.2.3");

        assertEquals(16, block.prefixLength());
        assertTrue(block.contains(AddressBlock.parse("10.1.200.7/32")));
        assertEquals(32, single.prefixLength());
        assertEquals("10.1.2.3/16", block.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "10.0.0/8", "10.0.0.256/32", "10.0.0.0/33", "not-a-cidr", "10.0.0.0/", "::/0", "010.0.0.1/32", "10.0.00.0/24"})
    void shouldRejectMalformedLiterals(String literal) {
        var e = assertThrows(CidrParseException.class, () -> AddressBlock.parse(literal));
        assertEquals(literal, e.getLiteral());
    }

    @Test
    void shouldRejectNull() {
        assertThrows(CidrParseException.class, () -> AddressBlock.parse(null));
    }
}
