package com.sparrowlogic.reachability.model;

import com.sparrowlogic.reachability.exception.CidrParseException;

import java.util.regex.Pattern;

// Host bits in the literal are masked off: 10.1.2.3/16 is 10.1.0.0/16.
public record AddressBlock(String literal, int network, int prefixLength) {

    private static final Pattern CIDR = Pattern.compile("(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})(?:/(\\d{1,2}))?");

    public static AddressBlock parse(String literal) {
        if (literal == null || literal.isBlank()) {
            throw new CidrParseException(String.valueOf(literal), "empty value");
        }
        var matcher = CIDR.matcher(literal.trim());
        if (!matcher.matches()) {
            throw new CidrParseException(literal, "expected a.b.c.d/n");
        }
        var address = 0;
        for (var i = 1; i <= 4; i++) {
            var digits = matcher.group(i);
            if (digits.length() > 1 && digits.charAt(0) == '0') {
                throw new CidrParseException(literal, "octet " + digits + " has a leading zero");
            }
            var octet = Integer.parseInt(digits);
            if (octet > 255) {
                throw new CidrParseException(literal, "octet " + octet + " out of range");
            }
            address = (address << 8) | octet;
        }
        var prefix = matcher.group(5) != null ? Integer.parseInt(matcher.group(5)) : 32;
        if (prefix > 32) {
            throw new CidrParseException(literal, "prefix length " + prefix + " out of range");
        }
        return new AddressBlock(literal.trim(), address & mask(prefix), prefix);
    }

    public boolean contains(AddressBlock inner) {
        return inner.prefixLength >= prefixLength && (inner.network & mask(prefixLength)) == network;
    }

    private static int mask(int prefix) {
        return prefix == 0 ? 0 : -1 << (32 - prefix);
    }

    @Override
    public String toString() {
        return literal;
    }
}
