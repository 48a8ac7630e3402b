package com.sparrowlogic.reachability.exception;

public class CidrParseException extends IllegalArgumentException {

    private final String literal;

    public CidrParseException(String literal, String reason) {
        super("invalid IPv4 CIDR block '" + literal + "': " + reason);
        this.literal = literal;
    }

    public String getLiteral() {
        return literal;
    }
}
