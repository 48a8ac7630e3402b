package com.sparrowlogic.reachability.model;

// The provider reports -1 on both bounds for "all ports" rules.
public record PortRange(int from, int to) {

    public static final int MIN_PORT = 0;
    public static final int MAX_PORT = 65535;

    public static PortRange of(int from, int to) {
        return new PortRange(from == -1 ? MIN_PORT : from, to == -1 ? MAX_PORT : to);
    }

    public static PortRange all() {
        return new PortRange(MIN_PORT, MAX_PORT);
    }

    public boolean contains(int port) {
        return from <= port && port <= to;
    }

    @Override
    public String toString() {
        return from == to ? String.valueOf(from) : from + "-" + to;
    }
}
