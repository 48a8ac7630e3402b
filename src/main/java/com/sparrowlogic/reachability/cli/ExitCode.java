package com.sparrowlogic.reachability.cli;

public enum ExitCode {
    SUCCESS(0),
    INVALID_ARGS(1),
    LOOKUP_FAILED(2),
    NOT_REACHABLE(3);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
