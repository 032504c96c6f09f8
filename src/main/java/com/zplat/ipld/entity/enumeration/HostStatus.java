package com.zplat.ipld.entity.enumeration;

public enum HostStatus {
    WAIT("wait"),
    DONE("done"),
    ERROR("error");

    private final String value;

    HostStatus(String value) {
        this.value = value;
    }

    /** Lower-case wire value used in progress payloads. */
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this != WAIT;
    }
}
