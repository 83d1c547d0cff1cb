package com.rolebridge.identity;

/** The two kinds of application identity that are mirrored into database roles. */
public enum IdentityKind {
    USER("user"),
    GROUP("group");

    private final String value;

    IdentityKind(String value) {
        this.value = value;
    }

    /** Canonical lower-case string (e.g. "user"), used in role markers and JSON. */
    public String value() {
        return value;
    }
}
