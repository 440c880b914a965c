package com.xpdustry.roster.common.error;

public final class RosterException extends RuntimeException {

    private final RosterError error;

    public RosterException(final RosterError error) {
        super(error.message());
        this.error = error;
    }

    public RosterError error() {
        return this.error;
    }
}
