package com.xpdustry.roster.common.error;

public enum RosterError {
    EMPTY_IDENTITY("Roll number is empty"),
    INVALID_IDENTITY_CHAR("Unrecognized character in roll number"),
    EMPTY_NAME("Name is empty"),
    MISSING_SECOND_TOKEN("No second name provided"),
    INVALID_NAME_CHAR("Name contains digits or special characters"),
    INVALID_SECOND_TOKEN("Second name contains digits or special characters"),
    OVERFLOW("Buffer overflow in input"),
    IDENTITY_NOT_FOUND("Roll number not found");

    private final String message;

    RosterError(final String message) {
        this.message = message;
    }

    public String message() {
        return this.message;
    }
}
