package com.xpdustry.roster.common.student;

public enum Classification {
    BTECH("BTech"),
    MTECH("MTech"),
    PHD("PhD");

    private final String label;

    Classification(final String label) {
        this.label = label;
    }

    public String label() {
        return this.label;
    }

    public int tier() {
        return this.ordinal();
    }
}
