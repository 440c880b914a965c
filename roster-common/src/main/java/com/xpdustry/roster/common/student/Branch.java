package com.xpdustry.roster.common.student;

public enum Branch {
    CSE,
    ECE;

    public String label() {
        return this.name();
    }
}
