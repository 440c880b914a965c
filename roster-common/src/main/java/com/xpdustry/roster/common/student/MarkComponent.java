package com.xpdustry.roster.common.student;

public enum MarkComponent {
    ASSIGNMENT('A'),
    MIDTERM('M'),
    LAB('L'),
    FINAL('F');

    private final char symbol;

    MarkComponent(final char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return this.symbol;
    }
}
