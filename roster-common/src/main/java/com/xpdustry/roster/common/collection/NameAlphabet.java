package com.xpdustry.roster.common.collection;

/**
 * Maps name characters to the child slots of a {@link NameTrie} node.
 *
 * <p>Letters are folded to lower case and take the slots {@code 0} to {@code 25}. Spaces and every
 * other character share the {@link #SEPARATOR} slot, so they sort after all letters and cannot be
 * told apart from each other.
 */
public final class NameAlphabet {

    public static final int SIZE = 27;

    public static final int SEPARATOR = SIZE - 1;

    private NameAlphabet() {}

    public static int index(final char c) {
        if (c >= 'a' && c <= 'z') {
            return c - 'a';
        }
        if (c >= 'A' && c <= 'Z') {
            return c - 'A';
        }
        return SEPARATOR;
    }
}
