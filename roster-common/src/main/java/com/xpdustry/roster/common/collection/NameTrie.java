package com.xpdustry.roster.common.collection;

import java.util.List;

public interface NameTrie<V> {

    static <V> NameTrie.Mutable<V> create() {
        return new NameTrieImpl<>();
    }

    List<V> get(final CharSequence name);

    List<V> collect();

    int size();

    interface Mutable<V> extends NameTrie<V> {

        void insert(final CharSequence name, final V value);
    }
}
