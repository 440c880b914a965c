package com.xpdustry.roster.common.collection;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

final class NameTrieImpl<V> implements NameTrie.Mutable<V> {

    private @Nullable NameTrieImpl<V>[] children = null;
    private @Nullable List<V> values = null;
    private int size = 0;

    @Override
    public void insert(final CharSequence name, final V value) {
        Preconditions.checkNotNull(name, "name");
        Preconditions.checkNotNull(value, "value");

        var node = this;
        for (int i = 0; i < name.length(); i++) {
            final var index = NameAlphabet.index(name.charAt(i));
            if (node.children == null) {
                node.children = newChildren();
            }
            var next = node.children[index];
            if (next == null) {
                next = new NameTrieImpl<>();
                node.children[index] = next;
            }
            node = next;
        }

        if (node.values == null) {
            node.values = new ArrayList<>(4);
        }
        node.values.add(value);
        this.size++;
    }

    @Override
    public List<V> get(final CharSequence name) {
        Preconditions.checkNotNull(name, "name");

        var node = this;
        for (int i = 0; i < name.length(); i++) {
            if (node.children == null) {
                return List.of();
            }
            node = node.children[NameAlphabet.index(name.charAt(i))];
            if (node == null) {
                return List.of();
            }
        }

        return node.values == null ? List.of() : List.copyOf(node.values);
    }

    @Override
    public List<V> collect() {
        final List<V> result = new ArrayList<>(this.size);
        collect(this, result);
        return result;
    }

    @Override
    public int size() {
        return this.size;
    }

    // Recursion depth is bounded by the longest inserted name
    private static <V> void collect(final NameTrieImpl<V> node, final List<V> result) {
        if (node.values != null) {
            result.addAll(node.values);
        }
        if (node.children == null) {
            return;
        }
        for (final var child : node.children) {
            if (child != null) {
                collect(child, result);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static <V> NameTrieImpl<V>[] newChildren() {
        return (NameTrieImpl<V>[]) new NameTrieImpl<?>[NameAlphabet.SIZE];
    }
}
