package com.xpdustry.roster.common.collection;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class NameTrieImplTest {

    @Test
    void test_collect_sorted() {
        final var trie = new NameTrieImpl<Integer>();
        trie.insert("Sunita Sharma", 0);
        trie.insert("Amit Kumar", 1);
        trie.insert("Rahul Verma", 2);
        Assertions.assertEquals(List.of(1, 2, 0), trie.collect());
        Assertions.assertEquals(3, trie.size());
    }

    @Test
    void test_case_insensitive() {
        final var trie = new NameTrieImpl<String>();
        trie.insert("bob", "lower");
        trie.insert("ALICE", "upper");
        trie.insert("Bob", "mixed");
        Assertions.assertEquals(List.of("upper", "lower", "mixed"), trie.collect());
        Assertions.assertEquals(List.of("lower", "mixed"), trie.get("BOB"));
    }

    @Test
    void test_prefix_sorts_first() {
        final var trie = new NameTrieImpl<String>();
        trie.insert("Ann Lee", "long");
        trie.insert("Ann", "short");
        Assertions.assertEquals(List.of("short", "long"), trie.collect());
    }

    @Test
    void test_separator_sorts_after_letters() {
        final var trie = new NameTrieImpl<String>();
        trie.insert("Ann Lee", "spaced");
        trie.insert("Annabel Lee", "letter");
        Assertions.assertEquals(List.of("letter", "spaced"), trie.collect());
    }

    @Test
    void test_duplicates_keep_insertion_order() {
        final var trie = new NameTrieImpl<String>();
        trie.insert("Maya Rao", "21EC2001");
        trie.insert("Maya Rao", "19CS0999");
        trie.insert("Maya Rao", "20CS1001");
        Assertions.assertEquals(List.of("21EC2001", "19CS0999", "20CS1001"), trie.collect());
    }

    @Test
    void test_separator_folding_is_lossy() {
        final var trie = new NameTrieImpl<String>();
        trie.insert("Mary-Jane Doe", "hyphen");
        trie.insert("Mary Jane Doe", "space");
        Assertions.assertEquals(List.of("hyphen", "space"), trie.get("Mary.Jane Doe"));
        Assertions.assertEquals(List.of("hyphen", "space"), trie.collect());
    }

    @Test
    void test_get_missing() {
        final var trie = new NameTrieImpl<String>();
        Assertions.assertEquals(List.of(), trie.get("Amit Kumar"));
        trie.insert("Amit Kumar", "20CS1001");
        Assertions.assertEquals(List.of(), trie.get("Amit"));
        Assertions.assertEquals(List.of(), trie.get("Amit Kumaran"));
    }

    @Test
    void test_empty() {
        final var trie = new NameTrieImpl<String>();
        Assertions.assertEquals(List.of(), trie.collect());
        Assertions.assertEquals(0, trie.size());
    }

    @Test
    void test_empty_name_stored_at_root() {
        final var trie = new NameTrieImpl<String>();
        trie.insert("b", "b");
        trie.insert("", "root");
        Assertions.assertEquals(List.of("root", "b"), trie.collect());
    }

    @Test
    void test_alphabet() {
        Assertions.assertEquals(0, NameAlphabet.index('a'));
        Assertions.assertEquals(0, NameAlphabet.index('A'));
        Assertions.assertEquals(25, NameAlphabet.index('Z'));
        Assertions.assertEquals(NameAlphabet.SEPARATOR, NameAlphabet.index(' '));
        Assertions.assertEquals(NameAlphabet.SEPARATOR, NameAlphabet.index('-'));
        Assertions.assertEquals(NameAlphabet.SEPARATOR, NameAlphabet.index('é'));
        Assertions.assertEquals(26, NameAlphabet.SEPARATOR);
    }
}
