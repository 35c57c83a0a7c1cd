package com.example.termgraph.utils;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.example.termgraph.Graph.Entities.LeafNode;

class KeyCodecTest {

    private final KeyCodec codec = new KeyCodec("", ":");
    private final KeyCodec namespaced = new KeyCodec("ns", ":");

    @Test
    void formatsTaggedNodeWithLowerCasedTagAndTerm() {
        assertEquals("noun:cat", codec.format(LeafNode.of("Noun", "Cat")));
        assertEquals("noun:cat", codec.nodeKey(LeafNode.of("Noun", "Cat")));
    }

    @Test
    void distinctValueReplacesTermVerbatim() {
        LeafNode leaf = new LeafNode("noun", "Cat", "Felis", false);
        assertEquals("noun:Felis", codec.nodeKey(leaf));
        assertEquals("ns:t:noun:Felis", namespaced.format(KeyCodec.TOTAL, leaf));
    }

    @Test
    void prependsNamespaceAndSkipsEmptyParts() {
        assertEquals("ns:t:noun:cat", namespaced.format(KeyCodec.TOTAL, "noun:cat"));
        assertEquals("x", codec.format("", null, "x"));
        assertEquals("ns", namespaced.format());
    }

    @Test
    void rejectsUnsupportedParts() {
        assertThrows(IllegalArgumentException.class, () -> codec.format(42));
        assertThrows(IllegalArgumentException.class, () -> new KeyCodec("", ""));
    }

    @Test
    void recognisesReservedPrefixes() {
        assertTrue(codec.isReservedPrefix("t:noun:cat"));
        assertTrue(codec.isReservedPrefix("<:noun:cat"));
        assertTrue(codec.isReservedPrefix("w:noun:cat"));
        assertTrue(codec.isReservedPrefix("^:d1"));
        assertFalse(codec.isReservedPrefix("noun:cat"));
        assertFalse(codec.isReservedPrefix("t"), "document counter has no trailing separator");
        assertFalse(codec.isReservedPrefix("tag:cat"));
    }

    @Test
    void reservedPrefixesFollowNamespace() {
        assertTrue(namespaced.isReservedPrefix("ns:w:noun:cat"));
        assertFalse(namespaced.isReservedPrefix("w:noun:cat"));
        assertFalse(namespaced.isReservedPrefix("ns:noun:cat"));
    }

    @Test
    void buildsEntityKeys() {
        assertEquals("t", codec.totalDocumentsKey());
        assertEquals("t:noun:cat", codec.totalKey("noun:cat"));
        assertEquals("d1", codec.adjacencyKey("d1"));
        assertEquals("<:noun:cat", codec.nextKey("noun:cat"));
        assertEquals("w:d1", codec.weightKey("d1"));
        assertEquals("^:d1", codec.contentKey("d1"));
        assertEquals("^:*", codec.contentPattern());
        assertEquals("*:cat", codec.termPattern("cat"));
        assertEquals("ns:*:cat", namespaced.termPattern("cat"));
        assertEquals("*:c\\?t", codec.termPattern("c?t"));
        assertEquals("*:\\*", codec.termPattern("*"));
        assertEquals("*:\\[a\\]\\\\", codec.termPattern("[a]\\"));
    }

    @Test
    void parsesKeys() {
        assertEquals("doc:1", namespaced.documentIdFromContentKey("ns:^:doc:1"));
        assertThrows(IllegalArgumentException.class, () -> codec.documentIdFromContentKey("w:d1"));
        assertEquals("noun:cat", namespaced.stripNamespace("ns:noun:cat"));
        assertEquals("noun:cat", codec.stripNamespace("noun:cat"));
        assertTrue(codec.isQualified("noun:cat"));
        assertFalse(codec.isQualified("cat"));
    }

    @Test
    void honoursCustomSeparator() {
        KeyCodec piped = new KeyCodec("g", "|");
        assertEquals("g|w|noun|cat", piped.format(KeyCodec.WEIGHT, LeafNode.of("noun", "cat")));
        assertTrue(piped.isReservedPrefix("g|t|noun|cat"));
        assertFalse(piped.isQualified("noun:cat"));
    }
}
