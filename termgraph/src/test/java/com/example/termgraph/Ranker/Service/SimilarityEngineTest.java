package com.example.termgraph.Ranker.Service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.termgraph.Store.InMemoryGraphStore;
import com.example.termgraph.utils.KeyCodec;

class SimilarityEngineTest {

    private static final double DELTA = 1e-9;

    private InMemoryGraphStore store;
    private SimilarityEngine similarityEngine;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        similarityEngine = new SimilarityEngine(store, new KeyCodec("", ":"));

        store.zAdd("w:d1", "noun:cat", 1.0);
        store.zAdd("w:d1", "verb:run", 2.0);

        store.zAdd("w:d2", "noun:cat", 2.0);
        store.zAdd("w:d2", "adj:big", 1.0);

        store.zAdd("w:d3", "verb:swim", 3.0);
    }

    @Test
    void documentIsFullySimilarToItself() {
        assertEquals(1.0, similarityEngine.cosineSimilarity("d1", "d1"), DELTA);
        assertEquals(1.0, similarityEngine.cosineSimilarity("d2", "d2"), DELTA);
    }

    @Test
    void magnitudesUseEachFullVector() {
        // dot = 1*2, |d1| = sqrt(5), |d2| = sqrt(5)
        assertEquals(0.4, similarityEngine.cosineSimilarity("d1", "d2"), DELTA);
        assertEquals(similarityEngine.cosineSimilarity("d1", "d2"), similarityEngine.cosineSimilarity("d2", "d1"), DELTA);
    }

    @Test
    void disjointVectorsAreOrthogonal() {
        assertEquals(0.0, similarityEngine.cosineSimilarity("d1", "d3"), DELTA);
    }

    @Test
    void conceptSimilarityKeepsNounsAndAdjectives() {
        // d1 -> {noun:cat=1}, d2 -> {noun:cat=2, adj:big=1}
        assertEquals(2 / Math.sqrt(5), similarityEngine.conceptSimilarity("d1", "d2"), DELTA);
    }

    @Test
    void conceptSimilarityKeepsCompoundTags() {
        store.zAdd("w:d5", "noun-pl:cats", 1.0);
        store.zAdd("w:d6", "noun-pl:cats", 1.0);
        store.zAdd("w:d6", "verb-past:ran", 4.0);
        store.zAdd("w:d6", "adj-comp:bigger", 0.0);

        assertEquals(1.0, similarityEngine.conceptSimilarity("d5", "d5"), DELTA);
        assertEquals(1.0, similarityEngine.conceptSimilarity("d5", "d6"), DELTA);
    }

    @Test
    void customTagFilter() {
        assertEquals(1.0, similarityEngine.cosineSimilarity("d1", "d1", Set.of("verb")), DELTA);
        assertEquals(0.0, similarityEngine.cosineSimilarity("d1", "d2", Set.of("verb")), DELTA);

        store.zAdd("w:d7", "verb-past:ran", 2.0);
        store.zAdd("w:d7", "noun:dog", 5.0);
        // d1 -> {verb:run=2}, d7 -> {verb-past:ran=2}
        assertEquals(0.0, similarityEngine.cosineSimilarity("d1", "d7", Set.of("verb")), DELTA);
        assertEquals(1.0, similarityEngine.cosineSimilarity("d7", "d7", Set.of("verb")), DELTA);
    }

    @Test
    void zeroMagnitudeIsDefinedAsZero() {
        assertEquals(0.0, similarityEngine.cosineSimilarity("d1", "unknown"));
        assertEquals(0.0, similarityEngine.conceptSimilarity("d3", "d1"), "d3 has no concepts");

        store.zAdd("w:d4", "noun:cat", 0.0);
        double score = similarityEngine.cosineSimilarity("d4", "d4");
        assertFalse(Double.isNaN(score));
        assertEquals(0.0, score);
    }
}
