package com.example.termgraph.Ranker.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.example.termgraph.Store.GraphStore;
import com.example.termgraph.Store.ScoredMember;
import com.example.termgraph.utils.KeyCodec;

/**
 * Cosine similarity between the TF-IDF weight vectors of two documents.
 */
@Service
public class SimilarityEngine {

    public static final Set<String> CONCEPT_TAGS = Set.of("noun", "adj");

    private static final Logger logger = LoggerFactory.getLogger(SimilarityEngine.class);

    private final GraphStore store;
    private final KeyCodec keyCodec;

    @Autowired
    public SimilarityEngine(GraphStore store, KeyCodec keyCodec) {
        this.store = store;
        this.keyCodec = keyCodec;
    }

    public double cosineSimilarity(String id1, String id2) {
        return cosineSimilarity(id1, id2, null);
    }

    /**
     * Similarity restricted to nouns and adjectives.
     */
    public double conceptSimilarity(String id1, String id2) {
        return cosineSimilarity(id1, id2, CONCEPT_TAGS);
    }

    /**
     * @param tagFilter tags to keep, or null/empty to keep every term. A term is kept when its
     *                  node key contains one of the tags, so {@code noun} also keeps
     *                  {@code noun-pl:cats}.
     * @return {@code dot / (|v1| * |v2|)}, or 0 when either vector is empty after filtering
     */
    public double cosineSimilarity(String id1, String id2, Collection<String> tagFilter) {
        Map<String, Double> vector1 = weightVector(id1, tagFilter);
        Map<String, Double> vector2 = weightVector(id2, tagFilter);

        double sum1 = sumOfSquares(vector1);
        double sum2 = sumOfSquares(vector2);
        if (sum1 == 0.0 || sum2 == 0.0) {
            logger.debug("Zero magnitude comparing {} and {}, similarity is 0", id1, id2);
            return 0.0;
        }

        Map<String, Double> smaller = vector1.size() <= vector2.size() ? vector1 : vector2;
        Map<String, Double> larger = smaller == vector1 ? vector2 : vector1;
        double dot = 0.0;
        for (Map.Entry<String, Double> entry : smaller.entrySet()) {
            Double other = larger.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * other;
            }
        }

        return dot / Math.sqrt(sum1 * sum2);
    }

    private Map<String, Double> weightVector(String documentId, Collection<String> tagFilter) {
        List<ScoredMember> weights = store.zRangeWithScores(keyCodec.weightKey(documentId), 0, -1);
        Map<String, Double> vector = new HashMap<>();
        for (ScoredMember weight : weights) {
            if (tagFilter == null || tagFilter.isEmpty() || matchesAnyTag(weight.getMember(), tagFilter)) {
                vector.put(weight.getMember(), weight.getScore());
            }
        }
        return vector;
    }

    private static boolean matchesAnyTag(String nodeKey, Collection<String> tagFilter) {
        for (String tag : tagFilter) {
            if (nodeKey.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    private static double sumOfSquares(Map<String, Double> vector) {
        double sum = 0.0;
        for (double score : vector.values()) {
            sum += score * score;
        }
        return sum;
    }
}
