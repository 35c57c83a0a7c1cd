package com.example.termgraph.Indexer.Service;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.example.termgraph.Indexer.Entities.TfIdfMetrics;
import com.example.termgraph.Store.GraphStore;
import com.example.termgraph.Store.ReadCommand;
import com.example.termgraph.utils.KeyCodec;

/**
 * Computes term frequency / inverse document frequency from the raw graph counters.
 *
 * <ul>
 * <li>{@code tf = 1 + log10(rawtf)}, or 0 when the term never occurred</li>
 * <li>{@code idf = log10(n / df)}, or 0 when no document contains the term</li>
 * <li>{@code tfidf = tf * idf}</li>
 * </ul>
 */
@Service
public class TfIdfCalculator {

    private static final Logger logger = LoggerFactory.getLogger(TfIdfCalculator.class);

    private final GraphStore store;
    private final KeyCodec keyCodec;

    @Autowired
    public TfIdfCalculator(GraphStore store, KeyCodec keyCodec) {
        this.store = store;
        this.keyCodec = keyCodec;
    }

    /**
     * Metrics of a term over the whole corpus.
     */
    public TfIdfMetrics compute(String term) {
        return compute(term, null);
    }

    /**
     * Metrics of a term, relative to {@code documentId} when it is not null. All counters are
     * read in one atomic round trip.
     */
    public TfIdfMetrics compute(String term, String documentId) {
        List<ReadCommand> reads = new ArrayList<>(4);
        reads.add(ReadCommand.get(keyCodec.totalKey(term)));
        reads.add(ReadCommand.get(keyCodec.totalDocumentsKey()));
        reads.add(ReadCommand.zCard(keyCodec.adjacencyKey(term)));
        if (documentId != null) {
            reads.add(ReadCommand.zScore(keyCodec.adjacencyKey(documentId), term));
        }

        List<Object> results = store.multiRead(reads);

        long rawtf = toLong(results.get(0));
        long n = toLong(results.get(1));
        long df = toLong(results.get(2));
        if (documentId != null) {
            rawtf = toLong(results.get(3));
        }

        double tf = rawtf > 0 ? 1 + Math.log10(rawtf) : 0.0;
        double idf = (df > 0 && n > 0) ? Math.log10((double) n / df) : 0.0;
        double tfidf = tf * idf;

        if (logger.isDebugEnabled()) {
            logger.debug("tfidf({}, {}) rawtf={} df={} n={} -> {}", term, documentId, rawtf, df, n, tfidf);
        }
        return new TfIdfMetrics(term, rawtf, df, n, idf, tf, tfidf);
    }

    private static long toLong(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number) {
            return Math.round(((Number) value).doubleValue());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return 0L;
        }
        return Math.round(Double.parseDouble(text));
    }
}
