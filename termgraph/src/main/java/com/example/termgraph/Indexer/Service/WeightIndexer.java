package com.example.termgraph.Indexer.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.example.termgraph.Indexer.Entities.IndexProgress;
import com.example.termgraph.Indexer.Entities.IndexSummary;
import com.example.termgraph.Indexer.Entities.TfIdfMetrics;
import com.example.termgraph.Store.GraphStore;
import com.example.termgraph.Store.StoreCommandException;
import com.example.termgraph.Store.StoreException;
import com.example.termgraph.utils.KeyCodec;

/**
 * Recomputes TF-IDF weights and stores each score twice: in the document's weight set
 * (term -> score) and in the term's weight set (document id -> score).
 */
@Service
public class WeightIndexer {

    public static final int MAX_CONCURRENT_DOCUMENTS = 8;

    private static final Logger logger = LoggerFactory.getLogger(WeightIndexer.class);

    private final GraphStore store;
    private final KeyCodec keyCodec;
    private final TfIdfCalculator calculator;
    private final Executor executor;

    @Autowired
    public WeightIndexer(GraphStore store, KeyCodec keyCodec, TfIdfCalculator calculator,
                         @Qualifier("weightIndexExecutor") Executor executor) {
        this.store = store;
        this.keyCodec = keyCodec;
        this.calculator = calculator;
        this.executor = executor;
    }

    /**
     * Indexes every term of one document. Every term is attempted even when some fail.
     *
     * @return false when the document has no terms or any term could not be written
     */
    public boolean indexWeights(String documentId) {
        List<String> terms = store.zRange(keyCodec.adjacencyKey(documentId), 0, -1);
        if (terms.isEmpty()) {
            logger.warn("Document {} has no terms to index", documentId);
            return false;
        }

        boolean success = true;
        for (String term : terms) {
            try {
                TfIdfMetrics metrics = calculator.compute(term, documentId);
                store.zAdd(keyCodec.weightKey(documentId), term, metrics.getTfidf());
                store.zAdd(keyCodec.weightKey(term), documentId, metrics.getTfidf());
            } catch (StoreCommandException e) {
                logger.warn("Could not index term {} of document {}: {}", term, documentId, e.getMessage());
                success = false;
            }
        }
        return success;
    }

    /**
     * Indexes every document that has stored content, at most
     * {@value #MAX_CONCURRENT_DOCUMENTS} at a time. {@code progress} is called once per
     * finished document, failed or not, with a strictly increasing count.
     */
    public IndexSummary indexAllWeights(Consumer<IndexProgress> progress) {
        Set<String> contentKeys = store.keys(keyCodec.contentPattern());
        List<String> documentIds = new ArrayList<>(contentKeys.size());
        for (String contentKey : contentKeys) {
            documentIds.add(keyCodec.documentIdFromContentKey(contentKey));
        }

        int total = documentIds.size();
        logger.info("Indexing weights of {} documents", total);

        Semaphore permits = new Semaphore(MAX_CONCURRENT_DOCUMENTS);
        AtomicInteger succeeded = new AtomicInteger(0);
        Object progressLock = new Object();
        int[] count = {0};
        List<CompletableFuture<Void>> futures = new ArrayList<>(total);

        for (String documentId : documentIds) {
            permits.acquireUninterruptibly();
            try {
                futures.add(CompletableFuture.runAsync(() -> {
                    try {
                        if (indexDocumentSafely(documentId)) {
                            succeeded.incrementAndGet();
                        }
                        synchronized (progressLock) {
                            count[0]++;
                            progress.accept(new IndexProgress(total, count[0],
                                    (int) Math.round((count[0] * 100.0) / total)));
                        }
                    } finally {
                        permits.release();
                    }
                }, executor));
            } catch (RuntimeException e) {
                permits.release();
                throw e;
            }
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        int completed;
        synchronized (progressLock) {
            completed = count[0];
        }
        logger.info("Weight indexing finished: {}/{} documents indexed successfully", succeeded.get(), total);
        return new IndexSummary(total, completed, succeeded.get());
    }

    private boolean indexDocumentSafely(String documentId) {
        try {
            return indexWeights(documentId);
        } catch (StoreException e) {
            logger.error("Indexing document {} failed: {}", documentId, e.getMessage());
            return false;
        }
    }
}
