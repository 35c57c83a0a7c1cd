package com.example.termgraph.service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.example.termgraph.Graph.Entities.NodeDescriptor;
import com.example.termgraph.Graph.Service.GraphBuilder;
import com.example.termgraph.Indexer.Entities.IndexProgress;
import com.example.termgraph.Indexer.Entities.IndexSummary;
import com.example.termgraph.Indexer.Entities.TfIdfMetrics;
import com.example.termgraph.Indexer.Service.TfIdfCalculator;
import com.example.termgraph.Indexer.Service.WeightIndexer;
import com.example.termgraph.Query.SearchEngine;
import com.example.termgraph.Query.SearchOptions;
import com.example.termgraph.Query.SearchResult;
import com.example.termgraph.Ranker.Service.SimilarityEngine;
import com.example.termgraph.Store.GraphStore;
import com.example.termgraph.Tokenizer.Tokenizer;
import com.example.termgraph.utils.KeyCodec;
import com.example.termgraph.utils.ProgressBarUtil;

/**
 * Entry point for an application layer: ingestion, indexing, search and similarity over one
 * document graph.
 */
@Service
public class DocumentGraphService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentGraphService.class);

    private final GraphStore store;
    private final KeyCodec keyCodec;
    private final Tokenizer tokenizer;
    private final GraphBuilder graphBuilder;
    private final TfIdfCalculator tfIdfCalculator;
    private final WeightIndexer weightIndexer;
    private final SearchEngine searchEngine;
    private final SimilarityEngine similarityEngine;

    @Autowired
    public DocumentGraphService(GraphStore store, KeyCodec keyCodec, Tokenizer tokenizer,
                                GraphBuilder graphBuilder, TfIdfCalculator tfIdfCalculator,
                                WeightIndexer weightIndexer, SearchEngine searchEngine,
                                SimilarityEngine similarityEngine) {
        this.store = store;
        this.keyCodec = keyCodec;
        this.tokenizer = tokenizer;
        this.graphBuilder = graphBuilder;
        this.tfIdfCalculator = tfIdfCalculator;
        this.weightIndexer = weightIndexer;
        this.searchEngine = searchEngine;
        this.similarityEngine = similarityEngine;
    }

    /**
     * Stores the text of a document and adds its tokens to the graph. Weights are not
     * updated until the document is re-indexed. Nothing is stored when tokenizing fails.
     *
     * @throws IllegalArgumentException if the id is empty or contains the key separator,
     *                                  which would make its adjacency set look like a node key
     */
    public void ingestDocument(String documentId, String text) {
        if (documentId == null || documentId.isEmpty()) {
            throw new IllegalArgumentException("Document id must not be empty");
        }
        if (documentId.contains(keyCodec.getSeparator())) {
            throw new IllegalArgumentException("Document id must not contain the key separator '"
                    + keyCodec.getSeparator() + "': " + documentId);
        }
        List<NodeDescriptor> nodes = tokenizer.tokenize(text);
        graphBuilder.storeContent(documentId, text);
        graphBuilder.ingest(documentId, nodes);
        logger.info("Ingested document {} ({} tokens)", documentId, nodes.size());
    }

    public SearchResult search(List<String> terms) {
        return searchEngine.search(terms);
    }

    public SearchResult search(List<String> terms, SearchOptions options) {
        return searchEngine.search(terms, options);
    }

    /**
     * Raw texts in the order of {@code documentIds}, null for unknown ids.
     */
    public List<String> getContents(List<String> documentIds) {
        List<String> keys = new ArrayList<>(documentIds.size());
        for (String documentId : documentIds) {
            keys.add(keyCodec.contentKey(documentId));
        }
        return store.mGet(keys);
    }

    public boolean indexWeights(String documentId) {
        return weightIndexer.indexWeights(documentId);
    }

    public IndexSummary indexAllWeights(Consumer<IndexProgress> progress) {
        return weightIndexer.indexAllWeights(progress);
    }

    /**
     * Re-indexes the whole corpus, logging a progress bar about every ten percent.
     */
    public IndexSummary indexAllWeights() {
        return weightIndexer.indexAllWeights(progress -> {
            int frequency = ProgressBarUtil.getUpdateFrequency(progress.getTotal(), 10);
            if (progress.getCount() % frequency == 0 || progress.getCount() == progress.getTotal()) {
                logger.info("Indexing weights {}", ProgressBarUtil.renderProgressBar(
                        progress.getCount(), progress.getTotal(), ProgressBarUtil.DEFAULT_BAR_LENGTH));
            }
        });
    }

    public double cosineSimilarity(String id1, String id2) {
        return similarityEngine.cosineSimilarity(id1, id2);
    }

    public double conceptSimilarity(String id1, String id2) {
        return similarityEngine.conceptSimilarity(id1, id2);
    }

    public TfIdfMetrics computeTfIdf(String term) {
        return tfIdfCalculator.compute(term);
    }

    public TfIdfMetrics computeTfIdf(String term, String documentId) {
        return tfIdfCalculator.compute(term, documentId);
    }
}
