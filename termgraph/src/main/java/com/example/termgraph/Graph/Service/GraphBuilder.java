package com.example.termgraph.Graph.Service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.example.termgraph.Graph.Entities.GroupNode;
import com.example.termgraph.Graph.Entities.LeafNode;
import com.example.termgraph.Graph.Entities.NodeDescriptor;
import com.example.termgraph.Store.GraphStore;
import com.example.termgraph.Store.WriteBatch;
import com.example.termgraph.config.GraphConfig;
import com.example.termgraph.utils.KeyCodec;

/**
 * Turns the node sequence of a document into frequency counters, symmetric
 * document/node cooccurrence edges and directed "next" edges.
 */
@Service
public class GraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GraphBuilder.class);

    private final GraphStore store;
    private final KeyCodec keyCodec;
    private final WriteMode writeMode;

    @Autowired
    public GraphBuilder(GraphStore store, KeyCodec keyCodec, GraphConfig config) {
        this(store, keyCodec, config.getWriteMode());
    }

    public GraphBuilder(GraphStore store, KeyCodec keyCodec, WriteMode writeMode) {
        this.store = store;
        this.keyCodec = keyCodec;
        this.writeMode = writeMode;
    }

    /**
     * Stores the raw text of a document, replacing any earlier version.
     */
    public void storeContent(String documentId, String text) {
        store.set(keyCodec.contentKey(documentId), text);
    }

    /**
     * Counts the document once and walks its nodes in order. Filtered leaves and groups are
     * skipped without breaking the chain of previous keys; groups are flattened into the
     * chain (original first, then children).
     */
    public void ingest(String documentId, List<? extends NodeDescriptor> nodes) {
        WriteBatch batch = store.newBatch();
        batch.incrBy(keyCodec.totalDocumentsKey(), 1);
        flushIfImmediate(batch);

        ChainWalker walker = new ChainWalker(documentId, batch);
        for (NodeDescriptor node : nodes) {
            node.accept(walker);
        }
        batch.flush();
        logger.debug("Ingested document {} with {} graph nodes", documentId, walker.count);
    }

    /**
     * Increments the frequency of {@code key}, the edge between {@code documentId} and
     * {@code key} in both directions, and the next edge {@code prevKey -> key} when
     * {@code prevKey} is present.
     *
     * @return {@code key}, to be used as the next previous key
     */
    public String incrementEdges(String documentId, String key, String prevKey) {
        WriteBatch batch = store.newBatch();
        incrementEdges(batch, documentId, key, prevKey);
        batch.flush();
        return key;
    }

    private String incrementEdges(WriteBatch batch, String documentId, String key, String prevKey) {
        batch.incrBy(keyCodec.totalKey(key), 1);
        batch.zIncrBy(keyCodec.adjacencyKey(documentId), key, 1);
        batch.zIncrBy(keyCodec.adjacencyKey(key), documentId, 1);
        if (prevKey != null) {
            batch.zIncrBy(keyCodec.nextKey(prevKey), key, 1);
        }
        flushIfImmediate(batch);
        return key;
    }

    private void flushIfImmediate(WriteBatch batch) {
        if (writeMode == WriteMode.IMMEDIATE) {
            batch.flush();
        }
    }

    private class ChainWalker implements NodeDescriptor.Visitor<Void> {

        private final String documentId;
        private final WriteBatch batch;
        private String previousKey;
        private int count;

        ChainWalker(String documentId, WriteBatch batch) {
            this.documentId = documentId;
            this.batch = batch;
        }

        @Override
        public Void visitLeaf(LeafNode leaf) {
            if (!leaf.isFiltered()) {
                chain(leaf);
            }
            return null;
        }

        @Override
        public Void visitGroup(GroupNode group) {
            if (group.isFiltered()) {
                return null;
            }
            if (!group.getOrig().isFiltered()) {
                chain(group.getOrig());
            }
            for (LeafNode child : group.getChildren()) {
                if (!child.isFiltered()) {
                    chain(child);
                }
            }
            return null;
        }

        private void chain(LeafNode leaf) {
            previousKey = incrementEdges(batch, documentId, keyCodec.nodeKey(leaf), previousKey);
            count++;
        }
    }
}
