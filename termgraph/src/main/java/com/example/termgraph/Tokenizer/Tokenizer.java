package com.example.termgraph.Tokenizer;

import java.util.List;

import com.example.termgraph.Graph.Entities.NodeDescriptor;

/**
 * Turns raw document text into the ordered node sequence consumed by ingestion.
 * Implementations must not reorder tokens: the order defines the next edges.
 */
public interface Tokenizer {

    List<NodeDescriptor> tokenize(String text);
}
