package com.example.termgraph.Graph.Service;

/**
 * How ingestion hands its increments to the store.
 */
public enum WriteMode {
    /** Flush after every node: each node's increments are applied before the next is issued. */
    IMMEDIATE,
    /** Flush once per document as a single pipelined batch. */
    BUFFERED
}
