package com.example.termgraph.Graph.Entities;

/**
 * One element of a tokenized document: either a {@link LeafNode} or a {@link GroupNode}.
 * Consumers dispatch through {@link #accept(Visitor)} so both shapes are always handled.
 */
public abstract class NodeDescriptor {

    private final boolean filtered;

    protected NodeDescriptor(boolean filtered) {
        this.filtered = filtered;
    }

    public boolean isFiltered() {
        return filtered;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {

        R visitLeaf(LeafNode leaf);

        R visitGroup(GroupNode group);
    }
}
