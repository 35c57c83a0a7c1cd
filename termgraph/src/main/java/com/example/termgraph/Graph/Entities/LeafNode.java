package com.example.termgraph.Graph.Entities;

import java.util.Objects;

import lombok.Getter;

/**
 * A tagged term, e.g. tag {@code noun} and term {@code Cat}. When {@code distinct} is set it
 * replaces the lower-cased term in the node key.
 */
@Getter
public class LeafNode extends NodeDescriptor {

    private final String tag;
    private final String term;
    private final String distinct;

    public LeafNode(String tag, String term, String distinct, boolean filtered) {
        super(filtered);
        this.tag = Objects.requireNonNull(tag, "tag");
        this.term = Objects.requireNonNull(term, "term");
        this.distinct = distinct;
    }

    public static LeafNode of(String tag, String term) {
        return new LeafNode(tag, term, null, false);
    }

    public static LeafNode filtered(String tag, String term) {
        return new LeafNode(tag, term, null, true);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLeaf(this);
    }

    @Override
    public String toString() {
        return tag + "/" + term + (isFiltered() ? " (filtered)" : "");
    }
}
