package com.example.termgraph.Graph.Entities;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import lombok.Getter;

/**
 * An original token together with the nodes derived from it (a stem, the parts of a
 * compound). Ingestion chains the original first, then the children in order.
 */
@Getter
public class GroupNode extends NodeDescriptor {

    private final LeafNode orig;
    private final List<LeafNode> children;

    public GroupNode(LeafNode orig, List<LeafNode> children, boolean filtered) {
        super(filtered);
        this.orig = Objects.requireNonNull(orig, "orig");
        this.children = children == null ? Collections.emptyList() : List.copyOf(children);
    }

    public static GroupNode of(LeafNode orig, List<LeafNode> children) {
        return new GroupNode(orig, children, false);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitGroup(this);
    }

    @Override
    public String toString() {
        return orig + " -> " + children + (isFiltered() ? " (filtered)" : "");
    }
}
