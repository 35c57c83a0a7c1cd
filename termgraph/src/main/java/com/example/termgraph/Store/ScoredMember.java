package com.example.termgraph.Store;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A sorted-set member together with its score.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ScoredMember {
    private final String member;
    private final double score;
}
