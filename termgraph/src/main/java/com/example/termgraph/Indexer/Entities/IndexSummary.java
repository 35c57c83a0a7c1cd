package com.example.termgraph.Indexer.Entities;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class IndexSummary {
    private final int total;
    // completed attempts, successful or not
    private final int count;
    private final int succeeded;
}
