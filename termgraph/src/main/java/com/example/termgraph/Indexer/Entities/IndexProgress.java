package com.example.termgraph.Indexer.Entities;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class IndexProgress {
    private final int total;
    private final int count;
    private final int percent;
}
