package com.example.termgraph.Indexer.Entities;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class TfIdfMetrics {
    private final String key;
    // document weight when computed for a document, corpus frequency otherwise
    private final long rawtf;
    private final long df;
    private final long n;
    private final double idf;
    private final double tf;
    private final double tfidf;
}
