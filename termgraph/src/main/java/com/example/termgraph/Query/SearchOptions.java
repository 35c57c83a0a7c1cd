package com.example.termgraph.Query;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class SearchOptions {
    // entries read per term weight set; null means the configured default
    private Integer searchLimit;

    public SearchOptions() {
    }

    public SearchOptions(Integer searchLimit) {
        this.searchLimit = searchLimit;
    }

    public static SearchOptions defaults() {
        return new SearchOptions();
    }
}
