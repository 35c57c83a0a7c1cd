package com.example.termgraph.Query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Document ids ranked by descending summed weight, with the summed weight of each id.
 */
public class SearchResult {

    private static final SearchResult EMPTY = new SearchResult(Collections.emptyList(), Collections.emptyMap());

    private final List<String> rankedIds;
    private final Map<String, Double> scores;

    public SearchResult(List<String> rankedIds, Map<String, Double> scores) {
        this.rankedIds = List.copyOf(rankedIds);
        this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public static SearchResult empty() {
        return EMPTY;
    }

    public List<String> getRankedIds() {
        return rankedIds;
    }

    public Map<String, Double> getScores() {
        return scores;
    }

    public double getScore(String documentId) {
        return scores.getOrDefault(documentId, 0.0);
    }

    public boolean isEmpty() {
        return rankedIds.isEmpty();
    }

    public int getTotalResults() {
        return rankedIds.size();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("Total results: ").append(getTotalResults()).append("\n");
        for (String id : rankedIds) {
            builder.append(id).append(" -> ").append(scores.get(id)).append("\n");
        }
        return builder.toString();
    }
}
