package com.example.termgraph.Query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.example.termgraph.Store.GraphStore;
import com.example.termgraph.Store.ScoredMember;
import com.example.termgraph.Store.StoreCommandException;
import com.example.termgraph.config.GraphConfig;
import com.example.termgraph.utils.KeyCodec;

/**
 * Ranks documents by the sum of their TF-IDF weights over the query terms.
 *
 * <p>A bare term such as {@code cat} expands to every node key ending in it
 * ({@code noun:cat}, {@code verb:cat}, ...); a term containing the separator is used as a
 * node key directly. Equal scores keep the order in which documents were first met: resolved
 * terms in order, and within a term the order of its weight set.
 */
@Service
public class SearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(SearchEngine.class);

    private final GraphStore store;
    private final KeyCodec keyCodec;
    private final int defaultSearchLimit;

    @Autowired
    public SearchEngine(GraphStore store, KeyCodec keyCodec, GraphConfig config) {
        this(store, keyCodec, config.getSearchLimit());
    }

    public SearchEngine(GraphStore store, KeyCodec keyCodec, int defaultSearchLimit) {
        this.store = store;
        this.keyCodec = keyCodec;
        this.defaultSearchLimit = defaultSearchLimit;
    }

    public SearchResult search(List<String> terms) {
        return search(terms, SearchOptions.defaults());
    }

    public SearchResult search(List<String> terms, SearchOptions options) {
        int searchLimit = defaultSearchLimit;
        if (options != null && options.getSearchLimit() != null && options.getSearchLimit() > 0) {
            searchLimit = options.getSearchLimit();
        }

        List<String> resolved = resolveTerms(terms);
        if (resolved.isEmpty()) {
            logger.debug("No graph keys found for {}", terms);
            return SearchResult.empty();
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        for (String term : resolved) {
            List<ScoredMember> weights;
            try {
                weights = store.zRevRangeWithScores(keyCodec.weightKey(term), 0, searchLimit - 1);
            } catch (StoreCommandException e) {
                logger.warn("Skipping term {}: {}", term, e.getMessage());
                continue;
            }
            for (ScoredMember weight : weights) {
                scores.merge(weight.getMember(), weight.getScore(), Double::sum);
            }
        }

        List<String> rankedIds = new ArrayList<>(scores.keySet());
        rankedIds.sort(Comparator.comparingDouble((String id) -> scores.get(id)).reversed());
        logger.debug("Search {} resolved to {} keys and matched {} documents", terms, resolved.size(), rankedIds.size());
        return new SearchResult(rankedIds, scores);
    }

    /**
     * Expands bare terms into the node keys ending with them, skipping bookkeeping keys.
     * Matches of one term are sorted so results do not depend on store key order.
     */
    public List<String> resolveTerms(List<String> terms) {
        List<String> resolved = new ArrayList<>();
        for (String term : terms) {
            if (term == null || term.isEmpty()) {
                continue;
            }
            if (keyCodec.isQualified(term)) {
                resolved.add(term);
                continue;
            }
            Set<String> keys;
            try {
                keys = store.keys(keyCodec.termPattern(term));
            } catch (StoreCommandException e) {
                logger.warn("Could not resolve term {}: {}", term, e.getMessage());
                continue;
            }
            List<String> matches = new ArrayList<>();
            for (String key : keys) {
                if (!keyCodec.isReservedPrefix(key)) {
                    matches.add(keyCodec.stripNamespace(key));
                }
            }
            Collections.sort(matches);
            resolved.addAll(matches);
        }
        return resolved;
    }
}
