package com.example.termgraph.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.example.termgraph.Graph.Service.WriteMode;
import com.example.termgraph.Indexer.Service.WeightIndexer;
import com.example.termgraph.utils.KeyCodec;

@Configuration
public class GraphConfig {

    private final String namespacePrefix;
    private final String separator;
    private final int searchLimit;
    private final WriteMode writeMode;

    public GraphConfig(@Value("${graph.namespace-prefix:}") String namespacePrefix,
                       @Value("${graph.separator::}") String separator,
                       @Value("${graph.search-limit:100}") int searchLimit,
                       @Value("${graph.ingest.write-mode:BUFFERED}") WriteMode writeMode) {
        if (searchLimit <= 0) {
            throw new IllegalArgumentException("graph.search-limit must be positive, got " + searchLimit);
        }
        this.namespacePrefix = namespacePrefix;
        this.separator = separator;
        this.searchLimit = searchLimit;
        this.writeMode = writeMode;
    }

    @Bean
    public KeyCodec keyCodec() {
        return new KeyCodec(namespacePrefix, separator);
    }

    @Bean
    public ThreadPoolTaskExecutor weightIndexExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(WeightIndexer.MAX_CONCURRENT_DOCUMENTS);
        executor.setMaxPoolSize(WeightIndexer.MAX_CONCURRENT_DOCUMENTS);
        executor.setThreadNamePrefix("weight-indexer-");
        executor.initialize();
        return executor;
    }

    public String getNamespacePrefix() {
        return namespacePrefix;
    }

    public String getSeparator() {
        return separator;
    }

    public int getSearchLimit() {
        return searchLimit;
    }

    public WriteMode getWriteMode() {
        return writeMode;
    }
}
