package com.example.termgraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import com.example.termgraph.Store.GraphStore;
import com.example.termgraph.utils.KeyCodec;

import io.github.cdimascio.dotenv.Dotenv;

@SpringBootApplication
public class TermGraphApplication implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(TermGraphApplication.class);

    @Autowired
    private GraphStore graphStore;

    @Autowired
    private KeyCodec keyCodec;

    public static void main(String[] args) {
        Dotenv dotenv = Dotenv.configure()
                .directory(".")
                .ignoreIfMissing()
                .load();

        dotenv.entries().forEach(entry -> System.setProperty(entry.getKey(), entry.getValue()));
        SpringApplication.run(TermGraphApplication.class, args);
    }

    @Override
    public void run(String... args) {
        logger.info("Checking graph store connection...");
        // an unreachable store is fatal: StoreConnectionException stops the startup
        graphStore.ping();
        logger.info("Graph store ready ({})", keyCodec);
    }
}
