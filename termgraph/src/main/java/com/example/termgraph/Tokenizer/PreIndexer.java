package com.example.termgraph.Tokenizer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Scanner;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.termgraph.Graph.Entities.GroupNode;
import com.example.termgraph.Graph.Entities.LeafNode;
import com.example.termgraph.Graph.Entities.NodeDescriptor;

import opennlp.tools.stemmer.PorterStemmer;

/**
 * Default tokenizer: strips markup, splits into lower-case words, filters stop words and
 * stems with the Porter stemmer. It does no part-of-speech tagging, so every surface word is
 * tagged {@value #WORD_TAG} and every stem {@value #STEM_TAG}; a tagger can be plugged in by
 * declaring another {@link Tokenizer} bean.
 */
@Component
public class PreIndexer implements Tokenizer {

    public static final String WORD_TAG = "word";
    public static final String STEM_TAG = "stem";

    private static final Logger logger = LoggerFactory.getLogger(PreIndexer.class);

    private static final String STOP_WORDS_RESOURCE = "stopWords.txt";

    // words, identifiers with underscores, numbers with an optional fraction
    private static final Pattern TOKEN_PATTERN = Pattern.compile("[\\p{L}\\p{N}_]+(?:[.'][\\p{L}\\p{N}_]+)*");

    private final Set<String> stopWords;

    public PreIndexer() {
        this(loadStopWords(STOP_WORDS_RESOURCE));
    }

    public PreIndexer(Set<String> stopWords) {
        this.stopWords = Collections.unmodifiableSet(new HashSet<>(stopWords));
    }

    @Override
    public List<NodeDescriptor> tokenize(String text) {
        List<NodeDescriptor> nodes = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return nodes;
        }

        PorterStemmer porterStemmer = new PorterStemmer();
        Matcher matcher = TOKEN_PATTERN.matcher(cleanHTML(text).toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (isFiltered(word)) {
                nodes.add(LeafNode.filtered(WORD_TAG, word));
                continue;
            }

            // programming identifiers and numbers are kept as they are
            if (word.matches(".*[^a-z].*") || word.length() <= 2) {
                nodes.add(LeafNode.of(WORD_TAG, word));
                continue;
            }

            String stemmed = porterStemmer.stem(word);
            if (stemmed.isEmpty() || stemmed.equals(word)) {
                nodes.add(LeafNode.of(WORD_TAG, word));
            } else {
                nodes.add(GroupNode.of(LeafNode.of(WORD_TAG, word), List.of(LeafNode.of(STEM_TAG, stemmed))));
            }
        }
        return nodes;
    }

    public String cleanHTML(String paragraph) {
        Document doc = Jsoup.parse(paragraph);
        doc.select("style, script, meta, link, noscript, svg, canvas").remove();
        return doc.text().replaceAll("\\s+", " ").trim();
    }

    public Set<String> getStopWords() {
        return stopWords;
    }

    private boolean isFiltered(String word) {
        return word.length() <= 1 || stopWords.contains(word);
    }

    static Set<String> loadStopWords(String resource) {
        Set<String> words = new HashSet<>();
        try (InputStream inputStream = PreIndexer.class.getClassLoader().getResourceAsStream(resource)) {
            if (inputStream == null) {
                throw new IllegalStateException("Resource file " + resource + " not found");
            }
            try (Scanner scanner = new Scanner(inputStream, StandardCharsets.UTF_8)) {
                while (scanner.hasNextLine()) {
                    String word = scanner.nextLine().trim().toLowerCase(Locale.ROOT);
                    if (!word.isEmpty()) {
                        words.add(word);
                    }
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + resource, e);
        }
        logger.debug("Loaded {} stop words", words.size());
        return words;
    }
}
