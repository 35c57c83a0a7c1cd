package com.example.termgraph.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.example.termgraph.Graph.Entities.LeafNode;

/**
 * Builds and parses the namespaced keys of the graph. Immutable and store independent.
 *
 * <p>Reserved prefixes: {@code t} (totals), {@code <} (next edges), {@code w} (weights)
 * and {@code ^} (content). A key like {@code t:noun:cat} holds the corpus frequency of
 * {@code noun:cat}; with namespace {@code ns} it becomes {@code ns:t:noun:cat}.
 */
public final class KeyCodec {

    public static final String TOTAL = "t";
    public static final String NEXT = "<";
    public static final String WEIGHT = "w";
    public static final String CONTENT = "^";

    private final String namespacePrefix;
    private final String separator;
    private final List<String> reservedPrefixes;

    public KeyCodec(String namespacePrefix, String separator) {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("Key separator must not be empty");
        }
        this.namespacePrefix = namespacePrefix == null ? "" : namespacePrefix;
        this.separator = separator;
        this.reservedPrefixes = List.of(
                format(TOTAL) + separator,
                format(NEXT) + separator,
                format(CONTENT) + separator,
                format(WEIGHT) + separator);
    }

    public String getNamespacePrefix() {
        return namespacePrefix;
    }

    public String getSeparator() {
        return separator;
    }

    /**
     * Joins the namespace prefix and the given parts. A {@link LeafNode} contributes its
     * lower-cased tag followed by its distinct value or lower-cased term; a non-empty
     * {@link CharSequence} is used verbatim; null and empty parts are skipped.
     */
    public String format(Object... parts) {
        List<String> args = new ArrayList<>();
        if (!namespacePrefix.isEmpty()) {
            args.add(namespacePrefix);
        }
        for (Object part : parts) {
            if (part instanceof LeafNode) {
                LeafNode leaf = (LeafNode) part;
                args.add(leaf.getTag().toLowerCase(Locale.ROOT));
                args.add(distinctOrTerm(leaf));
            } else if (part instanceof CharSequence) {
                if (((CharSequence) part).length() > 0) {
                    args.add(part.toString());
                }
            } else if (part != null) {
                throw new IllegalArgumentException("Cannot format key part of type " + part.getClass().getName());
            }
        }
        return String.join(separator, args);
    }

    /**
     * Node key without namespace, as stored in sorted-set members, e.g. {@code noun:cat}.
     */
    public String nodeKey(LeafNode leaf) {
        return leaf.getTag().toLowerCase(Locale.ROOT) + separator + distinctOrTerm(leaf);
    }

    public boolean isReservedPrefix(String key) {
        for (String prefix : reservedPrefixes) {
            if (key.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A term already containing the separator is treated as a node key.
     */
    public boolean isQualified(String term) {
        return term.contains(separator);
    }

    public String totalDocumentsKey() {
        return format(TOTAL);
    }

    public String totalKey(String nodeKey) {
        return format(TOTAL, nodeKey);
    }

    /**
     * Adjacency set of a document id or of a node key.
     */
    public String adjacencyKey(String idOrNodeKey) {
        return format(idOrNodeKey);
    }

    public String nextKey(String nodeKey) {
        return format(NEXT, nodeKey);
    }

    public String weightKey(String idOrNodeKey) {
        return format(WEIGHT, idOrNodeKey);
    }

    public String contentKey(String documentId) {
        return format(CONTENT, documentId);
    }

    public String contentPattern() {
        return globPrefix() + escapeGlob(CONTENT) + escapeGlob(separator) + "*";
    }

    /**
     * Wildcard pattern matching every key that ends with {@code term}. Glob characters in
     * {@code term} match only themselves.
     */
    public String termPattern(String term) {
        return globPrefix() + "*" + escapeGlob(separator) + escapeGlob(term);
    }

    /**
     * Backslash-escapes the Redis glob characters {@code * ? [ ] \}.
     */
    public static String escapeGlob(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    public String documentIdFromContentKey(String contentKey) {
        String prefix = format(CONTENT) + separator;
        if (!contentKey.startsWith(prefix)) {
            throw new IllegalArgumentException("Not a content key: " + contentKey);
        }
        return contentKey.substring(prefix.length());
    }

    public String stripNamespace(String key) {
        if (namespacePrefix.isEmpty()) {
            return key;
        }
        String prefix = namespacePrefix + separator;
        return key.startsWith(prefix) ? key.substring(prefix.length()) : key;
    }

    private String globPrefix() {
        return namespacePrefix.isEmpty() ? "" : escapeGlob(namespacePrefix) + escapeGlob(separator);
    }

    private static String distinctOrTerm(LeafNode leaf) {
        String distinct = leaf.getDistinct();
        if (distinct != null && !distinct.isEmpty()) {
            return distinct;
        }
        return leaf.getTerm().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyCodec)) {
            return false;
        }
        KeyCodec other = (KeyCodec) o;
        return namespacePrefix.equals(other.namespacePrefix) && separator.equals(other.separator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespacePrefix, separator);
    }

    @Override
    public String toString() {
        return "KeyCodec[namespace=" + namespacePrefix + ", separator=" + separator + "]";
    }
}
