package io.fullerstack.domaintrie;

import java.util.Map;
import java.util.Optional;

/**
 * Longest-suffix lookup over registered domain suffixes.
 *
 * <p>Suffixes are stored label by label, top-level label first, so that
 * {@code "api.google.com"} lives at {@code com -> google -> api}. A query walks
 * the same way and stops at the first label with no matching child.
 *
 * <h3>Example Usage:</h3>
 * <pre>{@code
 * DomainSuffixTrie<String> trie = DomainSuffixTries.newSynchronizedTrie();
 * trie.insert("google.com", "google");
 * trie.insert("map.google.com", "google-maps");
 *
 * trie.matchValue("test.google.com");      // Optional[google]
 * trie.matchValue("x.map.google.com");     // Optional[google-maps]
 * trie.match("test.baidu.com").isRoot();   // true
 * }</pre>
 *
 * <p>The node accessors ({@link #label()}, {@link #path()}, {@link #value()},
 * {@link #setValue(Object)}, {@link #child(String)}, {@link #children()})
 * address the trie's root node.
 *
 * @param <T> the type of value attached to registered suffixes
 * @see DomainSuffixTree
 * @see SynchronizedDomainSuffixTree
 */
public interface DomainSuffixTrie<T> {

    /**
     * Registers a suffix, creating any missing nodes along its path, and
     * attaches {@code value} to its last node. Re-inserting a suffix replaces
     * its value.
     *
     * @param suffix the dot-separated suffix (e.g., "map.google.com")
     * @param value the value to attach, never null
     * @throws EmptySuffixException if {@code suffix} is the empty string
     */
    void insert(String suffix, T value);

    /**
     * Finds the deepest existing node along the query's label path.
     *
     * <p>The result is decided by node existence, not by value presence: with
     * only {@code "api.google.com"} registered, {@code "foo.google.com"} matches
     * the {@code google} node, which carries no value.
     *
     * @param domain the domain to look up (e.g., "www.google.com")
     * @return the matched node, or the root if not even the top-level label matches
     */
    SuffixNode<T> match(String domain);

    /**
     * Value of the node returned by {@link #match(String)}.
     *
     * @param domain the domain to look up
     * @return the matched node's value, or empty if it has none
     */
    Optional<T> matchValue(String domain);

    /**
     * Finds the deepest node along the query's label path that carries a value.
     * A value set on the root is returned when nothing more specific is found.
     *
     * @param domain the domain to look up
     * @return the most specific registered node, or empty if none applies
     */
    Optional<SuffixNode<T>> matchRegistered(String domain);

    /**
     * Checks whether exactly this suffix was registered with a value.
     *
     * @param suffix the suffix to check
     * @return true if a node exists at that path and carries a value
     */
    boolean contains(String suffix);

    /**
     * Snapshot of all registered suffixes and their values.
     *
     * @return map of suffix path to value (never null)
     */
    Map<String, T> entries();

    String label();

    String path();

    Optional<T> value();

    Optional<T> setValue(T value);

    Optional<T> clearValue();

    Optional<SuffixNode<T>> child(String label);

    Map<String, SuffixNode<T>> children();
}
