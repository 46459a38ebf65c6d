package io.fullerstack.domaintrie;

import io.fullerstack.domaintrie.config.TrieConfig;
import lombok.experimental.UtilityClass;

/**
 * Entry points for creating domain suffix tries.
 *
 * <p><b>Choosing an implementation:</b>
 * <table border="1">
 * <tr>
 *   <th>Factory method</th>
 *   <th>Concurrent reads</th>
 *   <th>Concurrent writes</th>
 *   <th>Best For</th>
 * </tr>
 * <tr>
 *   <td>{@link #newTrie()}</td>
 *   <td>No</td>
 *   <td>No</td>
 *   <td>Single-threaded construction and lookup</td>
 * </tr>
 * <tr>
 *   <td>{@link #newSynchronizedTrie()}</td>
 *   <td>Yes (shared lock)</td>
 *   <td>Serialized (exclusive lock)</td>
 *   <td>Shared lookups with occasional registration</td>
 * </tr>
 * </table>
 */
@UtilityClass
public class DomainSuffixTries {

    /**
     * Creates an unsynchronized trie.
     *
     * @param <T> the type of value attached to registered suffixes
     * @return a new empty trie
     */
    public static <T> DomainSuffixTrie<T> newTrie() {
        return new DomainSuffixTree<>();
    }

    /**
     * Creates a thread-safe trie configured from {@link TrieConfig#global()}.
     *
     * @param <T> the type of value attached to registered suffixes
     * @return a new empty trie
     */
    public static <T> DomainSuffixTrie<T> newSynchronizedTrie() {
        return new SynchronizedDomainSuffixTree<>();
    }

    /**
     * Creates a thread-safe trie with an explicit configuration.
     *
     * @param config trie configuration, e.g. {@code TrieConfig.forTrie("blocklist")}
     * @param <T> the type of value attached to registered suffixes
     * @return a new empty trie
     */
    public static <T> DomainSuffixTrie<T> newSynchronizedTrie(TrieConfig config) {
        return new SynchronizedDomainSuffixTree<>(config);
    }
}
