/**
 * Longest-suffix matching of domain names.
 * <p>
 * Registered suffixes are kept in a trie keyed by dot-separated labels,
 * top-level label first. A lookup walks the query's labels from the right and
 * stops at the first label without a matching child; the last node reached is
 * the match.
 * <p>
 * <b>Key Classes:</b>
 * <ul>
 *   <li>{@link io.fullerstack.domaintrie.DomainSuffixTrie} - operations shared by both implementations</li>
 *   <li>{@link io.fullerstack.domaintrie.DomainSuffixTree} - unsynchronized trie</li>
 *   <li>{@link io.fullerstack.domaintrie.SynchronizedDomainSuffixTree} - whole-tree read/write lock over a tree</li>
 *   <li>{@link io.fullerstack.domaintrie.SuffixNode} - one label position, optionally carrying a value</li>
 * </ul>
 * <p>
 * <b>Matching rule:</b> node existence decides the match, not value presence.
 * With only {@code api.google.com} registered, {@code foo.google.com} matches the
 * {@code google} node, whose value is empty.
 * {@link io.fullerstack.domaintrie.DomainSuffixTrie#matchRegistered(String)}
 * returns the deepest node that does carry a value instead.
 * <p>
 * No validation is performed: labels are compared as exact strings, case included.
 */
package io.fullerstack.domaintrie;
