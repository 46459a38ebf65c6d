package io.fullerstack.domaintrie;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Unsynchronized domain suffix trie.
 *
 * <p><b>Performance characteristics:</b>
 * <ul>
 *   <li>insert(): O(d) where d = number of labels in the suffix</li>
 *   <li>match(): O(d) where d = number of labels in the query, no allocation per node</li>
 *   <li>entries(): O(n) where n = number of nodes</li>
 * </ul>
 *
 * <p><b>Thread safety:</b> none. Use from a single thread, or through
 * {@link SynchronizedDomainSuffixTree}.
 *
 * @param <T> the type of value attached to registered suffixes
 */
public class DomainSuffixTree<T> implements DomainSuffixTrie<T> {

    private static final Logger logger = LoggerFactory.getLogger(DomainSuffixTree.class);

    private final SuffixNode<T> root = SuffixNode.root();

    // -------------------- Trie operations --------------------

    @Override
    public void insert(String suffix, T value) {
        Objects.requireNonNull(suffix, "suffix");
        Objects.requireNonNull(value, "value");
        if (suffix.isEmpty()) {
            throw new EmptySuffixException("domain suffix cannot be empty");
        }

        SuffixNode<T> node = root;
        for (String label : DomainLabels.reversed(suffix)) {
            node = node.childOrCreate(label);
        }

        Optional<T> previous = node.setValue(value);
        if (previous.isPresent() && logger.isDebugEnabled()) {
            logger.debug("Replaced value for suffix '{}': {} -> {}", suffix, previous.get(), value);
        }
    }

    @Override
    public SuffixNode<T> match(String domain) {
        Objects.requireNonNull(domain, "domain");

        SuffixNode<T> node = root;
        String[] labels = DomainLabels.split(domain);
        for (int i = labels.length - 1; i >= 0; i--) {
            SuffixNode<T> next = node.childOrNull(labels[i]);
            if (next == null) {
                break;
            }
            node = next;
        }
        return node;
    }

    @Override
    public Optional<T> matchValue(String domain) {
        return match(domain).value();
    }

    @Override
    public Optional<SuffixNode<T>> matchRegistered(String domain) {
        Objects.requireNonNull(domain, "domain");

        SuffixNode<T> node = root;
        SuffixNode<T> registered = root.hasValue() ? root : null;
        String[] labels = DomainLabels.split(domain);
        for (int i = labels.length - 1; i >= 0; i--) {
            node = node.childOrNull(labels[i]);
            if (node == null) {
                break;
            }
            if (node.hasValue()) {
                registered = node;
            }
        }
        return Optional.ofNullable(registered);
    }

    @Override
    public boolean contains(String suffix) {
        Objects.requireNonNull(suffix, "suffix");
        if (suffix.isEmpty()) {
            return false;
        }

        SuffixNode<T> node = root;
        for (String label : DomainLabels.reversed(suffix)) {
            node = node.childOrNull(label);
            if (node == null) {
                return false;
            }
        }
        return node.hasValue();
    }

    @Override
    public Map<String, T> entries() {
        Map<String, T> result = new LinkedHashMap<>();
        root.collectEntries(result);
        return result;
    }

    // -------------------- Root accessors --------------------

    @Override
    public String label() {
        return root.label();
    }

    @Override
    public String path() {
        return root.path();
    }

    @Override
    public Optional<T> value() {
        return root.value();
    }

    @Override
    public Optional<T> setValue(T value) {
        return root.setValue(value);
    }

    @Override
    public Optional<T> clearValue() {
        return root.clearValue();
    }

    @Override
    public Optional<SuffixNode<T>> child(String label) {
        return root.child(label);
    }

    @Override
    public Map<String, SuffixNode<T>> children() {
        return root.children();
    }

    @Override
    public String toString() {
        return "DomainSuffixTree[suffixes=" + entries().size() + "]";
    }
}
