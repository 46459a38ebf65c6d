package io.fullerstack.domaintrie;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single label's position in a domain suffix trie.
 *
 * <p><b>Structure:</b>
 * <ul>
 *   <li>The root has an empty label and no parent; it is never part of a path</li>
 *   <li>Each other node holds one label and a parent link fixed at creation</li>
 *   <li>Children are keyed by exact label; nodes are never removed or relabeled</li>
 * </ul>
 *
 * <p>Reading labels from a node up to the root gives the suffix it represents:
 * the chain {@code com -> google -> api} read from {@code api} upwards is
 * {@code api.google.com}.
 *
 * <p><b>Value presence:</b> a node may exist without ever having been given a
 * value (every intermediate node created by an insertion starts that way).
 * Values are never {@code null}; absence is {@link Optional#empty()}.
 *
 * <p><b>Thread safety:</b> none. Nodes are guarded by the tree that owns them;
 * see {@link SynchronizedDomainSuffixTree}.
 *
 * @param <T> the type of value attached to registered suffixes
 */
public final class SuffixNode<T> {

    private final SuffixNode<T> parent;
    private final String label;
    private final int depth;
    private final Map<String, SuffixNode<T>> children = new HashMap<>();
    private T value;

    private SuffixNode(SuffixNode<T> parent, String label) {
        this.parent = parent;
        this.label = Objects.requireNonNull(label, "label cannot be null");
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    /**
     * Creates a parent-less root node with an empty label.
     */
    static <T> SuffixNode<T> root() {
        return new SuffixNode<>(null, "");
    }

    /**
     * Returns the child for the label, creating and linking it if absent.
     */
    SuffixNode<T> childOrCreate(String label) {
        return children.computeIfAbsent(label, l -> new SuffixNode<>(this, l));
    }

    /**
     * Exact child lookup; null if absent.
     */
    SuffixNode<T> childOrNull(String label) {
        return children.get(label);
    }

    // ============ Structure ============

    /**
     * Returns this node's own label, e.g. {@code "api"} for {@code api.google.com}.
     * The root returns the empty string.
     */
    public String label() {
        return label;
    }

    /**
     * Returns the full suffix this node represents, e.g. {@code "api.google.com"}.
     * The root returns the empty string.
     */
    public String path() {
        List<String> labels = new ArrayList<>(depth);
        SuffixNode<T> current = this;
        while (current.parent != null) {
            labels.add(current.label);
            current = current.parent;
        }
        return DomainLabels.join(labels);
    }

    /**
     * Number of labels between the root and this node; the root is 0.
     */
    public int depth() {
        return depth;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public Optional<SuffixNode<T>> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Looks up a direct child by its exact label.
     *
     * @param label the child label (e.g., "www")
     * @return the child, or empty if no suffix below this node uses that label
     */
    public Optional<SuffixNode<T>> child(String label) {
        Objects.requireNonNull(label, "label");
        return Optional.ofNullable(children.get(label));
    }

    /**
     * Returns a copy of this node's children keyed by label.
     * The returned map is unmodifiable and detached from the trie.
     */
    public Map<String, SuffixNode<T>> children() {
        return Collections.unmodifiableMap(new HashMap<>(children));
    }

    // ============ Value ============

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public boolean hasValue() {
        return value != null;
    }

    /**
     * Attaches a value to this node, replacing any previous one.
     *
     * @param value the new value, never null
     * @return the previous value, or empty if none was set
     */
    public Optional<T> setValue(T value) {
        Objects.requireNonNull(value, "value");
        T previous = this.value;
        this.value = value;
        return Optional.ofNullable(previous);
    }

    /**
     * Removes this node's value. The node itself stays in the trie.
     *
     * @return the removed value, or empty if none was set
     */
    public Optional<T> clearValue() {
        T previous = value;
        value = null;
        return Optional.ofNullable(previous);
    }

    /**
     * Adds this node's entry and those of its descendants to {@code output}.
     * The root contributes no entry of its own.
     *
     * <p>Walks with an explicit stack; suffixes may be arbitrarily deep.
     */
    void collectEntries(Map<String, T> output) {
        Deque<SuffixNode<T>> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            SuffixNode<T> node = pending.pop();
            if (node.parent != null && node.value != null) {
                output.put(node.path(), node.value);
            }
            for (SuffixNode<T> child : node.children.values()) {
                pending.push(child);
            }
        }
    }

    @Override
    public String toString() {
        return "SuffixNode[path=" + path() + ", value=" + value + "]";
    }
}
