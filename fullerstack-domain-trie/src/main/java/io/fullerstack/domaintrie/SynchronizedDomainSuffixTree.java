package io.fullerstack.domaintrie;

import io.fullerstack.domaintrie.config.TrieConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe domain suffix trie: one {@link DomainSuffixTree} behind one
 * whole-tree read/write lock.
 *
 * <p><b>Thread safety:</b>
 * ReadWriteLock ensures:
 * <ul>
 *   <li>Multiple concurrent readers (match, matchValue, matchRegistered, contains, entries, accessors)</li>
 *   <li>Exclusive writer (insert, setValue, clearValue)</li>
 *   <li>No reader ever walks a half-linked node</li>
 * </ul>
 *
 * <p>Every lock is released in {@code finally}; exceptions from the underlying
 * tree propagate unchanged.
 *
 * <p>Nodes returned by {@link #match(String)}, {@link #matchRegistered(String)},
 * {@link #child(String)} and {@link #children()} are live trie nodes and must be
 * treated as read-only views:
 * <ul>
 *   <li>Reading them after the call returns is not guarded by the lock; concurrent
 *       callers should use {@link #matchValue(String)} or read the node before the next write</li>
 *   <li>{@link SuffixNode#setValue(Object)} and {@link SuffixNode#clearValue()} on a returned
 *       node bypass the write lock entirely. Every write must go through this class
 *       ({@link #insert(String, Object)}, {@link #setValue(Object)}, {@link #clearValue()});
 *       re-inserting a suffix is how its value is replaced</li>
 * </ul>
 *
 * @param <T> the type of value attached to registered suffixes
 */
public final class SynchronizedDomainSuffixTree<T> implements DomainSuffixTrie<T> {

    private static final Logger logger = LoggerFactory.getLogger(SynchronizedDomainSuffixTree.class);

    private final DomainSuffixTree<T> tree;

    private final ReentrantReadWriteLock lock;

    /**
     * Creates an empty trie configured from {@link TrieConfig#global()}.
     */
    public SynchronizedDomainSuffixTree() {
        this(TrieConfig.global());
    }

    /**
     * Creates an empty trie; {@link TrieConfig#LOCK_FAIR} selects the lock ordering.
     *
     * @param config trie configuration
     */
    public SynchronizedDomainSuffixTree(TrieConfig config) {
        this(new DomainSuffixTree<>(), Objects.requireNonNull(config, "config").getBoolean(TrieConfig.LOCK_FAIR, false));
    }

    SynchronizedDomainSuffixTree(DomainSuffixTree<T> tree, boolean fair) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.lock = new ReentrantReadWriteLock(fair);
        logger.debug("Created synchronized domain suffix trie (fair lock: {})", fair);
    }

    /**
     * Whether the read/write lock hands out access in arrival order.
     */
    boolean isFair() {
        return lock.isFair();
    }

    // -------------------- Writes --------------------

    @Override
    public void insert(String suffix, T value) {
        lock.writeLock().lock();
        try {
            tree.insert(suffix, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<T> setValue(T value) {
        lock.writeLock().lock();
        try {
            return tree.setValue(value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<T> clearValue() {
        lock.writeLock().lock();
        try {
            return tree.clearValue();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // -------------------- Reads --------------------

    @Override
    public SuffixNode<T> match(String domain) {
        lock.readLock().lock();
        try {
            return tree.match(domain);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<T> matchValue(String domain) {
        lock.readLock().lock();
        try {
            return tree.matchValue(domain);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<SuffixNode<T>> matchRegistered(String domain) {
        lock.readLock().lock();
        try {
            return tree.matchRegistered(domain);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean contains(String suffix) {
        lock.readLock().lock();
        try {
            return tree.contains(suffix);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, T> entries() {
        lock.readLock().lock();
        try {
            return tree.entries();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String label() {
        lock.readLock().lock();
        try {
            return tree.label();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String path() {
        lock.readLock().lock();
        try {
            return tree.path();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<T> value() {
        lock.readLock().lock();
        try {
            return tree.value();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<SuffixNode<T>> child(String label) {
        lock.readLock().lock();
        try {
            return tree.child(label);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, SuffixNode<T>> children() {
        lock.readLock().lock();
        try {
            return tree.children();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "SynchronizedDomainSuffixTree[suffixes=" + entries().size() + "]";
    }
}
