package io.fullerstack.domaintrie.benchmark;

import io.fullerstack.domaintrie.DomainSuffixTrie;
import io.fullerstack.domaintrie.DomainSuffixTries;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Lookup cost of the unsynchronized trie versus the synchronized one.
 *
 * Both tries hold the same suffixes; the threaded group measures read-lock
 * contention under concurrent matching.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 2)
@Fork(1)
@State(Scope.Benchmark)
public class DomainSuffixTrieBenchmark {

    // Test data
    private static final String[] SUFFIXES = {
        "com", "google.com", "map.google.com", "api.google.com", "baidu.com", "jd.com",
        "co.uk", "bbc.co.uk", "news.bbc.co.uk", "github.io", "example.github.io"
    };
    private static final String HIT_DEEP = "tiles.eu.map.google.com";
    private static final String HIT_SHALLOW = "www.baidu.com";
    private static final String MISS = "www.example.org";

    private DomainSuffixTrie<String> plain;
    private DomainSuffixTrie<String> synchronizedTrie;

    @Setup
    public void setup() {
        plain = DomainSuffixTries.newTrie();
        synchronizedTrie = DomainSuffixTries.newSynchronizedTrie();
        for (String suffix : SUFFIXES) {
            plain.insert(suffix, suffix);
            synchronizedTrie.insert(suffix, suffix);
        }
    }

    // ========== UNSYNCHRONIZED ==========

    @Benchmark
    public void benchmark01_plain_matchDeep(Blackhole bh) {
        bh.consume(plain.match(HIT_DEEP));
    }

    @Benchmark
    public void benchmark02_plain_matchShallow(Blackhole bh) {
        bh.consume(plain.match(HIT_SHALLOW));
    }

    @Benchmark
    public void benchmark03_plain_matchMiss(Blackhole bh) {
        bh.consume(plain.match(MISS));
    }

    @Benchmark
    public void benchmark04_plain_matchRegistered(Blackhole bh) {
        bh.consume(plain.matchRegistered(HIT_DEEP));
    }

    // ========== SYNCHRONIZED ==========

    @Benchmark
    public void benchmark05_synchronized_matchDeep(Blackhole bh) {
        bh.consume(synchronizedTrie.match(HIT_DEEP));
    }

    @Benchmark
    public void benchmark06_synchronized_matchMiss(Blackhole bh) {
        bh.consume(synchronizedTrie.match(MISS));
    }

    @Benchmark
    @Threads(4)
    public void benchmark07_synchronized_matchDeepContended(Blackhole bh) {
        bh.consume(synchronizedTrie.matchValue(HIT_DEEP));
    }
}
