package io.fullerstack.domaintrie;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for DomainSuffixTree.
 * <p>
 * Tests verify:
 * <ul>
 *   <li>Longest-suffix matching and fallback to the root</li>
 *   <li>Structural matching on intermediate nodes without values</li>
 *   <li>Overwrite semantics and empty suffix rejection</li>
 *   <li>Path reconstruction and root accessors</li>
 * </ul>
 */
class DomainSuffixTreeTest {

    private DomainSuffixTree<String> tree;

    @BeforeEach
    void setUp() {
        tree = new DomainSuffixTree<>();
    }

    @Nested
    @DisplayName("Longest match")
    class LongestMatchTests {

        @Test
        @DisplayName("should prefer the most specific registered suffix")
        void testLongestMatchWins() {
            tree.insert("google.com", "A");
            tree.insert("map.google.com", "B");

            assertThat(tree.matchValue("x.map.google.com")).contains("B");
            assertThat(tree.matchValue("x.google.com")).contains("A");
            assertThat(tree.match("x.map.google.com").path()).isEqualTo("map.google.com");
        }

        @Test
        @DisplayName("should match a domain equal to a registered suffix")
        void testExactDomainMatches() {
            tree.insert("google.com", "google");

            SuffixNode<String> node = tree.match("google.com");

            assertThat(node.path()).isEqualTo("google.com");
            assertThat(node.value()).contains("google");
        }

        @Test
        @DisplayName("should not depend on insertion order")
        void testInsertionOrderIrrelevant() {
            tree.insert("map.google.com", "B");
            tree.insert("google.com", "A");

            assertThat(tree.matchValue("x.map.google.com")).contains("B");
            assertThat(tree.matchValue("x.google.com")).contains("A");
        }

        @Test
        @DisplayName("should compare labels exactly, case included")
        void testLabelsAreCaseSensitive() {
            tree.insert("google.com", "google");

            assertThat(tree.match("www.GOOGLE.com").path()).isEqualTo("com");
            assertThat(tree.matchValue("www.GOOGLE.com")).isEmpty();
        }

        @Test
        @DisplayName("should keep unrelated suffixes apart")
        void testSiblingSuffixes() {
            tree.insert("google.com", "google");
            tree.insert("baidu.com", "baidu");
            tree.insert("jd.com", "jd");

            assertThat(tree.matchValue("test.baidu.com")).contains("baidu");
            assertThat(tree.match("test.jd.com").label()).isEqualTo("jd");
            assertThat(tree.match("test.baidu.com").path()).isEqualTo("baidu.com");
        }
    }

    @Nested
    @DisplayName("No match")
    class NoMatchTests {

        @Test
        @DisplayName("should return the root on a fresh tree")
        void testFreshTreeReturnsRoot() {
            SuffixNode<String> node = tree.match("anything.com");

            assertThat(node.isRoot()).isTrue();
            assertThat(node.value()).isEmpty();
            assertThat(tree.matchValue("anything.com")).isEmpty();
        }

        @Test
        @DisplayName("should return the root when the top-level label is unknown")
        void testUnknownTopLevelReturnsRoot() {
            tree.insert("google.com", "google");

            assertThat(tree.match("google.org").isRoot()).isTrue();
        }

        @Test
        @DisplayName("should return the root for an empty domain")
        void testEmptyDomainReturnsRoot() {
            tree.insert("google.com", "google");

            assertThat(tree.match("").isRoot()).isTrue();
        }

        @Test
        @DisplayName("should reject a null domain")
        void testNullDomain() {
            assertThatThrownBy(() -> tree.match(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("domain");
        }
    }

    @Nested
    @DisplayName("Intermediate nodes")
    class IntermediateNodeTests {

        @BeforeEach
        void registerOnlyDeepSuffix() {
            tree.insert("api.google.com", "X");
        }

        @Test
        @DisplayName("should match an intermediate node that carries no value")
        void testIntermediateNodeMatched() {
            SuffixNode<String> node = tree.match("foo.google.com");

            assertThat(node.isRoot()).isFalse();
            assertThat(node.label()).isEqualTo("google");
            assertThat(node.path()).isEqualTo("google.com");
            assertThat(node.hasValue()).isFalse();
            assertThat(tree.matchValue("foo.google.com")).isEmpty();
        }

        @Test
        @DisplayName("matchRegistered should skip nodes without a value")
        void testMatchRegisteredSkipsIntermediate() {
            assertThat(tree.matchRegistered("foo.google.com")).isEmpty();
            assertThat(tree.matchRegistered("v1.api.google.com"))
                .hasValueSatisfying(node -> assertThat(node.path()).isEqualTo("api.google.com"));
        }

        @Test
        @DisplayName("matchRegistered should fall back to a less specific registered suffix")
        void testMatchRegisteredFallsBack() {
            tree.insert("com", "tld");

            assertThat(tree.matchRegistered("foo.google.com"))
                .hasValueSatisfying(node -> assertThat(node.value()).contains("tld"));
            assertThat(tree.match("foo.google.com").label()).isEqualTo("google");
        }

        @Test
        @DisplayName("contains should report only suffixes with a value")
        void testContains() {
            assertThat(tree.contains("api.google.com")).isTrue();
            assertThat(tree.contains("google.com")).isFalse();
            assertThat(tree.contains("www.api.google.com")).isFalse();
            assertThat(tree.contains("")).isFalse();
        }
    }

    @Nested
    @DisplayName("Insertion")
    class InsertionTests {

        @Test
        @DisplayName("should overwrite the value of a re-inserted suffix")
        void testOverwrite() {
            tree.insert("google.com", "first");
            tree.insert("google.com", "second");

            assertThat(tree.matchValue("google.com")).contains("second");
            assertThat(tree.entries()).containsExactly(Map.entry("google.com", "second"));
        }

        @Test
        @DisplayName("should create the whole label path top-level first")
        void testCreatesPath() {
            tree.insert("api.google.com", "X");

            assertThat(tree.children()).containsOnlyKeys("com");
            SuffixNode<String> google = tree.child("com").orElseThrow().child("google").orElseThrow();
            assertThat(google.children()).containsOnlyKeys("api");
            assertThat(google.child("api").orElseThrow().value()).contains("X");
        }

        @Test
        @DisplayName("should reach children of a matched node")
        void testChildOfMatchedNode() {
            tree.insert("google.com", "google");
            tree.insert("www.google.com", "google-web");

            SuffixNode<String> node = tree.match("google.com");

            assertThat(node.child("www"))
                .hasValueSatisfying(child -> assertThat(child.value()).contains("google-web"));
            assertThat(node.children()).containsOnlyKeys("www");
        }

        @Test
        @DisplayName("should reject an empty suffix without touching the tree")
        void testEmptySuffixRejected() {
            assertThatThrownBy(() -> tree.insert("", "v"))
                .isInstanceOf(EmptySuffixException.class)
                .hasMessageContaining("empty");

            assertThat(tree.children()).isEmpty();
            assertThat(tree.value()).isEmpty();
        }

        @Test
        @DisplayName("should reject null arguments without touching the tree")
        void testNullArgumentsRejected() {
            assertThatThrownBy(() -> tree.insert(null, "v"))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("suffix");
            assertThatThrownBy(() -> tree.insert("google.com", null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("value");

            assertThat(tree.children()).isEmpty();
        }

        @Test
        @DisplayName("should accept suffixes that are not valid domain syntax")
        void testNoValidation() {
            tree.insert("com.", "trailing");
            tree.insert("a..b", "double");

            assertThat(tree.children()).containsOnlyKeys("", "b");
            assertThat(tree.matchValue("com.")).contains("trailing");
            assertThat(tree.matchValue("x.a..b")).contains("double");
        }
    }

    @Nested
    @DisplayName("Paths and accessors")
    class AccessorTests {

        @Test
        @DisplayName("matching a registered suffix should reproduce its path")
        void testPathRoundTrip() {
            List<String> suffixes = List.of("com", "google.com", "map.google.com", "news.bbc.co.uk", "com.", "a..b");
            for (String suffix : suffixes) {
                tree.insert(suffix, suffix.toUpperCase());
            }

            for (String suffix : suffixes) {
                assertThat(tree.match(suffix).path()).isEqualTo(suffix);
            }
        }

        @Test
        @DisplayName("root accessors should describe the root node")
        void testRootAccessors() {
            tree.insert("google.com", "google");

            assertThat(tree.label()).isEmpty();
            assertThat(tree.path()).isEmpty();
            assertThat(tree.value()).isEmpty();
            assertThat(tree.child("com")).isPresent();
            assertThat(tree.child("org")).isEmpty();
        }

        @Test
        @DisplayName("a value on the root should act as the no-match default")
        void testRootValueAsDefault() {
            tree.insert("google.com", "google");

            assertThat(tree.setValue("default")).isEmpty();
            assertThat(tree.setValue("fallback")).contains("default");

            assertThat(tree.matchValue("example.org")).contains("fallback");
            assertThat(tree.matchRegistered("example.org"))
                .hasValueSatisfying(node -> assertThat(node.isRoot()).isTrue());
            assertThat(tree.matchValue("www.google.com")).contains("google");

            assertThat(tree.clearValue()).contains("fallback");
            assertThat(tree.matchValue("example.org")).isEmpty();
        }

        @Test
        @DisplayName("entries should list every registered suffix, root excluded")
        void testEntries() {
            tree.insert("google.com", "A");
            tree.insert("api.google.com", "B");
            tree.insert("co.uk", "C");
            tree.setValue("root");

            assertThat(tree.entries()).containsExactlyInAnyOrderEntriesOf(Map.of(
                "google.com", "A",
                "api.google.com", "B",
                "co.uk", "C"
            ));
        }

        @Test
        @DisplayName("children should be a detached copy")
        void testChildrenDefensiveCopy() {
            tree.insert("google.com", "google");

            Map<String, SuffixNode<String>> children = tree.children();
            tree.insert("bbc.co.uk", "bbc");

            assertThat(children).containsOnlyKeys("com");
            assertThatThrownBy(children::clear).isInstanceOf(UnsupportedOperationException.class);
            assertThat(tree.children()).containsOnlyKeys("com", "uk");
        }

        @Test
        @DisplayName("entries and toString should handle very deep suffixes")
        void testDeepSuffix() {
            String deep = String.join(".", Collections.nCopies(50_000, "a"));
            tree.insert(deep, "deep");
            tree.insert("a.a", "shallow");

            assertThat(tree.match(deep).depth()).isEqualTo(50_000);
            assertThat(tree.entries())
                .hasSize(2)
                .containsEntry("a.a", "shallow")
                .containsEntry(deep, "deep");
            assertThat(tree).hasToString("DomainSuffixTree[suffixes=2]");
        }

        @Test
        void toStringShouldCountSuffixes() {
            tree.insert("google.com", "A");
            tree.insert("api.google.com", "B");

            assertThat(tree).hasToString("DomainSuffixTree[suffixes=2]");
        }
    }
}
