package io.fullerstack.domaintrie;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splitting and joining of dot-separated domain labels.
 *
 * <p>Splitting keeps every empty label, leading and trailing ones included:
 * <ul>
 *   <li>{@code "api.google.com"} → {@code ["api", "google", "com"]}</li>
 *   <li>{@code "com."} → {@code ["com", ""]}</li>
 *   <li>{@code ""} → {@code [""]}</li>
 * </ul>
 *
 * <p>No other normalisation is applied: case, whitespace and punycode are left
 * untouched.
 */
@UtilityClass
public class DomainLabels {

    /** Label separator */
    public static final char SEPARATOR = '.';

    /**
     * Splits a domain into its labels, left to right.
     *
     * @param domain the domain (e.g., "api.google.com")
     * @return the labels in written order (e.g., ["api", "google", "com"])
     */
    public static String[] split(String domain) {
        Objects.requireNonNull(domain, "domain");
        // limit -1 keeps trailing empty labels
        return domain.split("\\.", -1);
    }

    /**
     * Joins labels ordered from the most specific one up to the top-level one.
     *
     * @param labels labels in written order
     * @return the dot-joined domain
     */
    public static String join(List<String> labels) {
        Objects.requireNonNull(labels, "labels");
        return String.join(String.valueOf(SEPARATOR), labels);
    }

    /**
     * Returns the labels of a domain ordered top-level first, the order in
     * which the trie is walked.
     *
     * @param domain the domain (e.g., "api.google.com")
     * @return labels top-level first (e.g., ["com", "google", "api"])
     */
    public static List<String> reversed(String domain) {
        String[] labels = split(domain);
        List<String> result = new ArrayList<>(labels.length);
        for (int i = labels.length - 1; i >= 0; i--) {
            result.add(labels[i]);
        }
        return result;
    }
}
