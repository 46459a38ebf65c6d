package io.fullerstack.domaintrie.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;

/**
 * Trie configuration backed by {@code domain-trie.properties} (ResourceBundle).
 *
 * <p>Lookup order for a key, first hit wins:
 * <ol>
 *   <li>System property {@code {trie}.{key}} (named configuration only)</li>
 *   <li>Bundle entry {@code {trie}.{key}} (named configuration only)</li>
 *   <li>System property {@code {key}}</li>
 *   <li>Bundle entry {@code {key}}</li>
 * </ol>
 *
 * <p><strong>Example Property File:</strong>
 * <pre>
 * # domain-trie.properties
 * trie.lock.fair=false
 *
 * # override for the "blocklist" trie only
 * blocklist.trie.lock.fair=true
 * </pre>
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * TrieConfig global = TrieConfig.global();
 * boolean fair = global.getBoolean(TrieConfig.LOCK_FAIR);
 * // → false
 *
 * TrieConfig blocklist = TrieConfig.forTrie("blocklist");
 * boolean fair = blocklist.getBoolean(TrieConfig.LOCK_FAIR);
 * // → true
 * </pre>
 */
public class TrieConfig {

  private static final Logger logger = LoggerFactory.getLogger(TrieConfig.class);

  /** Bundle base name, resolved as {@code domain-trie.properties} on the classpath */
  public static final String BUNDLE_NAME = "domain-trie";

  /** Fairness of the read/write lock guarding a synchronized trie */
  public static final String LOCK_FAIR = "trie.lock.fair";

  private final ResourceBundle bundle;
  private final String trieName;  // null for global

  private TrieConfig(ResourceBundle bundle, String trieName) {
    this.bundle = bundle;
    this.trieName = trieName;
  }

  /**
   * Get global configuration.
   *
   * @return Global configuration
   */
  public static TrieConfig global() {
    return new TrieConfig(loadBundle(), null);
  }

  /**
   * Get configuration for a named trie, falling back to global keys.
   *
   * @param trieName Trie name (e.g., "blocklist")
   * @return Trie-specific configuration
   */
  public static TrieConfig forTrie(String trieName) {
    Objects.requireNonNull(trieName, "trieName cannot be null");
    if (trieName.isBlank()) {
      throw new IllegalArgumentException("trieName cannot be blank");
    }
    return new TrieConfig(loadBundle(), trieName);
  }

  private static ResourceBundle loadBundle() {
    try {
      return ResourceBundle.getBundle(BUNDLE_NAME, Locale.ROOT);
    } catch (MissingResourceException e) {
      throw new ConfigurationException("Missing resource bundle '" + BUNDLE_NAME + "'", e);
    }
  }

  // =========================================================================
  // Type-safe getters with system property override support
  // =========================================================================

  /**
   * Get string value.
   *
   * @param key Property key
   * @return Property value
   * @throws ConfigurationException if key not found
   */
  public String getString(String key) {
    String value = lookup(key);
    if (value == null) {
      throw new ConfigurationException(
        "Missing config key '" + key + "' in context: " + context()
      );
    }
    return value;
  }

  /**
   * Get string value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value or default
   */
  public String getString(String key, String defaultValue) {
    String value = lookup(key);
    if (value == null) {
      logger.debug("Config key '{}' not set in context {}, using default '{}'", key, context(), defaultValue);
      return defaultValue;
    }
    return value;
  }

  /**
   * Get boolean value. Only {@code true} and {@code false} (any case) are accepted.
   *
   * @param key Property key
   * @return Property value as boolean
   * @throws ConfigurationException if key not found or not a boolean
   */
  public boolean getBoolean(String key) {
    return parseBoolean(key, getString(key));
  }

  /**
   * Get boolean value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as boolean or default
   * @throws ConfigurationException if the key is set but not a boolean
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getString(key, null);
    if (value == null) {
      return defaultValue;
    }
    return parseBoolean(key, value);
  }

  /**
   * Check if key exists in configuration.
   *
   * @param key Property key
   * @return true if key exists
   */
  public boolean contains(String key) {
    return lookup(key) != null;
  }

  /**
   * Get configuration context (for debugging).
   *
   * @return Context description (e.g., "global", "trie:blocklist")
   */
  public String context() {
    return trieName == null ? "global" : "trie:" + trieName;
  }

  private String lookup(String key) {
    Objects.requireNonNull(key, "key cannot be null");
    if (trieName != null) {
      String scoped = lookupPlain(trieName + "." + key);
      if (scoped != null) {
        return scoped;
      }
    }
    return lookupPlain(key);
  }

  private String lookupPlain(String key) {
    // System property override
    String sysProp = System.getProperty(key);
    if (sysProp != null) {
      return sysProp;
    }
    return bundle.containsKey(key) ? bundle.getString(key).trim() : null;
  }

  private static boolean parseBoolean(String key, String value) {
    String trimmed = value.trim();
    if ("true".equalsIgnoreCase(trimmed)) {
      return true;
    }
    if ("false".equalsIgnoreCase(trimmed)) {
      return false;
    }
    throw new ConfigurationException("Invalid boolean value for key '" + key + "': " + value);
  }

  @Override
  public String toString() {
    return "TrieConfig[context=" + context() + "]";
  }
}
