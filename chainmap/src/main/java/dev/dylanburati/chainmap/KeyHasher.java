package dev.dylanburati.chainmap;

import java.util.Objects;

/**
 * Computes hashes for insertion to a {@link ChainedHashMap}. The rules of
 * {@link Object#hashCode} also apply here: keys that are equal under the map's
 * {@link KeyEquality} must hash the same, and the hash of a key must not change
 * while it is in the map. Negative hashes are fine.
 */
@FunctionalInterface
public interface KeyHasher<K> {
  int hash(K key);

  static <K> KeyHasher<K> natural() {
    return Objects::hashCode;
  }
}
