package dev.dylanburati.chainmap;

import java.util.Objects;

/**
 * Decides whether two keys of a {@link ChainedHashMap} are the same key. Must be
 * reflexive, symmetric and consistent with the map's {@link KeyHasher}.
 */
@FunctionalInterface
public interface KeyEquality<K> {
  boolean equal(K a, K b);

  static <K> KeyEquality<K> natural() {
    return Objects::equals;
  }
}
