package dev.dylanburati.chainmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Helpers {
  public static <T> List<T> reversed(List<T> original) {
    List<T> result = new ArrayList<>(original);
    Collections.reverse(result);
    return result;
  }

  public static <T> List<T> contents(BucketList<T> list) {
    List<T> result = new ArrayList<>();
    list.forEach(result::add);
    return result;
  }

  public static <K, V> ChainedHashMap<K, V> unwrap(Result<ChainedHashMap<K, V>> result) {
    if (!result.isOk()) {
      throw new AssertionError("expected a map, got " + result);
    }
    return result.get();
  }

  /**
   * Hands out nodes and bucket arrays until told to fail, then throws
   * {@link OutOfMemoryError} for that kind of allocation.
   */
  static class LimitedAllocator implements Allocator {
    int nodesLeft = Integer.MAX_VALUE;
    int bucketArraysLeft = Integer.MAX_VALUE;
    int nodesAllocated = 0;
    int bucketArraysAllocated = 0;

    @Override
    public <E> BucketList.Node<E> newNode(E item, BucketList.Node<E> next) {
      if (nodesLeft <= 0) {
        throw new OutOfMemoryError("simulated");
      }
      nodesLeft--;
      nodesAllocated++;
      return new BucketList.Node<>(item, next);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <E> BucketList<E>[] newBuckets(int length) {
      if (bucketArraysLeft <= 0) {
        throw new OutOfMemoryError("simulated");
      }
      bucketArraysLeft--;
      bucketArraysAllocated++;
      BucketList<E>[] buckets = (BucketList<E>[]) new BucketList<?>[length];
      for (int i = 0; i < length; i++) {
        buckets[i] = new BucketList<>(this);
      }
      return buckets;
    }
  }
}
