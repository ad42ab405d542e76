package dev.dylanburati.chainmap;

/**
 * Source of the storage that lists and maps hold on to. Either method may throw
 * {@link OutOfMemoryError}; callers turn that into {@link Status#OUT_OF_MEMORY}.
 */
/* package-private */ interface Allocator {
  <E> BucketList.Node<E> newNode(E item, BucketList.Node<E> next);

  /** An array of {@code length} empty lists that allocate through this allocator. */
  <E> BucketList<E>[] newBuckets(int length);
}
