package dev.dylanburati.chainmap;

/* package-private */ class DefaultAllocator implements Allocator {
  private static DefaultAllocator instance = null;

  private DefaultAllocator() {}

  static DefaultAllocator instance() {
    if (instance == null) {
      instance = new DefaultAllocator();
    }
    return instance;
  }

  @Override
  public <E> BucketList.Node<E> newNode(E item, BucketList.Node<E> next) {
    return new BucketList.Node<>(item, next);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <E> BucketList<E>[] newBuckets(int length) {
    BucketList<E>[] buckets = (BucketList<E>[]) new BucketList<?>[length];
    for (int i = 0; i < length; i++) {
      buckets[i] = new BucketList<>(this);
    }
    return buckets;
  }
}
