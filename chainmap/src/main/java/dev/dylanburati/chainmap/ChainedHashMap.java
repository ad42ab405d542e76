package dev.dylanburati.chainmap;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hash map using separate chaining, with caller-supplied hashing and key equality.
 *
 * Each bucket is a {@link BucketList} of entries. A key lives in bucket
 * {@code floorMod(hasher.hash(key), capacity)}, and new keys are appended to
 * the back of their bucket. When an insertion brings the size to exactly
 * {@code capacity + 1}, the bucket array grows by {@link #GROWTH_FACTOR} and every
 * entry is moved to the front of its new bucket, so the relative order of
 * colliding entries is not kept across a resize. Capacity never shrinks.
 *
 * Fallible operations report {@link Status#OUT_OF_MEMORY} instead of throwing.
 * Call {@link #close()} when done; any use afterwards throws
 * {@link IllegalStateException}. Not thread-safe.
 */
public class ChainedHashMap<K, V> implements AutoCloseable {
  public static final int DEFAULT_CAPACITY = 100;
  public static final double GROWTH_FACTOR = 2.0;
  // largest array length the VM reliably hands out
  static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

  private static final Logger log = LoggerFactory.getLogger(ChainedHashMap.class);

  private final KeyHasher<K> hasher;
  private final KeyEquality<K> equality;
  private final Allocator allocator;
  // INVARIANT 0: buckets == null IFF closed
  // INVARIANT 1: buckets.length is the capacity, and >= 1
  // INVARIANT 2: size == sum of buckets[i].length()
  // INVARIANT 3: no two entries have keys equal under `equality`
  private BucketList<Entry<K, V>>[] buckets;
  private int size;
  // bumped on every insertion, removal and resize
  private int modCount;

  private ChainedHashMap(KeyHasher<K> hasher, KeyEquality<K> equality, Allocator allocator,
      BucketList<Entry<K, V>>[] buckets) {
    this.hasher = hasher;
    this.equality = equality;
    this.allocator = allocator;
    this.buckets = buckets;
    this.size = 0;
    this.modCount = 0;
  }

  public static <K, V> Result<ChainedHashMap<K, V>> create(KeyHasher<K> hasher, KeyEquality<K> equality) {
    return create(hasher, equality, DEFAULT_CAPACITY);
  }

  /**
   * Creates a map with {@code capacity} empty buckets. Fails with
   * {@link Status#OUT_OF_MEMORY} if the buckets can't be allocated, or
   * {@link Status#BAD_ARGUMENT} if no bucket array of that length can exist.
   */
  public static <K, V> Result<ChainedHashMap<K, V>> create(KeyHasher<K> hasher, KeyEquality<K> equality, int capacity) {
    return create(hasher, equality, capacity, DefaultAllocator.instance());
  }

  /** Map using {@link Object#hashCode} and {@link Object#equals} of the keys. */
  public static <K, V> Result<ChainedHashMap<K, V>> createNatural() {
    return create(KeyHasher.natural(), KeyEquality.natural(), DEFAULT_CAPACITY);
  }

  public static <K, V> Result<ChainedHashMap<K, V>> createNatural(int capacity) {
    return create(KeyHasher.natural(), KeyEquality.natural(), capacity);
  }

  static <K, V> Result<ChainedHashMap<K, V>> create(KeyHasher<K> hasher, KeyEquality<K> equality, int capacity,
      final Allocator allocator) {
    Objects.requireNonNull(hasher);
    Objects.requireNonNull(equality);
    Objects.requireNonNull(allocator);
    Result<BucketList<Entry<K, V>>[]> buckets = allocateBuckets(allocator, capacity);
    if (!buckets.isOk()) {
      return Result.failure(buckets.status());
    }
    return Result.ok(new ChainedHashMap<>(hasher, equality, allocator, buckets.get()));
  }

  /** A key/value pair stored in a bucket. The value may be replaced in place. */
  public static final class Entry<K, V> implements Map.Entry<K, V> {
    private final K key;
    private V value;

    Entry(K key, V value) {
      this.key = key;
      this.value = value;
    }

    @Override
    public K getKey() {
      return this.key;
    }

    @Override
    public V getValue() {
      return this.value;
    }

    @Override
    public V setValue(V value) {
      V prev = this.value;
      this.value = Objects.requireNonNull(value);
      return prev;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      return Objects.equals(this.key, e.getKey()) && Objects.equals(this.value, e.getValue());
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(this.key) ^ Objects.hashCode(this.value);
    }

    @Override
    public String toString() {
      return this.key + "=" + this.value;
    }
  }

  public int size() {
    this.ensureOpen();
    return this.size;
  }

  public boolean isEmpty() {
    return this.size() == 0;
  }

  /** Number of buckets. */
  public int capacity() {
    this.ensureOpen();
    return this.buckets.length;
  }

  public boolean isClosed() {
    return this.buckets == null;
  }

  /**
   * Maps {@code key} to {@code value}, replacing the value of an equal key if
   * there is one. Returns {@link Status#OUT_OF_MEMORY} and leaves the map
   * unchanged if the new entry can't be allocated.
   *
   * If the insertion triggers a resize that fails, the entry stays in the map at
   * the old capacity and {@link Status#OUT_OF_MEMORY} is still returned.
   */
  public Status put(K key, V value) {
    Objects.requireNonNull(value);
    this.ensureOpen();
    BucketList<Entry<K, V>> bucket = this.buckets[this.indexFor(key, this.buckets.length)];
    Entry<K, V> existing = this.findEntry(bucket, key);
    if (existing != null) {
      existing.value = value;
      return Status.OK;
    }

    Status status = bucket.pushBack(new Entry<>(key, value));
    if (!status.isOk()) {
      return status;
    }
    this.size++;
    this.modCount++;
    // equality, not >=: size grows by one per insertion, so this fires once per
    // threshold crossing, and a failed resize is not retried on the next put
    if (this.size == this.buckets.length + 1) {
      return this.resize();
    }
    return Status.OK;
  }

  public Optional<V> get(K key) {
    Entry<K, V> entry = this.findEntry(key);
    return entry == null ? Optional.empty() : Optional.of(entry.value);
  }

  public boolean containsKey(K key) {
    return this.findEntry(key) != null;
  }

  /** Removes the entry for {@code key}, returning its value, or empty if there was none. */
  public Optional<V> remove(K key) {
    this.ensureOpen();
    BucketList<Entry<K, V>> bucket = this.buckets[this.indexFor(key, this.buckets.length)];
    BucketList.Node<Entry<K, V>> prev = null;
    BucketList.Node<Entry<K, V>> curr = bucket.head();
    while (curr != null && !this.equality.equal(curr.item().key, key)) {
      prev = curr;
      curr = curr.next();
    }
    if (curr == null) {
      return Optional.empty();
    }

    bucket.remove(curr, prev);
    this.size--;
    this.modCount++;
    return Optional.of(curr.item().value);
  }

  /** Visits entries bucket by bucket, each bucket from front to back. */
  public void forEach(BiConsumer<? super K, ? super V> action) {
    Objects.requireNonNull(action);
    this.ensureOpen();
    for (BucketList<Entry<K, V>> bucket : this.buckets) {
      for (BucketList.Node<Entry<K, V>> n = bucket.head(); n != null; n = n.next()) {
        action.accept(n.item().key, n.item().value);
      }
    }
  }

  /** Removes every entry. The capacity is kept. */
  public void clear() {
    this.ensureOpen();
    for (BucketList<Entry<K, V>> bucket : this.buckets) {
      bucket.clear();
    }
    this.size = 0;
    this.modCount++;
  }

  /**
   * Returns a live {@link Map} view backed by this map. Keys passed to the view
   * are handed to this map's hasher and equality unchecked, which may throw
   * {@link ClassCastException} for keys of the wrong type. {@code put} on the
   * view throws {@link AllocationException} if the entry couldn't be stored.
   */
  public Map<K, V> asMap() {
    this.ensureOpen();
    return new MapView<>(this);
  }

  /** Releases every bucket. Further use of the map throws; closing again does nothing. */
  @Override
  public void close() {
    if (this.buckets == null) {
      return;
    }
    for (BucketList<Entry<K, V>> bucket : this.buckets) {
      bucket.clear();
    }
    log.debug("Closed map with {} buckets and {} entries", this.buckets.length, this.size);
    this.buckets = null;
    this.size = 0;
    this.modCount++;
  }

  private void ensureOpen() {
    if (this.buckets == null) {
      throw new IllegalStateException("Map is closed");
    }
  }

  private int indexFor(K key, int capacity) {
    return Math.floorMod(this.hasher.hash(key), capacity);
  }

  private Entry<K, V> findEntry(K key) {
    this.ensureOpen();
    return this.findEntry(this.buckets[this.indexFor(key, this.buckets.length)], key);
  }

  private Entry<K, V> findEntry(BucketList<Entry<K, V>> bucket, K key) {
    for (BucketList.Node<Entry<K, V>> n = bucket.head(); n != null; n = n.next()) {
      if (this.equality.equal(n.item().key, key)) {
        return n.item();
      }
    }
    return null;
  }

  // used by view iterators, which hold the entry itself rather than its key
  private void removeEntry(int index, Entry<K, V> entry) {
    BucketList<Entry<K, V>> bucket = this.buckets[index];
    BucketList.Node<Entry<K, V>> prev = null;
    BucketList.Node<Entry<K, V>> curr = bucket.head();
    while (curr != null && curr.item() != entry) {
      prev = curr;
      curr = curr.next();
    }
    if (curr == null) {
      throw new IllegalStateException("Entry no longer in map");
    }
    bucket.remove(curr, prev);
    this.size--;
    this.modCount++;
  }

  private boolean containsValue(Object value) {
    this.ensureOpen();
    for (BucketList<Entry<K, V>> bucket : this.buckets) {
      for (BucketList.Node<Entry<K, V>> n = bucket.head(); n != null; n = n.next()) {
        if (n.item().value.equals(value)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Moves every entry into a new bucket array {@link #GROWTH_FACTOR} times as
   * long. The map is untouched if the array can't be allocated.
   */
  private Status resize() {
    int oldCapacity = this.buckets.length;
    long newCapacity = (long) (GROWTH_FACTOR * oldCapacity);
    Result<BucketList<Entry<K, V>>[]> allocated = allocateBuckets(this.allocator, newCapacity);
    if (!allocated.isOk()) {
      log.warn("Resize from {} to {} buckets failed: {}", oldCapacity, newCapacity, allocated.status().description());
      return allocated.status();
    }

    BucketList<Entry<K, V>>[] nextBuckets = allocated.get();
    for (BucketList<Entry<K, V>> bucket : this.buckets) {
      // relinks nodes, so nothing here can fail once nextBuckets exists
      while (!bucket.isEmpty()) {
        int idx = this.indexFor(bucket.head().item().key, nextBuckets.length);
        bucket.moveFrontTo(nextBuckets[idx]);
      }
      bucket.clear();
    }

    this.buckets = nextBuckets;
    this.modCount++;
    log.debug("Resized from {} to {} buckets (size={})", oldCapacity, nextBuckets.length, this.size);
    return Status.OK;
  }

  private static <E> Result<BucketList<E>[]> allocateBuckets(Allocator allocator, long capacity) {
    if (capacity < 1) {
      return Result.failure(Status.BAD_ARGUMENT);
    }
    if (capacity > MAX_CAPACITY) {
      return Result.failure(Status.OUT_OF_MEMORY);
    }
    try {
      return Result.ok(allocator.newBuckets((int) capacity));
    } catch (OutOfMemoryError e) {
      log.warn("Could not allocate {} buckets", capacity, e);
      return Result.failure(Status.OUT_OF_MEMORY);
    }
  }

  @SuppressWarnings("unchecked")
  private static <T> T castUnsafe(Object o) {
    return (T) o;
  }

  // start of section adapted from
  // https://github.com/apache/commons-collections/blob/master/src/main/java/org/apache/commons/collections4/map/AbstractHashedMap.java

  protected static class MapView<K, V> extends AbstractMap<K, V> {
    protected final ChainedHashMap<K, V> inner;

    protected MapView(final ChainedHashMap<K, V> inner) {
      this.inner = inner;
    }

    @Override
    public int size() {
      return inner.size();
    }

    @Override
    public boolean isEmpty() {
      return inner.isEmpty();
    }

    @Override
    public boolean containsKey(Object key) {
      return inner.containsKey(castUnsafe(key));
    }

    @Override
    public boolean containsValue(Object value) {
      return inner.containsValue(value);
    }

    @Override
    public V get(Object key) {
      return this.getOrDefault(key, null);
    }

    @Override
    public V getOrDefault(Object key, V defaultValue) {
      ChainedHashMap.Entry<K, V> entry = inner.findEntry(castUnsafe(key));
      return entry == null ? defaultValue : entry.value;
    }

    @Override
    public V put(K key, V value) {
      Objects.requireNonNull(value);
      ChainedHashMap.Entry<K, V> existing = inner.findEntry(key);
      if (existing != null) {
        return existing.setValue(value);
      }
      Status status = inner.put(key, value);
      // a failed resize still stores the entry, which is all put promises
      if (!status.isOk() && inner.findEntry(key) == null) {
        throw new AllocationException(status);
      }
      return null;
    }

    @Override
    public V remove(Object key) {
      return inner.remove(castUnsafe(key)).orElse(null);
    }

    @Override
    public void replaceAll(BiFunction<? super K, ? super V, ? extends V> function) {
      Objects.requireNonNull(function);
      inner.ensureOpen();
      for (BucketList<ChainedHashMap.Entry<K, V>> bucket : inner.buckets) {
        for (BucketList.Node<ChainedHashMap.Entry<K, V>> n = bucket.head(); n != null; n = n.next()) {
          n.item().setValue(function.apply(n.item().key, n.item().value));
        }
      }
    }

    @Override
    public void clear() {
      inner.clear();
    }

    @Override
    public Set<K> keySet() {
      return new KeySet<>(this);
    }

    @Override
    public Collection<V> values() {
      return new Values<>(this);
    }

    @Override
    public Set<Map.Entry<K, V>> entrySet() {
      return new EntrySet<>(this);
    }
  }

  protected static class KeySet<K> extends AbstractSet<K> {
    private final MapView<K, ?> owner;
    protected KeySet(final MapView<K, ?> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<K> iterator() {
      return new KeyIterator<>(owner.inner);
    }
    public final boolean contains(Object o) {
      return owner.containsKey(o);
    }
    public final boolean remove(Object key) {
      return owner.remove(key) != null;
    }

    public final void forEach(Consumer<? super K> action) {
      if (action == null) {
        throw new NullPointerException();
      }
      owner.inner.forEach((k, _v) -> action.accept(k));
    }
  }

  protected static class Values<V> extends AbstractCollection<V> {
    private final MapView<?, V> owner;
    protected Values(final MapView<?, V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<V> iterator() {
      return new ValueIterator<>(owner.inner);
    }
    public final boolean contains(Object o) {
      return owner.containsValue(o);
    }

    public final void forEach(Consumer<? super V> action) {
      if (action == null) {
        throw new NullPointerException();
      }
      owner.inner.forEach((_k, v) -> action.accept(v));
    }
  }

  protected static class EntrySet<K, V> extends AbstractSet<Map.Entry<K, V>> {
    private final MapView<K, V> owner;
    protected EntrySet(final MapView<K, V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<Map.Entry<K, V>> iterator() {
      return new EntryIterator<>(owner.inner);
    }

    public final boolean contains(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      Entry<K, V> entry = owner.inner.findEntry(castUnsafe(e.getKey()));
      return entry != null && entry.value.equals(e.getValue());
    }
    public final boolean remove(Object o) {
      if (o instanceof Map.Entry<?, ?>) {
        Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
        return owner.remove(e.getKey(), e.getValue());
      }
      return false;
    }
  }

  protected static abstract class HashIterator<K, V> {
    protected final ChainedHashMap<K, V> owner;
    private int expectedModCount;
    // bucket holding nextNode, and the one holding current
    private int bucketIndex;
    private int currentBucketIndex;
    private BucketList.Node<Entry<K, V>> nextNode;
    private Entry<K, V> current;

    protected HashIterator(final ChainedHashMap<K, V> owner) {
      owner.ensureOpen();
      this.owner = owner;
      this.expectedModCount = owner.modCount;
      this.bucketIndex = -1;
      this.currentBucketIndex = -1;
      this.current = null;
      this.nextNode = this.findNode(null);
    }

    private BucketList.Node<Entry<K, V>> findNode(BucketList.Node<Entry<K, V>> after) {
      if (this.expectedModCount != owner.modCount) {
        throw new ConcurrentModificationException();
      }
      BucketList.Node<Entry<K, V>> n = after == null ? null : after.next();
      while (n == null && this.bucketIndex + 1 < owner.buckets.length) {
        this.bucketIndex++;
        n = owner.buckets[this.bucketIndex].head();
      }
      return n;
    }

    public final boolean hasNext() {
      return this.nextNode != null;
    }

    public final void remove() {
      if (this.current == null) {
        throw new IllegalStateException();
      }
      if (this.expectedModCount != owner.modCount) {
        throw new ConcurrentModificationException();
      }
      owner.removeEntry(this.currentBucketIndex, this.current);
      this.expectedModCount = owner.modCount;
      this.current = null;
    }

    protected Entry<K, V> advance() {
      if (this.nextNode == null) {
        throw new NoSuchElementException();
      }
      BucketList.Node<Entry<K, V>> node = this.nextNode;
      this.current = node.item();
      this.currentBucketIndex = this.bucketIndex;
      this.nextNode = this.findNode(node);
      return this.current;
    }
  }

  protected static class KeyIterator<K> extends HashIterator<K, Object> implements Iterator<K> {
    protected KeyIterator(final ChainedHashMap<K, ?> owner) {
      super(castUnsafe(owner));
    }
    public final K next() {
      return this.advance().key;
    }
  }

  protected static class ValueIterator<V> extends HashIterator<Object, V> implements Iterator<V> {
    protected ValueIterator(final ChainedHashMap<?, V> owner) {
      super(castUnsafe(owner));
    }
    public final V next() {
      return this.advance().value;
    }
  }

  protected static class EntryIterator<K, V> extends HashIterator<K, V> implements Iterator<Map.Entry<K, V>> {
    protected EntryIterator(final ChainedHashMap<K, V> owner) {
      super(owner);
    }
    public final Map.Entry<K, V> next() {
      return this.advance();
    }
  }

  // end section adapted from
  // https://github.com/apache/commons-collections/blob/master/src/main/java/org/apache/commons/collections4/map/AbstractHashedMap.java
}
