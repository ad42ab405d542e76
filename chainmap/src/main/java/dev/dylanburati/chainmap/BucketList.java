package dev.dylanburati.chainmap;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Singly-linked list usable as a stack, queue or deque.
 *
 * Pushing to either end and popping from the front take O(1) time. Popping from
 * the back takes O(n), since the list keeps no predecessor links and has to walk
 * to the node before the tail. If you only need to pop from one end, pop from
 * the front.
 *
 * Pushes allocate a node and report {@link Status#OUT_OF_MEMORY} instead of
 * throwing when that allocation fails; the list is unchanged in that case.
 */
public class BucketList<E> implements Iterable<E> {
  private static final Logger log = LoggerFactory.getLogger(BucketList.class);

  private final Allocator allocator;
  // INVARIANT: length == 0 <=> head == null <=> tail == null
  private Node<E> head;
  private Node<E> tail;
  private int length;

  public BucketList() {
    this(DefaultAllocator.instance());
  }

  BucketList(final Allocator allocator) {
    this.allocator = Objects.requireNonNull(allocator);
    this.head = null;
    this.tail = null;
    this.length = 0;
  }

  /** A link in the list. Only the list that created a node may modify it. */
  public static final class Node<E> {
    private final E item;
    private Node<E> next;

    Node(E item, Node<E> next) {
      this.item = item;
      this.next = next;
    }

    public E item() {
      return this.item;
    }

    public Node<E> next() {
      return this.next;
    }
  }

  public int length() {
    return this.length;
  }

  public boolean isEmpty() {
    return this.length == 0;
  }

  public Node<E> head() {
    return this.head;
  }

  public Node<E> tail() {
    return this.tail;
  }

  /** Adds an item to the back of the list in O(1) time. */
  public Status pushBack(E item) {
    Node<E> node = this.allocate(item, null);
    if (node == null) {
      return Status.OUT_OF_MEMORY;
    }
    if (this.head == null) {
      this.head = node;
    } else {
      this.tail.next = node;
    }
    this.tail = node;
    this.length++;
    return Status.OK;
  }

  /** Adds an item to the front of the list in O(1) time. */
  public Status pushFront(E item) {
    Node<E> node = this.allocate(item, this.head);
    if (node == null) {
      return Status.OUT_OF_MEMORY;
    }
    this.linkFirst(node);
    return Status.OK;
  }

  /** Removes the first item in O(1) time, or returns empty if the list is empty. */
  public Optional<E> popFront() {
    Node<E> node = this.unlinkFirst();
    return node == null ? Optional.empty() : Optional.ofNullable(node.item);
  }

  /** Removes the last item in O(n) time, or returns empty if the list is empty. */
  public Optional<E> popBack() {
    if (this.head == null) {
      return Optional.empty();
    }
    Node<E> last = this.tail;
    if (this.head == last) {
      this.head = null;
      this.tail = null;
      this.length = 0;
      return Optional.ofNullable(last.item);
    }

    Node<E> curr = this.head;
    while (curr.next != last) {
      curr = curr.next;
    }
    curr.next = null;
    this.tail = curr;
    this.length--;
    return Optional.ofNullable(last.item);
  }

  /** Best case O(1), worst case O(n). */
  public boolean includes(BiPredicate<? super E, ? super E> cmp, E item) {
    Objects.requireNonNull(cmp);
    for (Node<E> curr = this.head; curr != null; curr = curr.next) {
      if (cmp.test(curr.item, item)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Unlinks {@code node}, which must belong to this list. {@code prev} is the
   * node directly before it, or {@code null} if {@code node} is the head.
   *
   * Head and tail removals take the {@link #popFront} and {@link #popBack} paths.
   * An interior node is only unlinked when {@code prev.next == node}; if
   * {@code prev} does not precede {@code node}, or is {@code null} for a node
   * that isn't the head, the list is left as it is.
   */
  public void remove(Node<E> node, Node<E> prev) {
    if (this.head == null) {
      return;
    }
    if (node == this.head) {
      this.unlinkFirst();
      return;
    }
    if (node == this.tail) {
      this.popBack();
      return;
    }
    if (prev != null && prev.next == node) {
      prev.next = node.next;
      node.next = null;
      this.length--;
    }
  }

  /** Unlinks every node in O(n) time. The list is empty and usable afterwards. */
  public void clear() {
    Node<E> curr = this.head;
    while (curr != null) {
      Node<E> next = curr.next;
      curr.next = null;
      curr = next;
    }
    this.head = null;
    this.tail = null;
    this.length = 0;
  }

  /**
   * Moves the head node of this list to the front of {@code target} without
   * allocating. Returns false if this list is empty.
   */
  boolean moveFrontTo(BucketList<E> target) {
    Node<E> node = this.unlinkFirst();
    if (node == null) {
      return false;
    }
    node.next = target.head;
    target.linkFirst(node);
    return true;
  }

  @Override
  public Iterator<E> iterator() {
    return new NodeIterator<>(this.head);
  }

  @Override
  public void forEach(Consumer<? super E> action) {
    if (action == null) {
      throw new NullPointerException();
    }
    for (Node<E> curr = this.head; curr != null; curr = curr.next) {
      action.accept(curr.item);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (Node<E> curr = this.head; curr != null; curr = curr.next) {
      sb.append(curr.item);
      if (curr.next != null) {
        sb.append(", ");
      }
    }
    return sb.append(']').toString();
  }

  private Node<E> allocate(E item, Node<E> next) {
    try {
      return this.allocator.newNode(item, next);
    } catch (OutOfMemoryError e) {
      log.warn("Could not allocate list node (length={})", this.length, e);
      return null;
    }
  }

  // node.next must already point at the current head
  private void linkFirst(Node<E> node) {
    if (this.head == null) {
      this.tail = node;
    }
    this.head = node;
    this.length++;
  }

  private Node<E> unlinkFirst() {
    Node<E> first = this.head;
    if (first == null) {
      return null;
    }
    if (first == this.tail) {
      this.head = null;
      this.tail = null;
      this.length = 0;
    } else {
      this.head = first.next;
      this.length--;
    }
    first.next = null;
    return first;
  }

  private static final class NodeIterator<E> implements Iterator<E> {
    private Node<E> next;

    NodeIterator(Node<E> head) {
      this.next = head;
    }

    @Override
    public boolean hasNext() {
      return this.next != null;
    }

    @Override
    public E next() {
      if (this.next == null) {
        throw new NoSuchElementException();
      }
      E item = this.next.item;
      this.next = this.next.next;
      return item;
    }
  }
}
