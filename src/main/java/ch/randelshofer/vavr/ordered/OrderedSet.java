/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2024 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.ordered;

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.HashSet;
import io.vavr.collection.Iterator;
import io.vavr.collection.List;
import io.vavr.control.Option;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collector;

/**
 * Implements an immutable set that iterates in the order, in which elements were inserted.
 * <p>
 * Features:
 * <ul>
 *     <li>allows null elements</li>
 *     <li>is immutable</li>
 *     <li>is thread-safe</li>
 *     <li>iterates in the order, in which elements were inserted</li>
 *     <li>re-adding an element with {@link #add} moves it to the end</li>
 *     <li>two sets are only equal if they iterate the same elements in the same order</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>add, remove: O(log N) in an amortized sense, because we sometimes have to
 *     renumber the elements.</li>
 *     <li>contains: O(1)</li>
 *     <li>toHashSet: O(1)</li>
 *     <li>iterator creation: O(1)</li>
 *     <li>iterator.next: O(1)</li>
 *     <li>head, last: O(1)</li>
 * </ul>
 * <p>
 * This set keeps its elements in a {@link HashSet}, and their insertion order in a
 * {@link KeySequence}. See {@link OrderedMap} for details.
 * <p>
 * This set does not provide {@code union}, {@code intersect} or {@code diff}: there is
 * no single right way to interleave the insertion orders of two sets.
 *
 * @param <T> the element type
 */
public final class OrderedSet<T> implements Iterable<T>, Serializable {
    private static final long serialVersionUID = 1L;
    private static final OrderedSet<?> EMPTY = new OrderedSet<>(HashSet.empty(), KeySequence.empty());

    private final HashSet<T> backing;
    private final transient KeySequence<T> order;

    private OrderedSet(HashSet<T> backing, KeySequence<T> order) {
        this.backing = Objects.requireNonNull(backing);
        this.order = Objects.requireNonNull(order);
    }

    static <T> OrderedSet<T> wrap(HashSet<T> backing, KeySequence<T> order) {
        return backing.isEmpty() ? empty() : new OrderedSet<>(backing, order);
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain an {@link OrderedSet}.
     *
     * @param <T> Component type of the OrderedSet.
     * @return An OrderedSet Collector.
     */
    public static <T> Collector<T, ArrayList<T>, OrderedSet<T>> collector() {
        return Collector.of(ArrayList::new, ArrayList::add, (left, right) -> {
            left.addAll(right);
            return left;
        }, OrderedSet::ofAll);
    }

    /**
     * Returns the empty {@code OrderedSet}.
     *
     * @param <T> Component type
     * @return An empty {@code OrderedSet}.
     */
    @SuppressWarnings("unchecked")
    public static <T> OrderedSet<T> empty() {
        return (OrderedSet<T>) EMPTY;
    }

    /**
     * Narrows a widened {@code OrderedSet<? extends T>} to {@code OrderedSet<T>}
     * by performing a type-safe cast. This is eligible because immutable/read-only
     * collections are covariant.
     *
     * @param orderedSet An {@code OrderedSet}.
     * @param <T>        Component type of the {@code OrderedSet}.
     * @return the given {@code orderedSet} instance as narrowed type {@code OrderedSet<T>}.
     */
    @SuppressWarnings("unchecked")
    public static <T> OrderedSet<T> narrow(OrderedSet<? extends T> orderedSet) {
        return (OrderedSet<T>) orderedSet;
    }

    /**
     * Returns a singleton {@code OrderedSet}, i.e. an {@code OrderedSet} of one element.
     *
     * @param element An element.
     * @param <T>     The component type
     * @return A new OrderedSet instance containing the given element
     */
    public static <T> OrderedSet<T> of(T element) {
        return OrderedSet.<T>empty().add(element);
    }

    /**
     * Creates an OrderedSet of the given elements.
     * <p>
     * If an element occurs more than once, it takes the position of its last occurrence.
     *
     * <pre><code>OrderedSet.of(1, 2, 1)   // = OrderedSet(2, 1)</code></pre>
     *
     * @param <T>      Component type of the OrderedSet.
     * @param elements Zero or more elements.
     * @return A set containing the given elements.
     * @throws NullPointerException if {@code elements} is null
     */
    @SafeVarargs
    public static <T> OrderedSet<T> of(T... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return OrderedSet.<T>empty().addAll(Arrays.asList(elements));
    }

    /**
     * Creates an OrderedSet of the given elements, in iteration order.
     * <p>
     * If an element occurs more than once, it takes the position of its last occurrence.
     *
     * @param elements Set elements
     * @param <T>      The value type
     * @return A new OrderedSet containing the given entries
     */
    @SuppressWarnings("unchecked")
    public static <T> OrderedSet<T> ofAll(Iterable<? extends T> elements) {
        Objects.requireNonNull(elements, "elements is null");
        if (elements instanceof OrderedSet) {
            return (OrderedSet<T>) elements;
        }
        return OrderedSet.<T>empty().addAll(elements);
    }

    /**
     * Creates an OrderedSet that contains the elements of the given {@link java.util.stream.Stream}.
     *
     * @param javaStream A {@link java.util.stream.Stream}
     * @param <T>        Component type of the Stream.
     * @return An OrderedSet containing the given elements in the encounter order of the stream.
     */
    public static <T> OrderedSet<T> ofAll(java.util.stream.Stream<? extends T> javaStream) {
        Objects.requireNonNull(javaStream, "javaStream is null");
        return OrderedSet.<T>empty().addAll(Iterator.ofAll(javaStream.iterator()));
    }

    private OrderedSet<T> addAll(Iterable<? extends T> elements) {
        HashSet<T> newBacking = backing;
        KeySequence<T> newOrder = order;
        for (T element : elements) {
            newBacking = newBacking.add(element);
            newOrder = newOrder.append(element);
        }
        return newBacking == backing && newOrder == order ? this : wrap(newBacking, newOrder);
    }

    /**
     * Adds the specified element. If the element is already in this set,
     * it is moved to the end.
     *
     * @param element an element
     * @return a set that ends with the element
     */
    public OrderedSet<T> add(T element) {
        KeySequence<T> newOrder = order.append(element);
        return newOrder == order ? this : new OrderedSet<>(backing.add(element), newOrder);
    }

    /**
     * Removes the specified element.
     *
     * @param element an element
     * @return a set without the element, or this set if it does not contain the element
     */
    public OrderedSet<T> remove(T element) {
        if (!backing.contains(element)) {
            return this;
        }
        return wrap(backing.remove(element), order.remove(element));
    }

    /**
     * Returns true if this set contains the given element.
     *
     * @param element an element
     * @return true if the element is in this set
     */
    public boolean contains(T element) {
        return backing.contains(element);
    }

    /**
     * Returns true if this set has no elements.
     *
     * @return true if this set is empty
     */
    public boolean isEmpty() {
        return backing.isEmpty();
    }

    /**
     * Returns the number of elements.
     *
     * @return the size of this set
     */
    public int size() {
        return backing.size();
    }

    /**
     * Returns the element that was added first.
     *
     * @return the first element
     * @throws NoSuchElementException if this set is empty
     */
    public T head() {
        if (isEmpty()) {
            throw new NoSuchElementException("head of empty OrderedSet");
        }
        return order.head();
    }

    /**
     * Returns the first element, if there is one.
     *
     * @return {@code Some(element)}, or {@code None} if this set is empty
     */
    public Option<T> headOption() {
        return isEmpty() ? Option.none() : Option.some(head());
    }

    /**
     * Returns the element that was added last.
     *
     * @return the last element
     * @throws NoSuchElementException if this set is empty
     */
    public T last() {
        if (isEmpty()) {
            throw new NoSuchElementException("last of empty OrderedSet");
        }
        return order.last();
    }

    /**
     * Returns the last element, if there is one.
     *
     * @return {@code Some(element)}, or {@code None} if this set is empty
     */
    public Option<T> lastOption() {
        return isEmpty() ? Option.none() : Option.some(last());
    }

    /**
     * Returns the elements of this set in insertion order.
     *
     * @return the elements
     */
    public List<T> toList() {
        return List.ofAll(this);
    }

    /**
     * Returns the unordered backing set of this set.
     *
     * @return the backing set
     */
    public HashSet<T> toHashSet() {
        return backing;
    }

    /**
     * Copies this set into a new {@link java.util.LinkedHashSet} with the same iteration order.
     *
     * @return a new mutable set
     */
    public java.util.LinkedHashSet<T> toJavaSet() {
        java.util.LinkedHashSet<T> s = new java.util.LinkedHashSet<>();
        for (T element : this) {
            s.add(element);
        }
        return s;
    }

    /**
     * Maps the elements of this set.
     * <p>
     * The mapped elements are added in the order of this set. If two elements map to
     * the same value, the value takes the position of the later one.
     *
     * <pre><code>OrderedSet.of(1, 2, 3).map(i -&gt; i % 2)   // = OrderedSet(0, 1)</code></pre>
     *
     * @param mapper a mapping function
     * @param <U>    the new element type
     * @return the mapped set
     */
    public <U> OrderedSet<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper is null");
        return OrderedSet.<U>empty().addAll(iterator().map(mapper));
    }

    /**
     * Folds the elements of this set from the first to the last element.
     *
     * @param zero the initial value
     * @param f    combines an element and the accumulated value
     * @param <U>  the result type
     * @return the folded value
     */
    public <U> U foldLeft(U zero, BiFunction<? super T, ? super U, ? extends U> f) {
        Objects.requireNonNull(f, "f is null");
        U acc = zero;
        for (Iterator<T> i = iterator(); i.hasNext(); ) {
            acc = f.apply(i.next(), acc);
        }
        return acc;
    }

    /**
     * Folds the elements of this set from the last to the first element.
     *
     * @param zero the initial value
     * @param f    combines an element and the accumulated value
     * @param <U>  the result type
     * @return the folded value
     */
    public <U> U foldRight(U zero, BiFunction<? super T, ? super U, ? extends U> f) {
        Objects.requireNonNull(f, "f is null");
        U acc = zero;
        for (Iterator<T> i = reverseIterator(); i.hasNext(); ) {
            acc = f.apply(i.next(), acc);
        }
        return acc;
    }

    /**
     * Returns the elements that satisfy the predicate, in their original order.
     *
     * @param predicate tests an element
     * @return the matching elements, or this set if all elements match
     */
    public OrderedSet<T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        OrderedSet<T> result = OrderedSet.<T>empty().addAll(iterator().filter(predicate));
        return result.size() == size() ? this : result;
    }

    /**
     * Returns the elements that do not satisfy the predicate, in their original order.
     *
     * @param predicate tests an element
     * @return the non-matching elements
     */
    public OrderedSet<T> reject(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return filter(predicate.negate());
    }

    /**
     * Splits this set into the elements that satisfy the predicate, and the elements
     * that do not. Both sets keep the relative order of this set.
     *
     * @param predicate a predicate
     * @return a tuple of the matching and the non-matching elements
     */
    public Tuple2<OrderedSet<T>, OrderedSet<T>> partition(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        OrderedSet<T> pass = empty();
        OrderedSet<T> fail = empty();
        for (Iterator<T> i = iterator(); i.hasNext(); ) {
            T element = i.next();
            if (predicate.test(element)) {
                pass = pass.add(element);
            } else {
                fail = fail.add(element);
            }
        }
        return Tuple.of(pass, fail);
    }

    @Override
    public Iterator<T> iterator() {
        return order.iterator().filter(backing::contains);
    }

    /**
     * Returns an iterator over the elements of this set, from the last to the first element.
     *
     * @return a reverse iterator
     */
    public Iterator<T> reverseIterator() {
        return order.reverseIterator().filter(backing::contains);
    }

    @Override
    public Spliterator<T> spliterator() {
        return Spliterators.spliterator(iterator(), size(),
                Spliterator.SIZED | Spliterator.DISTINCT | Spliterator.ORDERED | Spliterator.IMMUTABLE);
    }

    /**
     * Returns true if the given object is an {@code OrderedSet} with equal elements
     * in the same order.
     *
     * @param o an object
     * @return true if equal
     */
    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof OrderedSet)) {
            return false;
        }
        OrderedSet<?> that = (OrderedSet<?>) o;
        if (size() != that.size()) {
            return false;
        }
        Iterator<?> i = iterator();
        Iterator<?> j = that.iterator();
        while (i.hasNext()) {
            if (!Objects.equals(i.next(), j.next())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Iterator<T> i = iterator(); i.hasNext(); ) {
            h = 31 * h + Objects.hashCode(i.next());
        }
        return h;
    }

    @Override
    public String toString() {
        return iterator().mkString("OrderedSet(", ", ", ")");
    }

    private Object writeReplace() {
        return new SerializationProxy<>(this);
    }

    /**
     * {@code readObject} method for the serialization proxy pattern.
     * <p>
     * Guarantees that the serialization system will never generate a serialized instance of the enclosing class.
     *
     * @param stream An object serialization stream.
     * @throws InvalidObjectException This method will throw with the message "Proxy required".
     */
    private void readObject(ObjectInputStream stream) throws InvalidObjectException {
        throw new InvalidObjectException("Proxy required");
    }

    // DEV NOTE: The serialization proxy pattern is not compatible with non-final, i.e. extendable,
    // classes. Also, it may not be compatible with circular object graphs.
    private static final class SerializationProxy<T> implements Serializable {

        private static final long serialVersionUID = 1L;

        // the instance to be serialized/deserialized
        private transient OrderedSet<T> set;

        SerializationProxy(OrderedSet<T> set) {
            this.set = set;
        }

        @SuppressWarnings("unchecked")
        private void readObject(ObjectInputStream s) throws ClassNotFoundException, IOException {
            s.defaultReadObject();
            final int size = s.readInt();
            if (size < 0) {
                throw new InvalidObjectException("No elements");
            }
            OrderedSet<T> result = empty();
            for (int i = 0; i < size; i++) {
                result = result.add((T) s.readObject());
            }
            set = result;
        }

        private Object readResolve() {
            return set;
        }

        private void writeObject(ObjectOutputStream s) throws IOException {
            s.defaultWriteObject();
            s.writeInt(set.size());
            for (T element : set) {
                s.writeObject(element);
            }
        }
    }
}
