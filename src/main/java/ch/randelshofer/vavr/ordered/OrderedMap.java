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

import io.vavr.Function3;
import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.HashMap;
import io.vavr.collection.HashSet;
import io.vavr.collection.Iterator;
import io.vavr.collection.List;
import io.vavr.collection.Seq;
import io.vavr.collection.Vector;
import io.vavr.control.Option;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collector;

/**
 * Implements an immutable map that iterates in the order, in which keys were inserted.
 * <p>
 * Features:
 * <ul>
 *     <li>allows null keys and null values</li>
 *     <li>is immutable</li>
 *     <li>is thread-safe</li>
 *     <li>iterates in the order, in which keys were inserted</li>
 *     <li>re-inserting a key with {@link #put} moves it to the end</li>
 *     <li>two maps are only equal if they iterate the same entries in the same order</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>put, remove: O(log N) in an amortized sense, because we sometimes have to
 *     renumber the keys.</li>
 *     <li>update: O(log N)</li>
 *     <li>get, containsKey: O(1)</li>
 *     <li>toHashMap: O(1)</li>
 *     <li>iterator creation: O(1)</li>
 *     <li>iterator.next: O(1)</li>
 *     <li>head, last: O(1)</li>
 * </ul>
 * <p>
 * Implementation details:
 * <p>
 * This map keeps two structures: a {@link HashMap} that holds the entries, and a
 * {@link KeySequence} that holds the keys in insertion order. Lookups only consult
 * the hash map. Iteration walks the key sequence and looks up the value of each key
 * in the hash map.
 * <p>
 * Every write operation updates both structures, and only publishes the new map once
 * both are complete. Both structures are persistent, so a new map shares most of its
 * nodes with the map it was derived from.
 * <p>
 * This map does not provide {@code merge}, {@code union} or similar operations: there
 * is no single right way to interleave the insertion orders of two maps. Fold one map
 * into the other with {@link #put} instead.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class OrderedMap<K, V> implements Iterable<Tuple2<K, V>>, Serializable {
    private static final long serialVersionUID = 1L;
    private static final OrderedMap<?, ?> EMPTY = new OrderedMap<>(HashMap.empty(), KeySequence.empty());

    /**
     * Holds the entries of this map, in no particular order.
     */
    private final HashMap<K, V> backing;

    /**
     * Holds the keys of {@link #backing} in the order in which they were inserted.
     */
    private final transient KeySequence<K> order;

    private OrderedMap(HashMap<K, V> backing, KeySequence<K> order) {
        this.backing = Objects.requireNonNull(backing);
        this.order = Objects.requireNonNull(order);
    }

    private static <K, V> OrderedMap<K, V> wrap(HashMap<K, V> backing, KeySequence<K> order) {
        return backing.isEmpty() ? empty() : new OrderedMap<>(backing, order);
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain an {@link OrderedMap}.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return An {@link OrderedMap} Collector.
     */
    public static <K, V> Collector<Tuple2<K, V>, ArrayList<Tuple2<K, V>>, OrderedMap<K, V>> collector() {
        return Collector.of(ArrayList::new, ArrayList::add, (left, right) -> {
            left.addAll(right);
            return left;
        }, OrderedMap::ofEntries);
    }

    /**
     * Returns the empty {@code OrderedMap}.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return An empty {@code OrderedMap}.
     */
    @SuppressWarnings("unchecked")
    public static <K, V> OrderedMap<K, V> empty() {
        return (OrderedMap<K, V>) EMPTY;
    }

    /**
     * Narrows a widened {@code OrderedMap<? extends K, ? extends V>} to {@code OrderedMap<K, V>}
     * by performing a type-safe cast. This is eligible because immutable/read-only
     * collections are covariant.
     *
     * @param orderedMap An {@code OrderedMap}.
     * @param <K>        Key type
     * @param <V>        Value type
     * @return the given {@code orderedMap} instance as narrowed type {@code OrderedMap<K, V>}.
     */
    @SuppressWarnings("unchecked")
    public static <K, V> OrderedMap<K, V> narrow(OrderedMap<? extends K, ? extends V> orderedMap) {
        return (OrderedMap<K, V>) orderedMap;
    }

    /**
     * Returns a singleton {@code OrderedMap}, i.e. an {@code OrderedMap} of one entry.
     *
     * @param entry A map entry.
     * @param <K>   The key type
     * @param <V>   The value type
     * @return A new Map containing the given entry
     */
    public static <K, V> OrderedMap<K, V> of(Tuple2<? extends K, ? extends V> entry) {
        Objects.requireNonNull(entry, "entry is null");
        return OrderedMap.<K, V>empty().put(entry._1, entry._2);
    }

    /**
     * Returns a singleton {@code OrderedMap}, i.e. an {@code OrderedMap} of one entry.
     *
     * @param key   A singleton map key.
     * @param value A singleton map value.
     * @param <K>   The key type
     * @param <V>   The value type
     * @return A new Map containing the given entry
     */
    public static <K, V> OrderedMap<K, V> of(K key, V value) {
        return OrderedMap.<K, V>empty().put(key, value);
    }

    /**
     * Creates an {@code OrderedMap} of the given pairs, in the given order.
     * If {@code k2} equals {@code k1}, the map has one entry with value {@code v2}.
     *
     * @param k1  a key for the map
     * @param v1  the value for k1
     * @param k2  a key for the map
     * @param v2  the value for k2
     * @param <K> The key type
     * @param <V> The value type
     * @return A new Map containing the given entries
     */
    public static <K, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2) {
        return OrderedMap.<K, V>empty().put(k1, v1).put(k2, v2);
    }

    /**
     * Creates an {@code OrderedMap} of the given pairs, in the given order.
     *
     * @param k1  a key for the map
     * @param v1  the value for k1
     * @param k2  a key for the map
     * @param v2  the value for k2
     * @param k3  a key for the map
     * @param v3  the value for k3
     * @param <K> The key type
     * @param <V> The value type
     * @return A new Map containing the given entries
     */
    public static <K, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
        return OrderedMap.<K, V>empty().put(k1, v1).put(k2, v2).put(k3, v3);
    }

    /**
     * Creates an OrderedMap of the given entries.
     * <p>
     * The entries are put in the given order. If a key occurs more than once,
     * the last occurrence determines its value and its position.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    @SafeVarargs
    public static <K, V> OrderedMap<K, V> ofEntries(Tuple2<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        return OrderedMap.<K, V>empty().putAllTuples(Arrays.asList(entries));
    }

    /**
     * Creates an OrderedMap of the given entries.
     * <p>
     * The entries are put in the given order. If a key occurs more than once,
     * the last occurrence determines its value and its position.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    @SafeVarargs
    public static <K, V> OrderedMap<K, V> ofEntries(Map.Entry<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        OrderedMap<K, V> result = empty();
        for (Map.Entry<? extends K, ? extends V> entry : entries) {
            result = result.put(entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Creates an OrderedMap of the given entries.
     * <p>
     * The entries are put in iteration order. If a key occurs more than once,
     * the last occurrence determines its value and its position.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    @SuppressWarnings("unchecked")
    public static <K, V> OrderedMap<K, V> ofEntries(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        if (entries instanceof OrderedMap<?, ?>) {
            return (OrderedMap<K, V>) entries;
        }
        return OrderedMap.<K, V>empty().putAllTuples(entries);
    }

    private OrderedMap<K, V> putAllTuples(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        HashMap<K, V> newBacking = backing;
        KeySequence<K> newOrder = order;
        for (Tuple2<? extends K, ? extends V> entry : entries) {
            newBacking = newBacking.put(entry._1, entry._2);
            newOrder = newOrder.append(entry._1);
        }
        return newBacking == backing && newOrder == order ? this : wrap(newBacking, newOrder);
    }

    /**
     * Associates the specified value with the specified key in this map.
     * <p>
     * If the map previously contained a mapping for the key, the old value is
     * replaced by the specified value, and the key is moved to the end of the map.
     *
     * @param key   key with which the specified value is to be associated
     * @param value value to be associated with the specified key
     * @return A new Map containing these elements and that entry.
     */
    public OrderedMap<K, V> put(K key, V value) {
        return new OrderedMap<>(backing.put(key, value), order.append(key));
    }

    /**
     * Convenience method for {@code put(entry._1, entry._2)}.
     *
     * @param entry A Tuple2 containing the key and value
     * @return A new Map containing these elements and that entry.
     */
    public OrderedMap<K, V> put(Tuple2<? extends K, ? extends V> entry) {
        Objects.requireNonNull(entry, "entry is null");
        return put(entry._1, entry._2);
    }

    /**
     * Updates the value of the specified key with the given function.
     * <p>
     * The function receives the current value of the key, or {@link Option#none()} if
     * the key is not in this map.
     * <ul>
     *     <li>If the function returns a value and the key is in this map, the value is
     *     replaced. Unlike {@link #put}, the key keeps its position.</li>
     *     <li>If the function returns a value and the key is not in this map, the entry
     *     is appended.</li>
     *     <li>If the function returns {@link Option#none()}, the key is removed.</li>
     * </ul>
     *
     * @param key     a key
     * @param updater computes the new value from the current one
     * @return the updated map
     */
    public OrderedMap<K, V> update(K key, Function<? super Option<V>, ? extends Option<? extends V>> updater) {
        Objects.requireNonNull(updater, "updater is null");
        final Option<V> current = backing.get(key);
        final Option<? extends V> updated = Objects.requireNonNull(updater.apply(current), "updater returned null");
        if (updated.isEmpty()) {
            return remove(key);
        }
        final HashMap<K, V> newBacking = backing.put(key, updated.get());
        return new OrderedMap<>(newBacking, current.isDefined() ? order : order.append(key));
    }

    /**
     * Removes the mapping for the specified key.
     *
     * @param key a key
     * @return a map without the key, or this map if the key is not in this map
     */
    public OrderedMap<K, V> remove(K key) {
        if (!backing.containsKey(key)) {
            return this;
        }
        return wrap(backing.remove(key), order.remove(key));
    }

    /**
     * Returns true if this map has no entries.
     *
     * @return true if this map is empty
     */
    public boolean isEmpty() {
        return backing.isEmpty();
    }

    /**
     * Returns true if this map contains the given key.
     * <p>
     * This is a lookup in the backing {@link HashMap}, its cost does not depend on
     * the number of removed keys.
     *
     * @param key a key
     * @return true if the key is in this map
     */
    public boolean containsKey(K key) {
        return backing.containsKey(key);
    }

    /**
     * Returns the value of the given key.
     *
     * @param key a key
     * @return {@code Some(value)} if the key is in this map, {@code None} otherwise
     */
    public Option<V> get(K key) {
        return backing.get(key);
    }

    /**
     * Returns the value of the given key, or {@code defaultValue} if the key is not in this map.
     *
     * @param key          a key
     * @param defaultValue the value returned for an absent key
     * @return the value of the key, or the default value
     */
    public V getOrElse(K key, V defaultValue) {
        return backing.getOrElse(key, defaultValue);
    }

    /**
     * Returns the number of entries.
     *
     * @return the size of this map
     */
    public int size() {
        return backing.size();
    }

    /**
     * Returns the first entry of this map.
     *
     * @return the entry that was inserted first
     * @throws NoSuchElementException if this map is empty
     */
    public Tuple2<K, V> head() {
        if (isEmpty()) {
            throw new NoSuchElementException("head of empty OrderedMap");
        }
        K key = order.head();
        return Tuple.of(key, backing.get(key).get());
    }

    /**
     * Returns the first entry of this map, if there is one.
     *
     * @return {@code Some(entry)}, or {@code None} if this map is empty
     */
    public Option<Tuple2<K, V>> headOption() {
        return isEmpty() ? Option.none() : Option.some(head());
    }

    /**
     * Returns the last entry of this map.
     *
     * @return the entry that was inserted last
     * @throws NoSuchElementException if this map is empty
     */
    public Tuple2<K, V> last() {
        if (isEmpty()) {
            throw new NoSuchElementException("last of empty OrderedMap");
        }
        K key = order.last();
        return Tuple.of(key, backing.get(key).get());
    }

    /**
     * Returns the last entry of this map, if there is one.
     *
     * @return {@code Some(entry)}, or {@code None} if this map is empty
     */
    public Option<Tuple2<K, V>> lastOption() {
        return isEmpty() ? Option.none() : Option.some(last());
    }

    /**
     * Returns the keys of this map in insertion order.
     *
     * @return the keys
     */
    public Seq<K> keys() {
        return Vector.ofAll(order.iterator().filter(backing::containsKey));
    }

    /**
     * Returns the keys of this map as an {@link OrderedSet} with the same order.
     *
     * @return the key set
     */
    public OrderedSet<K> keySet() {
        return OrderedSet.wrap(HashSet.ofAll(backing.keySet()), order);
    }

    /**
     * Returns the values of this map in the insertion order of their keys.
     *
     * @return the values
     */
    public Seq<V> values() {
        return Vector.ofAll(iterator().map(Tuple2::_2));
    }

    /**
     * Returns the entries of this map in insertion order.
     *
     * @return the entries
     */
    public List<Tuple2<K, V>> toList() {
        return List.ofAll(this);
    }

    /**
     * Returns the unordered backing map of this map.
     *
     * @return the backing map
     */
    public HashMap<K, V> toHashMap() {
        return backing;
    }

    /**
     * Copies this map into a new {@link java.util.LinkedHashMap} with the same iteration order.
     *
     * @return a new mutable map
     */
    public java.util.LinkedHashMap<K, V> toJavaMap() {
        java.util.LinkedHashMap<K, V> m = new java.util.LinkedHashMap<>();
        forEach((k, v) -> m.put(k, v));
        return m;
    }

    /**
     * Maps the values of this map. Keys and their order are left unchanged.
     *
     * @param mapper computes a new value from a key and its value
     * @param <W>    the new value type
     * @return a map with the same keys in the same order, and mapped values
     */
    public <W> OrderedMap<K, W> map(BiFunction<? super K, ? super V, ? extends W> mapper) {
        Objects.requireNonNull(mapper, "mapper is null");
        return new OrderedMap<>(backing.map((k, v) -> Tuple.<K, W>of(k, mapper.apply(k, v))), order);
    }

    /**
     * Maps the values of this map. Keys and their order stay the same.
     *
     * @param mapper maps a value to a new value
     * @param <W>    the new value type
     * @return a map with the mapped values
     */
    public <W> OrderedMap<K, W> mapValues(Function<? super V, ? extends W> mapper) {
        Objects.requireNonNull(mapper, "mapper is null");
        return map((k, v) -> mapper.apply(v));
    }

    /**
     * Folds the entries of this map from the first to the last entry.
     *
     * @param zero the initial value
     * @param f    combines a key, its value and the accumulated value
     * @param <U>  the result type
     * @return the folded value
     */
    public <U> U foldLeft(U zero, Function3<? super K, ? super V, ? super U, ? extends U> f) {
        Objects.requireNonNull(f, "f is null");
        U acc = zero;
        for (Iterator<Tuple2<K, V>> i = iterator(); i.hasNext(); ) {
            Tuple2<K, V> entry = i.next();
            acc = f.apply(entry._1, entry._2, acc);
        }
        return acc;
    }

    /**
     * Folds the entries of this map from the last to the first entry.
     *
     * @param zero the initial value
     * @param f    combines a key, its value and the accumulated value
     * @param <U>  the result type
     * @return the folded value
     */
    public <U> U foldRight(U zero, Function3<? super K, ? super V, ? super U, ? extends U> f) {
        Objects.requireNonNull(f, "f is null");
        U acc = zero;
        for (Iterator<Tuple2<K, V>> i = reverseIterator(); i.hasNext(); ) {
            Tuple2<K, V> entry = i.next();
            acc = f.apply(entry._1, entry._2, acc);
        }
        return acc;
    }

    /**
     * Returns the entries that satisfy the predicate, in their original order.
     *
     * @param predicate tests a key and its value
     * @return the matching entries, or this map if all entries match
     */
    public OrderedMap<K, V> filter(BiPredicate<? super K, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        OrderedMap<K, V> result = empty();
        for (Iterator<Tuple2<K, V>> i = iterator(); i.hasNext(); ) {
            Tuple2<K, V> entry = i.next();
            if (predicate.test(entry._1, entry._2)) {
                result = result.put(entry._1, entry._2);
            }
        }
        return result.size() == size() ? this : result;
    }

    /**
     * Returns the entries whose key satisfies the predicate, in their original order.
     *
     * @param predicate tests a key
     * @return the matching entries, or this map if all entries match
     */
    public OrderedMap<K, V> filterKeys(Predicate<? super K> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return filter((k, v) -> predicate.test(k));
    }

    /**
     * Returns the entries that do not satisfy the predicate, in their original order.
     *
     * @param predicate tests a key and its value
     * @return the non-matching entries
     */
    public OrderedMap<K, V> reject(BiPredicate<? super K, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return filter(predicate.negate());
    }

    /**
     * Splits this map into the entries that satisfy the predicate, and the entries
     * that do not. Both maps keep the relative order of this map.
     *
     * @param predicate tests a key and its value
     * @return a tuple of the matching and the non-matching entries
     */
    public Tuple2<OrderedMap<K, V>, OrderedMap<K, V>> partition(BiPredicate<? super K, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        OrderedMap<K, V> pass = empty();
        OrderedMap<K, V> fail = empty();
        for (Iterator<Tuple2<K, V>> i = iterator(); i.hasNext(); ) {
            Tuple2<K, V> entry = i.next();
            if (predicate.test(entry._1, entry._2)) {
                pass = pass.put(entry._1, entry._2);
            } else {
                fail = fail.put(entry._1, entry._2);
            }
        }
        return Tuple.of(pass, fail);
    }

    /**
     * Performs an action on each entry, from the first to the last entry.
     *
     * @param action consumes a key and its value
     */
    public void forEach(BiConsumer<? super K, ? super V> action) {
        Objects.requireNonNull(action, "action is null");
        for (Iterator<Tuple2<K, V>> i = iterator(); i.hasNext(); ) {
            Tuple2<K, V> entry = i.next();
            action.accept(entry._1, entry._2);
        }
    }

    @Override
    public Iterator<Tuple2<K, V>> iterator() {
        return entries(order.iterator());
    }

    /**
     * Returns an iterator over the entries of this map, from the last to the first entry.
     *
     * @return a reverse iterator
     */
    public Iterator<Tuple2<K, V>> reverseIterator() {
        return entries(order.reverseIterator());
    }

    // Keys without a value can only show up if the two structures got out of sync; they are skipped.
    private Iterator<Tuple2<K, V>> entries(Iterator<K> keys) {
        return keys.flatMap(key -> backing.get(key).map(value -> Tuple.of(key, value)));
    }

    @Override
    public Spliterator<Tuple2<K, V>> spliterator() {
        return Spliterators.spliterator(iterator(), size(),
                Spliterator.SIZED | Spliterator.DISTINCT | Spliterator.ORDERED | Spliterator.IMMUTABLE);
    }

    /**
     * Returns true if the given object is an {@code OrderedMap} with equal entries
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
        if (!(o instanceof OrderedMap)) {
            return false;
        }
        OrderedMap<?, ?> that = (OrderedMap<?, ?>) o;
        if (size() != that.size()) {
            return false;
        }
        Iterator<? extends Tuple2<?, ?>> i = iterator();
        Iterator<? extends Tuple2<?, ?>> j = that.iterator();
        while (i.hasNext()) {
            if (!i.next().equals(j.next())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Iterator<Tuple2<K, V>> i = iterator(); i.hasNext(); ) {
            h = 31 * h + i.next().hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        return iterator().mkString("OrderedMap(", ", ", ")");
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

    /**
     * A serialization proxy which, in this context, is used to deserialize immutable, ordered maps with final
     * instance fields.
     *
     * @param <K> The key type
     * @param <V> The value type
     */
    // DEV NOTE: The serialization proxy pattern is not compatible with non-final, i.e. extendable,
    // classes. Also, it may not be compatible with circular object graphs.
    private static final class SerializationProxy<K, V> implements Serializable {

        private static final long serialVersionUID = 1L;

        // the instance to be serialized/deserialized
        private transient OrderedMap<K, V> map;

        /**
         * Constructor for the case of serialization, called by {@link OrderedMap#writeReplace()}.
         * <p/>
         * The constructor of a SerializationProxy takes an argument that concisely represents the logical state of
         * an instance of the enclosing class.
         *
         * @param map a map
         */
        SerializationProxy(OrderedMap<K, V> map) {
            this.map = map;
        }

        /**
         * Read an object from a deserialization stream.
         *
         * @param s An object deserialization stream.
         * @throws ClassNotFoundException If the object's class read from the stream cannot be found.
         * @throws InvalidObjectException If the stream contains a negative size.
         * @throws IOException            If an error occurs reading from the stream.
         */
        @SuppressWarnings("unchecked")
        private void readObject(ObjectInputStream s) throws ClassNotFoundException, IOException {
            s.defaultReadObject();
            final int size = s.readInt();
            if (size < 0) {
                throw new InvalidObjectException("No elements");
            }
            OrderedMap<K, V> m = empty();
            for (int i = 0; i < size; i++) {
                final K key = (K) s.readObject();
                final V value = (V) s.readObject();
                m = m.put(key, value);
            }
            map = m;
        }

        /**
         * {@code readResolve} method for the serialization proxy pattern.
         * <p>
         * Returns a logically equivalent instance of the enclosing class. The presence of this method causes the
         * serialization system to translate the serialization proxy back into an instance of the enclosing class
         * upon deserialization.
         *
         * @return A deserialized instance of the enclosing class.
         */
        private Object readResolve() {
            return map;
        }

        /**
         * Write an object to a serialization stream.
         *
         * @param s An object serialization stream.
         * @throws IOException If an error occurs writing to the stream.
         */
        private void writeObject(ObjectOutputStream s) throws IOException {
            s.defaultWriteObject();
            s.writeInt(map.size());
            for (Iterator<Tuple2<K, V>> i = map.iterator(); i.hasNext(); ) {
                Tuple2<K, V> e = i.next();
                s.writeObject(e._1);
                s.writeObject(e._2);
            }
        }
    }
}
