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

import io.vavr.collection.HashMap;
import io.vavr.collection.Iterator;
import io.vavr.collection.Vector;
import io.vavr.control.Option;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * An immutable sequence of distinct keys, in the order in which they were inserted.
 * <p>
 * This is the order record of {@link OrderedMap} and {@link OrderedSet}. The containers
 * keep their keys in an unordered backing structure, and record the insertion order here.
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>append: O(log N) in an amortized sense, because we sometimes have to
 *     renumber the keys.</li>
 *     <li>remove: O(log N) in an amortized sense, because we sometimes have to renumber the keys.</li>
 *     <li>contains: O(1)</li>
 *     <li>iterator creation: O(1)</li>
 *     <li>iterator.next: O(1)</li>
 *     <li>head, last: O(1)</li>
 * </ul>
 * <p>
 * Implementation details:
 * <p>
 * Each key gets a sequence number when it is appended. The key is stored in a
 * {@link Vector} at index {@code sequence number + offset}. The sequence number of
 * each key is stored in a {@link HashMap}, so that we can find the slot of a key
 * without searching the vector.
 * <p>
 * If a key is removed that is not the first or the last key of the vector, we replace
 * its slot by a tombstone. If the key is at the start or end of the vector, we remove
 * the slot and all its neighboring tombstones from the vector. Removing slots from the
 * start of the vector shifts all indices, which we compensate for by decrementing the offset.
 * <p>
 * A tombstone can store the number of tombstones in the run it belongs to, in ascending
 * and in descending direction. We use these numbers to skip tombstones when we iterate
 * over the vector. Since we only iterate in ascending or descending order from one of the
 * ends of the vector, we only enter a run at one of its ends. It is sufficient, if we keep
 * the numbers of the first and the last tombstone of a run up to date.
 * <p>
 * If the number of tombstones exceeds the number of keys, or if the sequence numbers are
 * about to overflow, we renumber all keys, and we create a new vector without tombstones.
 *
 * @param <K> the key type
 */
final class KeySequence<K> {

    private static final KeySequence<?> EMPTY = new KeySequence<>(Vector.empty(), HashMap.empty(), 0);

    /**
     * In this vector we store the keys in the order in which they were inserted,
     * interspersed with {@link Tombstone}s.
     */
    private final Vector<Object> vector;

    /**
     * Maps each key to its sequence number.
     */
    private final HashMap<K, Integer> sequenceNumbers;

    /**
     * Offset of sequence numbers to vector indices.
     *
     * <pre>vector index = sequence number + offset</pre>
     */
    private final int offset;

    private KeySequence(Vector<Object> vector, HashMap<K, Integer> sequenceNumbers, int offset) {
        this.vector = Objects.requireNonNull(vector);
        this.sequenceNumbers = Objects.requireNonNull(sequenceNumbers);
        this.offset = offset;
    }

    @SuppressWarnings("unchecked")
    static <K> KeySequence<K> empty() {
        return (KeySequence<K>) EMPTY;
    }

    /**
     * Returns true if the vector must be renumbered.
     *
     * @param size         the number of keys
     * @param offset       the offset of sequence numbers to vector indices
     * @param vectorLength the number of slots in the vector, including tombstones
     * @return true if the vector must be renumbered
     */
    static boolean mustRenumber(int size, int offset, int vectorLength) {
        return vectorLength >>> 1 > size
                || (long) vectorLength - offset > Integer.MAX_VALUE - 2
                || offset < Integer.MIN_VALUE + 2;
    }

    int size() {
        return sequenceNumbers.size();
    }

    boolean isEmpty() {
        return sequenceNumbers.isEmpty();
    }

    boolean contains(K key) {
        return sequenceNumbers.containsKey(key);
    }

    /**
     * Number of slots in the vector, including tombstones.
     */
    int vectorLength() {
        return vector.length();
    }

    @SuppressWarnings("unchecked")
    K head() {
        if (isEmpty()) {
            throw new NoSuchElementException("head of empty KeySequence");
        }
        return (K) vector.head();
    }

    @SuppressWarnings("unchecked")
    K last() {
        if (isEmpty()) {
            throw new NoSuchElementException("last of empty KeySequence");
        }
        return (K) vector.last();
    }

    /**
     * Appends the specified key. If the key is already in this sequence,
     * it is moved to the end.
     *
     * @param key a key
     * @return a sequence that ends with the key
     */
    KeySequence<K> append(K key) {
        Option<Integer> sequenceNumber = sequenceNumbers.get(key);
        if (sequenceNumber.isDefined() && sequenceNumber.get() + offset == vector.length() - 1) {
            return this;
        }
        KeySequence<K> s = sequenceNumber.isDefined() ? remove(key) : this;
        int newSequenceNumber = s.vector.length() - s.offset;
        return s.renumber(s.vector.append(key), s.sequenceNumbers.put(key, newSequenceNumber), s.offset);
    }

    /**
     * Removes the specified key.
     *
     * @param key a key
     * @return a sequence without the key, or this sequence if it does not contain the key
     */
    KeySequence<K> remove(K key) {
        Option<Integer> sequenceNumber = sequenceNumbers.get(key);
        if (sequenceNumber.isEmpty()) {
            return this;
        }
        HashMap<K, Integer> newSequenceNumbers = sequenceNumbers.remove(key);
        int index = sequenceNumber.get() + offset;
        int length = vector.length();

        // If the key is the first, we remove it and its neighboring tombstones from the vector.
        if (index == 0) {
            int n = 1;
            if (length > 1 && vector.get(1) instanceof Tombstone) {
                n += ((Tombstone) vector.get(1)).after;
            }
            return renumber(vector.drop(n), newSequenceNumbers, offset - n);
        }

        // If the key is the last, we remove it and its neighboring tombstones from the vector.
        if (index == length - 1) {
            int n = 1;
            if (vector.get(length - 2) instanceof Tombstone) {
                n += ((Tombstone) vector.get(length - 2)).before;
            }
            return renumber(vector.dropRight(n), newSequenceNumbers, offset);
        }

        // Otherwise, we replace the key by a tombstone, and merge it with its neighboring runs.
        return renumber(bury(vector, index), newSequenceNumbers, offset);
    }

    private static Vector<Object> bury(Vector<Object> vector, int index) {
        Object before = vector.get(index - 1);
        Object after = vector.get(index + 1);
        int runBefore = before instanceof Tombstone ? ((Tombstone) before).before : 0;
        int runAfter = after instanceof Tombstone ? ((Tombstone) after).after : 0;
        int start = index - runBefore;
        int end = index + runAfter;
        int run = runBefore + 1 + runAfter;
        if (start == end) {
            return vector.update(index, new Tombstone(1, 1));
        }
        return vector.update(index, Tombstone.INNER)
                .update(start, new Tombstone(0, run))
                .update(end, new Tombstone(run, 0));
    }

    private KeySequence<K> renumber(Vector<Object> vector, HashMap<K, Integer> sequenceNumbers, int offset) {
        int size = sequenceNumbers.size();
        if (size == 0) {
            return empty();
        }
        if (mustRenumber(size, offset, vector.length())) {
            Vector<Object> compacted = Vector.empty();
            HashMap<K, Integer> renumbered = HashMap.empty();
            for (Iterator<K> i = new AscendingIterator<>(vector); i.hasNext(); ) {
                K key = i.next();
                renumbered = renumbered.put(key, compacted.length());
                compacted = compacted.append(key);
            }
            return new KeySequence<>(compacted, renumbered, 0);
        }
        return new KeySequence<>(vector, sequenceNumbers, offset);
    }

    Iterator<K> iterator() {
        return isEmpty() ? Iterator.empty() : new AscendingIterator<>(vector);
    }

    Iterator<K> reverseIterator() {
        return isEmpty() ? Iterator.empty() : new DescendingIterator<>(vector);
    }

    @Override
    public String toString() {
        return iterator().mkString("KeySequence(", ", ", ")");
    }

    /**
     * Marks a removed slot in the vector.
     * <p>
     * {@code before} is the length of the run in descending direction, it is only
     * valid in the last tombstone of a run. {@code after} is the length of the run
     * in ascending direction, it is only valid in the first tombstone of a run.
     */
    static final class Tombstone {
        static final Tombstone INNER = new Tombstone(0, 0);

        final int before;
        final int after;

        Tombstone(int before, int after) {
            this.before = before;
            this.after = after;
        }

        @Override
        public String toString() {
            return "Tombstone(" + before + ", " + after + ")";
        }
    }

    private static final class AscendingIterator<K> implements Iterator<K> {
        private final Vector<Object> vector;
        private int index;

        AscendingIterator(Vector<Object> vector) {
            this.vector = vector;
        }

        @Override
        public boolean hasNext() {
            return index < vector.length();
        }

        @SuppressWarnings("unchecked")
        @Override
        public K next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            K key = (K) vector.get(index++);
            if (index < vector.length()) {
                Object o = vector.get(index);
                if (o instanceof Tombstone) {
                    index += ((Tombstone) o).after;
                }
            }
            return key;
        }
    }

    private static final class DescendingIterator<K> implements Iterator<K> {
        private final Vector<Object> vector;
        private int index;

        DescendingIterator(Vector<Object> vector) {
            this.vector = vector;
            this.index = vector.length() - 1;
        }

        @Override
        public boolean hasNext() {
            return index >= 0;
        }

        @SuppressWarnings("unchecked")
        @Override
        public K next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            K key = (K) vector.get(index--);
            if (index >= 0) {
                Object o = vector.get(index);
                if (o instanceof Tombstone) {
                    index -= ((Tombstone) o).before;
                }
            }
            return key;
        }
    }
}
