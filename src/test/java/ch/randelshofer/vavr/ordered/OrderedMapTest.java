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
import io.vavr.collection.HashMap;
import io.vavr.collection.Iterator;
import io.vavr.collection.List;
import io.vavr.control.Option;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.math.BigDecimal;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.Spliterator;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OrderedMapTest {

    private static OrderedMap<Integer, String> abc() {
        return OrderedMap.of(1, "a", 2, "b", 3, "c");
    }

    @SuppressWarnings("unchecked")
    private static <T> T serializeAndDeserialize(T obj) throws IOException, ClassNotFoundException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(buf)) {
            out.writeObject(obj);
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(buf.toByteArray()))) {
            return (T) in.readObject();
        }
    }

    // -- construction

    @Test
    public void shouldCreateEmptyMap() {
        OrderedMap<Integer, String> empty = OrderedMap.empty();
        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.size()).isZero();
        assertThat(empty.toList()).isEqualTo(List.empty());
        assertThat(empty.toHashMap()).isEqualTo(HashMap.empty());
    }

    @Test
    public void shouldCreateSingleton() {
        OrderedMap<Integer, String> m = OrderedMap.of(1, "a");
        assertThat(m.toList()).isEqualTo(List.of(Tuple.of(1, "a")));
        assertThat(OrderedMap.of(Tuple.of(1, "a"))).isEqualTo(m);
    }

    @Test
    public void shouldIterateInInsertionOrder() {
        OrderedMap<Integer, String> m = OrderedMap.<Integer, String>empty()
                .put(3, "first")
                .put(1, "second")
                .put(2, "third");
        assertThat(m.toList()).isEqualTo(List.of(Tuple.of(3, "first"), Tuple.of(1, "second"), Tuple.of(2, "third")));
    }

    @Test
    public void shouldKeepLastOccurrenceOfDuplicateKeys() {
        OrderedMap<Integer, String> m = OrderedMap.ofEntries(Tuple.of(1, "a"), Tuple.of(2, "b"), Tuple.of(1, "c"));
        assertThat(m).isEqualTo(OrderedMap.ofEntries(Tuple.of(2, "b"), Tuple.of(1, "c")));
        assertThat(m.toList()).isEqualTo(List.of(Tuple.of(2, "b"), Tuple.of(1, "c")));
    }

    @Test
    public void shouldCreateFromJavaMapEntries() {
        OrderedMap<Integer, String> m = OrderedMap.ofEntries(
                new AbstractMap.SimpleEntry<>(2, "b"),
                new AbstractMap.SimpleEntry<>(1, "a"));
        assertThat(m.keys()).containsExactly(2, 1);
    }

    @Test
    public void shouldRoundTripThroughList() {
        OrderedMap<Integer, String> m = abc().put(1, "z").remove(2).put(4, "d");
        assertThat(OrderedMap.ofEntries(m.toList())).isEqualTo(m);
    }

    @Test
    public void shouldReturnSameInstanceWhenCreatingFromOrderedMap() {
        OrderedMap<Integer, String> m = abc();
        assertThat(OrderedMap.ofEntries(m)).isSameAs(m);
    }

    @Test
    public void shouldCollectStream() {
        OrderedMap<Integer, String> m = Stream.of(Tuple.of(3, "c"), Tuple.of(1, "a"), Tuple.of(3, "x"))
                .collect(OrderedMap.collector());
        assertThat(m.toList()).isEqualTo(List.of(Tuple.of(1, "a"), Tuple.of(3, "x")));
    }

    // -- static narrow

    @Test
    public void shouldNarrowOrderedMap() {
        final OrderedMap<Integer, Double> int2doubleMap = OrderedMap.of(1, 1.0d);
        final OrderedMap<Number, Number> number2numberMap = OrderedMap.narrow(int2doubleMap);
        final int actual = number2numberMap.put(new BigDecimal("2"), new BigDecimal("2.0"))
                .foldLeft(0, (k, v, acc) -> acc + v.intValue());
        assertThat(actual).isEqualTo(3);
    }

    // -- put

    @Test
    public void shouldAppendNewKey() {
        OrderedMap<Integer, String> m = abc();
        OrderedMap<Integer, String> m2 = m.put(4, "d");
        assertThat(m2.size()).isEqualTo(m.size() + 1);
        assertThat(m2.last()).isEqualTo(Tuple.of(4, "d"));
    }

    @Test
    public void shouldMoveReinsertedKeyToTheEnd() {
        OrderedMap<Integer, String> m = OrderedMap.<Integer, String>empty().put(1, "a").put(2, "b");
        assertThat(m.keys()).containsExactly(1, 2);
        OrderedMap<Integer, String> m2 = m.put(1, "c");
        assertThat(m2.toList()).isEqualTo(List.of(Tuple.of(2, "b"), Tuple.of(1, "c")));
        assertThat(m2.size()).isEqualTo(m.size());
    }

    @Test
    public void shouldPutNullKeyAndNullValue() {
        OrderedMap<Integer, String> m = OrderedMap.<Integer, String>empty().put(null, "a").put(0, null);
        assertThat(m.toList()).isEqualTo(List.of(Tuple.of(null, "a"), Tuple.of(0, null)));
        assertThat(m.get(null)).isEqualTo(Option.some("a"));
        assertThat(m.get(0)).isEqualTo(Option.some(null));
        assertThat(m.containsKey(0)).isTrue();
    }

    @Test
    public void shouldUseStructuralEqualityOfCompoundKeys() {
        OrderedMap<Tuple2<Integer, List<String>>, Integer> m = OrderedMap.of(Tuple.of(1, List.of("x", "y")), 1);
        assertThat(m.get(Tuple.of(1, List.of("x", "y")))).isEqualTo(Option.some(1));
        assertThat(m.containsKey(Tuple.of(1, List.of("y", "x")))).isFalse();
    }

    // -- update

    @Test
    public void shouldUpdateExistingKeyInPlace() {
        OrderedMap<Integer, String> m = abc().update(1, v -> v.map(String::toUpperCase));
        assertThat(m.toList()).isEqualTo(List.of(Tuple.of(1, "A"), Tuple.of(2, "b"), Tuple.of(3, "c")));
    }

    @Test
    public void shouldPassCurrentValueToUpdater() {
        AtomicInteger calls = new AtomicInteger();
        abc().update(2, v -> {
            calls.incrementAndGet();
            assertThat(v).isEqualTo(Option.some("b"));
            return v;
        });
        abc().update(9, v -> {
            calls.incrementAndGet();
            assertThat(v).isEqualTo(Option.none());
            return v;
        });
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    public void shouldAppendWhenUpdatingAbsentKey() {
        OrderedMap<Integer, String> m = abc().update(0, v -> Option.some("z"));
        assertThat(m.keys()).containsExactly(1, 2, 3, 0);
    }

    @Test
    public void shouldRemoveWhenUpdaterReturnsNone() {
        OrderedMap<Integer, String> m = abc().update(2, v -> Option.none());
        assertThat(m.toList()).isEqualTo(List.of(Tuple.of(1, "a"), Tuple.of(3, "c")));
    }

    @Test
    public void shouldReturnSameMapWhenUpdaterReturnsNoneForAbsentKey() {
        OrderedMap<Integer, String> m = abc();
        assertThat(m.update(9, v -> Option.none())).isSameAs(m);
    }

    @Test
    public void shouldRejectNullUpdater() {
        assertThatThrownBy(() -> abc().update(1, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("updater is null");
    }

    // -- remove

    @Test
    public void shouldRemoveKey() {
        OrderedMap<Integer, String> m = abc().remove(2);
        assertThat(m.toList()).isEqualTo(List.of(Tuple.of(1, "a"), Tuple.of(3, "c")));
        assertThat(m.containsKey(2)).isFalse();
        assertThat(m.get(2)).isEqualTo(Option.none());
    }

    @Test
    public void shouldReturnSameMapWhenRemovingAbsentKey() {
        OrderedMap<Integer, String> m = abc();
        assertThat(m.remove(9)).isSameAs(m);
        assertThat(OrderedMap.empty().remove(9)).isSameAs(OrderedMap.empty());
    }

    @Test
    public void shouldBeEmptyAfterRemovingAllKeys() {
        assertThat(abc().remove(1).remove(3).remove(2)).isSameAs(OrderedMap.empty());
    }

    // -- queries

    @Test
    public void shouldAgreeOnMembershipAndLookup() {
        OrderedMap<Integer, String> m = abc().remove(2).put(5, "e");
        for (int k = 0; k < 7; k++) {
            assertThat(m.containsKey(k)).isEqualTo(m.get(k).isDefined());
        }
        assertThat(m.size()).isEqualTo(m.toList().length()).isEqualTo(m.keys().length());
    }

    @Test
    public void shouldReturnDefaultForAbsentKey() {
        assertThat(abc().getOrElse(9, "z")).isEqualTo("z");
        assertThat(abc().getOrElse(1, "z")).isEqualTo("a");
    }

    @Test
    public void shouldReturnKeysAndValuesInInsertionOrder() {
        OrderedMap<Integer, String> m = OrderedMap.of(3, "c", 1, "a", 2, "b");
        assertThat(m.keys()).containsExactly(3, 1, 2);
        assertThat(m.values()).containsExactly("c", "a", "b");
        assertThat(m.keySet()).isEqualTo(OrderedSet.of(3, 1, 2));
    }

    @Test
    public void shouldReturnHeadAndLast() {
        OrderedMap<Integer, String> m = abc().put(1, "x");
        assertThat(m.head()).isEqualTo(Tuple.of(2, "b"));
        assertThat(m.last()).isEqualTo(Tuple.of(1, "x"));
        assertThat(m.headOption()).isEqualTo(Option.some(Tuple.of(2, "b")));
        assertThat(OrderedMap.empty().lastOption()).isEqualTo(Option.none());
    }

    @Test
    public void shouldThrowWhenHeadOfEmpty() {
        assertThatThrownBy(() -> OrderedMap.empty().head())
                .isInstanceOf(NoSuchElementException.class)
                .hasMessage("head of empty OrderedMap");
        assertThatThrownBy(() -> OrderedMap.empty().last())
                .isInstanceOf(NoSuchElementException.class);
    }

    // -- conversion

    @Test
    public void shouldExposeBackingHashMap() {
        OrderedMap<Integer, String> m = abc();
        assertThat(m.toHashMap()).isEqualTo(HashMap.of(3, "c", 2, "b", 1, "a"));
        assertThat(m.toHashMap()).isSameAs(m.toHashMap());
    }

    @Test
    public void shouldConvertToJavaMapInInsertionOrder() {
        LinkedHashMap<Integer, String> javaMap = OrderedMap.of(3, "c", 1, "a").toJavaMap();
        assertThat(javaMap.keySet()).containsExactly(3, 1);
    }

    // -- map

    @Test
    public void shouldMapValuesKeepingKeysAndOrder() {
        OrderedMap<Integer, String> m = OrderedMap.of(3, "c", 1, "a", 2, "b");
        OrderedMap<Integer, String> mapped = m.map((k, v) -> v + k);
        assertThat(mapped.toList()).isEqualTo(List.of(Tuple.of(3, "c3"), Tuple.of(1, "a1"), Tuple.of(2, "b2")));
        assertThat(m.mapValues(String::length).values()).containsExactly(1, 1, 1);
    }

    // -- fold

    @Test
    public void shouldFoldLeftFromFirstToLast() {
        OrderedMap<Integer, String> m = OrderedMap.of(3, "c", 1, "a", 2, "b");
        assertThat(m.foldLeft(List.<Integer>empty(), (k, v, acc) -> acc.prepend(k))).isEqualTo(List.of(2, 1, 3));
        assertThat(m.foldLeft("", (k, v, acc) -> acc + v)).isEqualTo("cab");
    }

    @Test
    public void shouldFoldRightFromLastToFirst() {
        OrderedMap<Integer, String> m = OrderedMap.of(3, "c", 1, "a", 2, "b");
        assertThat(m.foldRight(List.<Integer>empty(), (k, v, acc) -> acc.prepend(k))).isEqualTo(List.of(3, 1, 2));
        assertThat(m.foldRight("", (k, v, acc) -> acc + v)).isEqualTo("bac");
    }

    @Test
    public void shouldFoldEmptyMapToZero() {
        assertThat(OrderedMap.<Integer, String>empty().foldLeft("zero", (k, v, acc) -> acc + v)).isEqualTo("zero");
    }

    // -- filter

    @Test
    public void shouldFilterKeepingRelativeOrder() {
        OrderedMap<Integer, String> m = OrderedMap.of(4, "d", 1, "a", 2, "b").put(3, "c");
        OrderedMap<Integer, String> even = m.filter((k, v) -> k % 2 == 0);
        assertThat(even.toList()).isEqualTo(List.of(Tuple.of(4, "d"), Tuple.of(2, "b")));
        assertThat(even).isEqualTo(OrderedMap.ofEntries(m.toList().filter(e -> e._1 % 2 == 0)));
        assertThat(m.reject((k, v) -> k % 2 == 0).keys()).containsExactly(1, 3);
        assertThat(m.filterKeys(k -> k > 2).keys()).containsExactly(4, 3);
    }

    @Test
    public void shouldReturnSameMapWhenAllEntriesPassFilter() {
        OrderedMap<Integer, String> m = abc();
        assertThat(m.filter((k, v) -> true)).isSameAs(m);
        assertThat(m.filter((k, v) -> false)).isSameAs(OrderedMap.empty());
    }

    // -- partition

    @Test
    public void shouldPartitionKeepingRelativeOrder() {
        OrderedMap<Integer, String> m = OrderedMap.of(5, "e", 2, "b", 3, "c").put(4, "d").put(1, "a");
        Tuple2<OrderedMap<Integer, String>, OrderedMap<Integer, String>> parts = m.partition((k, v) -> k % 2 == 0);
        assertThat(parts._1.keys()).containsExactly(2, 4);
        assertThat(parts._2.keys()).containsExactly(5, 3, 1);
        assertThat(parts._1.toList().appendAll(parts._2.toList())).containsExactlyInAnyOrderElementsOf(m.toList());
        assertThat(parts._1.keys()).doesNotContainAnyElementsOf(parts._2.keys());
    }

    @Test
    public void shouldPartitionInOneIteration() {
        final AtomicInteger count = new AtomicInteger(0);
        final Tuple2<OrderedMap<Integer, String>, OrderedMap<Integer, String>> results = abc().partition((k, v) -> {
            count.incrementAndGet();
            return true;
        });
        assertThat(results._1).isEqualTo(abc());
        assertThat(results._2).isEqualTo(OrderedMap.empty());
        assertThat(count.get()).isEqualTo(3);
    }

    // -- equality

    @Test
    public void shouldNotEqualSameEntriesInDifferentOrder() {
        OrderedMap<String, Integer> map = OrderedMap.<String, Integer>empty().put("Aa", 1).put("BB", 2);
        OrderedMap<String, Integer> map2 = OrderedMap.<String, Integer>empty().put("BB", 2).put("Aa", 1);
        assertThat(map).isNotEqualTo(map2);
        assertThat(map.toHashMap()).isEqualTo(map2.toHashMap());
    }

    @Test
    public void shouldEqualMapWithSameHistoryIndependentOfRemovals() {
        OrderedMap<Integer, String> m1 = abc().remove(2).put(2, "b");
        OrderedMap<Integer, String> m2 = OrderedMap.of(1, "a", 3, "c", 2, "b");
        assertThat(m1).isEqualTo(m2);
        assertThat(m1.hashCode()).isEqualTo(m2.hashCode());
    }

    @Test
    public void shouldNotEqualOtherCollections() {
        assertThat(abc().equals(HashMap.of(1, "a"))).isFalse();
        assertThat(abc().equals(abc().toList())).isFalse();
        assertThat(OrderedMap.empty().equals(OrderedSet.empty())).isFalse();
    }

    // -- persistence

    @Test
    public void shouldNotChangeWhenDerivedMapChanges() {
        OrderedMap<Integer, String> m = abc();
        m.put(1, "x");
        m.remove(2);
        m.update(3, v -> Option.some("y"));
        assertThat(m.toList()).isEqualTo(List.of(Tuple.of(1, "a"), Tuple.of(2, "b"), Tuple.of(3, "c")));
    }

    // -- iteration

    @Test
    public void shouldIterateInReverseOrder() {
        assertThat(abc().reverseIterator().map(Tuple2::_1).toList()).isEqualTo(List.of(3, 2, 1));
    }

    @Test
    public void shouldThrowWhenIteratingPastTheLastEntry() {
        Iterator<Tuple2<Integer, String>> it = OrderedMap.of(1, "a").iterator();
        assertThat(it.next()).isEqualTo(Tuple.of(1, "a"));
        assertThat(it.hasNext()).isFalse();
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    public void shouldThrowWhenReverseIteratingPastTheFirstEntry() {
        Iterator<Tuple2<Integer, String>> it = OrderedMap.of(1, "a", 2, "b").remove(1).reverseIterator();
        assertThat(it.next()).isEqualTo(Tuple.of(2, "b"));
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    public void shouldVisitEntriesWithBiConsumer() {
        ArrayList<String> visited = new ArrayList<>();
        abc().forEach((k, v) -> visited.add(k + v));
        assertThat(visited).containsExactly("1a", "2b", "3c");
    }

    @Test
    public void shouldHaveOrderedSizedSpliterator() {
        Spliterator<Tuple2<Integer, String>> spliterator = abc().spliterator();
        assertThat(spliterator.hasCharacteristics(Spliterator.ORDERED)).isTrue();
        assertThat(spliterator.hasCharacteristics(Spliterator.SIZED | Spliterator.DISTINCT)).isTrue();
        assertThat(spliterator.getExactSizeIfKnown()).isEqualTo(3);
    }

    @Test
    public void shouldRenderToString() {
        assertThat(OrderedMap.of(3, "first", 1, "second").toString()).isEqualTo("OrderedMap((3, first), (1, second))");
        assertThat(OrderedMap.empty().toString()).isEqualTo("OrderedMap()");
    }

    // -- serialization

    @Test
    public void shouldKeepOrderWhenSerialized() throws Exception {
        OrderedMap<Integer, String> m = abc().put(1, "x").remove(2);
        OrderedMap<Integer, String> copy = serializeAndDeserialize(m);
        assertThat(copy).isEqualTo(m);
        assertThat(copy.keys()).containsExactly(3, 1);
    }

    @Test
    public void shouldDeserializeEmptyMapAsSharedEmptyInstance() throws Exception {
        assertThat(serializeAndDeserialize(OrderedMap.empty())).isSameAs(OrderedMap.empty());
    }

    // -- model

    @Test
    public void shouldMatchReferenceModelAfterRandomOperations() {
        Random rnd = new Random(7);
        LinkedHashMap<Integer, Integer> model = new LinkedHashMap<>();
        OrderedMap<Integer, Integer> m = OrderedMap.empty();
        for (int step = 0; step < 3000; step++) {
            Integer key = rnd.nextInt(40);
            Integer value = rnd.nextInt(1000);
            switch (rnd.nextInt(4)) {
                case 0:
                    model.remove(key);
                    m = m.remove(key);
                    break;
                case 1:
                    // LinkedHashMap.put keeps the position of an existing key
                    model.put(key, value);
                    m = m.update(key, v -> Option.some(value));
                    break;
                default:
                    model.remove(key);
                    model.put(key, value);
                    m = m.put(key, value);
                    break;
            }
            ArrayList<Tuple2<Integer, Integer>> expected = new ArrayList<>();
            model.forEach((k, v) -> expected.add(Tuple.of(k, v)));
            assertThat(m.toList().toJavaList()).isEqualTo(expected);
            assertThat(m.size()).isEqualTo(model.size());
        }
    }
}
