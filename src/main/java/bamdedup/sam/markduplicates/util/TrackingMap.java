/*
 * The MIT License
 *
 * Copyright (c) 2024 The Broad Institute
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package bamdedup.sam.markduplicates.util;

import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * An ordered map of open duplicate candidates, one per key, that can be truncated from its low end as the input
 * advances.
 *
 * @param <K> the key type; its natural order must match the order in which keys become final
 * @param <V> the tracked value
 */
public class TrackingMap<K extends Comparable<K>, V> {

    /**
     * The result of {@link #upsert}: either a fresh slot (no value yet) or the slot of an existing entry.  Setting a
     * value stores it in the map under the slot's key.
     */
    public final class Slot {
        private final K key;
        private final boolean isNew;
        private V value;

        private Slot(final K key, final V value) {
            this.key = key;
            this.value = value;
            this.isNew = (value == null);
        }

        /** True if the key was not present before the upsert. */
        public boolean isNew() { return isNew; }

        /** The stored value; null for a new slot that has not been set. */
        public V get() { return value; }

        public void set(final V value) {
            if (value == null) throw new IllegalArgumentException("Cannot track a null value for key " + key);
            this.value = value;
            map.put(key, value);
        }
    }

    private final TreeMap<K, V> map = new TreeMap<>();

    /** Looks up the entry for {@code key}, returning a slot that says whether it already existed. */
    public Slot upsert(final K key) {
        return new Slot(key, map.get(key));
    }

    public V get(final K key) {
        return map.get(key);
    }

    /**
     * Removes every entry whose key is strictly less than {@code cutoff}, handing each value to {@code finalizer} in
     * key order first.
     *
     * @return the number of entries removed
     */
    public int evictBefore(final K cutoff, final Consumer<V> finalizer) {
        return evict(map.headMap(cutoff, false), finalizer);
    }

    /** Removes every entry, handing each value to {@code finalizer} in key order first. */
    public int evictAll(final Consumer<V> finalizer) {
        return evict(map, finalizer);
    }

    private int evict(final NavigableMap<K, V> range, final Consumer<V> finalizer) {
        final int removed = range.size();
        for (final V value : range.values()) {
            finalizer.accept(value);
        }
        range.clear();
        return removed;
    }

    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }
}
