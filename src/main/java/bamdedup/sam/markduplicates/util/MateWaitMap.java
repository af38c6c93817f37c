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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Reads whose mate has not been seen yet, keyed by the linearized position at which the mate is expected.  Several
 * reads may wait at the same position; they are told apart by read name.  Every entry owns its record.
 */
public class MateWaitMap {
    private final TreeMap<Long, List<ReadData>> waiting = new TreeMap<>();
    private int size = 0;

    /**
     * Combines a reference index and a 0-based position into a single value that increases strictly with
     * coordinate order.
     */
    public static long linearize(final int referenceIndex, final int zeroBasedPosition) {
        return ((long) referenceIndex << 32) | (zeroBasedPosition & 0xFFFFFFFFL);
    }

    /** Parks a read until its mate, expected at {@code matePosition}, shows up. */
    public void put(final long matePosition, final ReadData readData) {
        if (readData.getHandle() == null) {
            throw new IllegalArgumentException("Reads waiting for a mate must own their record");
        }
        waiting.computeIfAbsent(matePosition, k -> new ArrayList<>(2)).add(readData);
        size++;
    }

    /**
     * Removes and returns the read named {@code readName} that is waiting for a mate at {@code position}, or null if
     * there is none.
     */
    public ReadData removeMate(final long position, final String readName) {
        final List<ReadData> candidates = waiting.get(position);
        if (candidates == null) return null;
        final Iterator<ReadData> iterator = candidates.iterator();
        while (iterator.hasNext()) {
            final ReadData candidate = iterator.next();
            if (candidate.getHandle().getRecord().getReadName().equals(readName)) {
                iterator.remove();
                if (candidates.isEmpty()) waiting.remove(position);
                size--;
                return candidate;
            }
        }
        return null;
    }

    /**
     * Removes every read whose mate was expected strictly before {@code position}, handing each to
     * {@code finalizer} in position order first.
     *
     * @return the number of reads removed
     */
    public int evictBefore(final long position, final Consumer<ReadData> finalizer) {
        return evict(waiting.headMap(position, false), finalizer);
    }

    public int evictAll(final Consumer<ReadData> finalizer) {
        return evict(waiting, finalizer);
    }

    private int evict(final NavigableMap<Long, List<ReadData>> range, final Consumer<ReadData> finalizer) {
        int removed = 0;
        for (final Map.Entry<Long, List<ReadData>> entry : range.entrySet()) {
            for (final ReadData readData : entry.getValue()) {
                finalizer.accept(readData);
                removed++;
            }
        }
        range.clear();
        size -= removed;
        return removed;
    }

    /** The number of waiting reads. */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }
}
