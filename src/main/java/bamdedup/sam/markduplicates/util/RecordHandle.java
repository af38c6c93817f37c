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

import htsjdk.samtools.SAMRecord;

/**
 * An owning reference to a record handed out by a {@link RecordPool}.  A handle is held by at most one owner at a
 * time and is invalid once released back to its pool.
 */
public final class RecordHandle {
    private SAMRecord record;

    RecordHandle() {
    }

    void attach(final SAMRecord record) {
        this.record = record;
    }

    void detach() {
        if (record == null) {
            throw new IllegalStateException("Record handle has already been released");
        }
        record = null;
    }

    public boolean isLive() {
        return record != null;
    }

    public SAMRecord getRecord() {
        if (record == null) {
            throw new IllegalStateException("Record handle has already been released");
        }
        return record;
    }
}
