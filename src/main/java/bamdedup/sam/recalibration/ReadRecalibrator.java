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
package bamdedup.sam.recalibration;

import htsjdk.samtools.SAMRecord;

import java.io.File;

/**
 * A base quality recalibration model that is trained on reads judged not to be duplicates and then applied to every
 * read written out.
 */
public interface ReadRecalibrator {

    /** Adds a non-duplicate read's observations to the model. */
    void buildTable(SAMRecord record);

    /** Rewrites the read's base qualities from the model. */
    void applyTable(SAMRecord record);

    /**
     * Finalizes the model and writes it next to {@code output}.  Called once, after all reads have been passed to
     * {@link #buildTable} and before any read is passed to {@link #applyTable}.
     */
    void emitModel(File output);
}
