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

import bamdedup.BamDedupException;
import htsjdk.samtools.SAMFileHeader;
import htsjdk.samtools.SAMReadGroupRecord;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMTag;
import htsjdk.samtools.util.Log;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps read groups to small integer library ids so that reads from different libraries never collide on the same
 * duplicate key.  Libraries are numbered from 1 in the order their first read group appears in the header.
 */
public class LibraryIdResolver {
    /** Library ids must fit in one byte. */
    public static final int MAX_LIBRARIES = 0xff;

    private static final Log log = Log.getInstance(LibraryIdResolver.class);

    private final Map<String, Integer> readGroupToLibraryId = new HashMap<>();
    private final int numLibraries;

    public LibraryIdResolver(final SAMFileHeader header) {
        final Map<String, Integer> libraryNameToId = new HashMap<>();
        for (final SAMReadGroupRecord readGroup : header.getReadGroups()) {
            final String id = readGroup.getReadGroupId();
            if (id == null || id.isEmpty()) {
                throw new BamDedupException("Cannot find read group ID in the header line " + readGroup.getSAMString());
            }
            if (readGroupToLibraryId.containsKey(id)) {
                throw new BamDedupException("The read group ID " + id + " is not a unique identifier");
            }

            String library = readGroup.getLibrary();
            if (library == null || library.isEmpty()) {
                log.warn("Cannot find library information in the header line " + readGroup.getSAMString() +
                        ". Using empty string for library name");
                library = "";
            }
            final Integer libraryId = libraryNameToId.computeIfAbsent(library, k -> libraryNameToId.size() + 1);
            readGroupToLibraryId.put(id, libraryId);
        }
        this.numLibraries = libraryNameToId.size();

        if (numLibraries > MAX_LIBRARIES) {
            throw new BamDedupException("More than " + MAX_LIBRARIES + " library names are identified. " +
                    "At most " + MAX_LIBRARIES + " libraries are supported.");
        }
    }

    public int getNumLibraries() {
        return numLibraries;
    }

    /**
     * Returns the library id of the record's read group, or 0 when the header names at most one library, in which
     * case the RG tag is not consulted.
     *
     * @throws BamDedupException if the record's RG tag is missing, is not a string, or names an unknown read group
     */
    public int getLibraryId(final SAMRecord record) {
        if (numLibraries <= 1) return 0;

        final Object readGroup = record.getAttribute(SAMTag.RG.name());
        if (readGroup == null) {
            throw new BamDedupException("No RG tag is found in read " + record.getReadName());
        }
        if (!(readGroup instanceof String)) {
            throw new BamDedupException("RG tag of read " + record.getReadName() + " is not a string");
        }
        final Integer libraryId = readGroupToLibraryId.get(readGroup);
        if (libraryId == null) {
            throw new BamDedupException("RG tag " + readGroup + " of read " + record.getReadName() +
                    " does not exist in the header");
        }
        return libraryId;
    }
}
