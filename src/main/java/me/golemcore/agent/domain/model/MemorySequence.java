package me.golemcore.agent.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Result of a memory query: a lazy, finite, restartable sequence of entries in
 * ordering-index order.
 *
 * <p>
 * Bounds are fixed when the query runs; entries appended afterwards are not
 * visible. Entries are read from the backing log only while iterating, and
 * every call to {@link #iterator()} starts again from the first entry.
 */
public final class MemorySequence implements Iterable<MemoryEntry> {

    private static final MemorySequence EMPTY = new MemorySequence(List.of(), 0, 0);

    private final List<MemoryEntry> source;
    private final int start;
    private final int end;

    /**
     * @param source
     *            append-only backing log; must tolerate reads concurrent with
     *            appends
     */
    public MemorySequence(List<MemoryEntry> source, int start, int end) {
        if (start < 0 || start > end) {
            throw new IllegalArgumentException("Invalid bounds [" + start + ", " + end + ")");
        }
        this.source = source;
        this.start = start;
        this.end = end;
    }

    public static MemorySequence empty() {
        return EMPTY;
    }

    @Override
    public Iterator<MemoryEntry> iterator() {
        return new Iterator<>() {
            private int position = start;

            @Override
            public boolean hasNext() {
                return position < end;
            }

            @Override
            public MemoryEntry next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return source.get(position++);
            }
        };
    }

    public Stream<MemoryEntry> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<MemoryEntry> toList() {
        return stream().toList();
    }

    public int size() {
        return end - start;
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
