package org.tessera.compiler.frontend.lexer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A bounded, process-wide memo of {@link LineOffsetTable}s keyed by source text.
 * <p>
 * Entries are kept in access order and the least recently used entry is evicted once the
 * capacity is exceeded. All access is synchronized,
 * as this is the only state shared between concurrent compilations.
 */
public final class LineOffsetCache {

    /** The number of tables kept by {@link #shared()}. */
    public static final int DEFAULT_CAPACITY = 64;

    private static final LineOffsetCache SHARED = new LineOffsetCache(DEFAULT_CAPACITY);

    private final Map<String, LineOffsetTable> tables;

    /**
     * @param capacity The maximum number of tables to keep.
     */
    public LineOffsetCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.tables = new LinkedHashMap<>(capacity, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, LineOffsetTable> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * @return The process-wide cache.
     */
    public static LineOffsetCache shared() {
        return SHARED;
    }

    /**
     * Returns the table for the source, building and caching it on a miss.
     * @param source The source text.
     * @return The offset table.
     */
    public synchronized LineOffsetTable tableFor(String source) {
        LineOffsetTable table = tables.get(source);
        if (table == null) {
            table = LineOffsetTable.build(source);
            tables.put(source, table);
        }
        return table;
    }

    /**
     * @return The number of cached tables.
     */
    public synchronized int size() {
        return tables.size();
    }

    /**
     * @param source A source text.
     * @return {@code true} if a table for the source is cached.
     */
    public synchronized boolean contains(String source) {
        return tables.containsKey(source);
    }

    /**
     * Removes all cached tables.
     */
    public synchronized void clear() {
        tables.clear();
    }
}
