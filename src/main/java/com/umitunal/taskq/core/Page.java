package com.umitunal.taskq.core;

import java.util.List;

/**
 * One page of a cursor-paginated listing.
 *
 * @param <E> the element type
 */
public final class Page<E> {
    private final List<E> items;
    private final String nextCursor;

    public Page(List<E> items, String nextCursor) {
        this.items = List.copyOf(items);
        this.nextCursor = nextCursor;
    }

    public List<E> getItems() {
        return items;
    }

    /**
     * Cursor for the following page, or null when this is the last page.
     */
    public String getNextCursor() {
        return nextCursor;
    }

    public boolean hasNext() {
        return nextCursor != null;
    }
}
