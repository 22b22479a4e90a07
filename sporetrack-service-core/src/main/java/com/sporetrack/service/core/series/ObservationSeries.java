package com.sporetrack.service.core.series;

import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.SeriesCursor;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;

/**
 * Lazy, finite view of one series in phase-day order. Pages are fetched on demand; every iterator starts at the
 * cursor the series was opened with, so the view can be re-iterated or reopened {@link #from} any consumed row.
 */
public final class ObservationSeries implements Iterable<Observation> {

    private final BiFunction<SeriesCursor, Integer, List<Observation>> pageLoader;
    private final SeriesCursor start;
    private final int pageSize;

    ObservationSeries(
            BiFunction<SeriesCursor, Integer, List<Observation>> pageLoader, SeriesCursor start, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.pageLoader = pageLoader;
        this.start = start;
        this.pageSize = pageSize;
    }

    /** The same series restarted after {@code cursor}. */
    public ObservationSeries from(SeriesCursor cursor) {
        return new ObservationSeries(pageLoader, cursor, pageSize);
    }

    @Override
    public Iterator<Observation> iterator() {
        return new PageIterator();
    }

    private final class PageIterator implements Iterator<Observation> {
        private SeriesCursor cursor = start;
        private Iterator<Observation> page = List.<Observation>of().iterator();
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            while (!page.hasNext() && !exhausted) {
                List<Observation> next = pageLoader.apply(cursor, pageSize);
                exhausted = next.size() < pageSize;
                if (!next.isEmpty()) {
                    cursor = SeriesCursor.after(next.get(next.size() - 1));
                }
                page = next.iterator();
            }
            return page.hasNext();
        }

        @Override
        public Observation next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.next();
        }
    }
}
