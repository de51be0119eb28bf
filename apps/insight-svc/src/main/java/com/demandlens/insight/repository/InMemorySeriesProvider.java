package com.demandlens.insight.repository;

import com.demandlens.insight.model.DateAlignedSeries;
import java.time.LocalDate;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemorySeriesProvider implements SeriesProvider {

    private final Map<String, DateAlignedSeries> storage = new ConcurrentHashMap<>();

    public DateAlignedSeries save(DateAlignedSeries series) {
        storage.put(series.id(), series);
        return series;
    }

    @Override
    public DateAlignedSeries fetch(String seriesId, LocalDate fromInclusive, LocalDate toInclusive) {
        DateAlignedSeries series = storage.get(seriesId);
        if (series == null) {
            return DateAlignedSeries.empty(seriesId);
        }
        return series.between(fromInclusive, toInclusive);
    }

    public Set<String> ids() {
        return Set.copyOf(storage.keySet());
    }
}
