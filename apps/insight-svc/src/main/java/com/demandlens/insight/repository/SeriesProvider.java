package com.demandlens.insight.repository;

import com.demandlens.insight.model.DateAlignedSeries;
import java.time.LocalDate;

/**
 * Source of named series. Unknown ids yield an empty series rather than an error.
 */
public interface SeriesProvider {

    DateAlignedSeries fetch(String seriesId, LocalDate fromInclusive, LocalDate toInclusive);
}
