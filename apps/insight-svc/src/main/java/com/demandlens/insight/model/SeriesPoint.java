package com.demandlens.insight.model;

import java.time.LocalDate;

public record SeriesPoint(LocalDate date, double value) {
}
