package com.demandlens.insight.model;

public enum AggregationMethod {
    SUM,
    MEAN,
    LAST
}
