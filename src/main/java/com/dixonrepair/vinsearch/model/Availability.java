package com.dixonrepair.vinsearch.model;

public enum Availability {
    IN_STOCK,
    OUT_OF_STOCK,
    UNKNOWN
}
