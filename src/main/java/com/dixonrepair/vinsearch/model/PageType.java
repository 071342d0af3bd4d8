package com.dixonrepair.vinsearch.model;

/**
 * Kind of page a result URL points at, with its quality weight.
 */
public enum PageType {

    PRODUCT(1.0),
    CATEGORY(0.5),
    UNKNOWN(0.2);

    private final double weight;

    PageType(double weight) {
        this.weight = weight;
    }

    public double getWeight() {
        return weight;
    }
}
