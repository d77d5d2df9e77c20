package com.gillianbc.retirement.model;

public enum LeverDirection {
    INCREASE,
    DECREASE;

    public String label() {
        return name().toLowerCase();
    }
}
