package com.tyron.keystone.api.component;

public enum ComplexityRating {
    LOW,
    MEDIUM,
    HIGH
}
