package com.repo.formulas.graph;

public enum ImpactLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
