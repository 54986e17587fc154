package com.repo.formulas.graph;

public enum DependencyType {
    DIRECT,
    EXTERNAL,
    VOLATILE
}
