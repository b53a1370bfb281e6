package com.example.spacefinder.duplicates;

public enum DuplicateStage {
    GROUPING_BY_SIZE("Grouping by size"),
    PARTIAL_HASHING("Calculating partial hashes"),
    COMPLETE("Complete");

    private final String description;

    DuplicateStage(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return description;
    }
}
