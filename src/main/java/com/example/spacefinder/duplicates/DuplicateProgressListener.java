package com.example.spacefinder.duplicates;

@FunctionalInterface
public interface DuplicateProgressListener {
    /**
     * Called synchronously from the searching thread. {@code current} never decreases within a stage.
     */
    void onProgress(DuplicateStage stage, long current, long total);

    DuplicateProgressListener NONE = (stage, current, total) -> {
    };
}
