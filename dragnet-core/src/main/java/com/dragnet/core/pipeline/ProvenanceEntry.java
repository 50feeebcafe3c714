package com.dragnet.core.pipeline;

/**
 * @param stage stage (or source) name
 * @param input zero-based ordinal of the input that stage was handling
 */
public record ProvenanceEntry(String stage, long input) {

    @Override
    public String toString() {
        return stage + "#" + input;
    }
}
