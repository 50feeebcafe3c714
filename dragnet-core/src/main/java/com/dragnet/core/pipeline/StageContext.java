package com.dragnet.core.pipeline;

import java.util.List;

/** What a stage sees of its pipeline while handling one input. */
public interface StageContext<O> {

    /** Passes a value downstream, blocking while the next buffer is full. */
    void emit(O value);

    void bump(String counter);

    void bump(String counter, long delta);

    /** Counts a per-item problem and logs it with the current item's provenance. */
    void warn(String counter, Throwable cause);

    /** Where the current input came from: one entry per stage it passed through, oldest first. */
    List<ProvenanceEntry> provenance();
}
