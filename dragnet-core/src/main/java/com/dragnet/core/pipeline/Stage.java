package com.dragnet.core.pipeline;

/**
 * One step of a {@link Pipeline}. A stage is driven by a single worker thread: {@link #process} is called once per
 * input in arrival order, then {@link #finish} once at end of input. Either may emit any number of outputs.
 */
public interface Stage<I, O> {

    String name();

    void process(I input, StageContext<O> context) throws Exception;

    default void finish(StageContext<O> context) throws Exception {}

    /**
     * Called once if the pipeline is aborted or fails, possibly concurrently with {@link #process}. Must release held
     * resources without completing partial work.
     */
    default void abort() {}
}
