package com.dragnet.core.pipeline;

import com.dragnet.core.exception.PipelineException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import lombok.extern.slf4j.Slf4j;

/**
 * A linear chain of {@link Stage}s that behaves as one unit: one input end, one output end.
 *
 * <p>Each stage runs on its own worker thread. Stages are connected by bounded buffers, so a slow consumer slows every
 * upstream stage down to the writer: {@link #write} blocks while the first buffer is full. {@link #end()} is passed
 * through every stage in order and {@link #take()} reports completion only after the last stage has finished.
 *
 * <p>The first exception thrown by any stage (or by the source given to {@link #start}) stops the whole pipeline,
 * aborts every stage and is reported exactly once, by whichever of {@link #take()} or {@link #await()} observes it
 * first.
 */
@Slf4j
public final class Pipeline<I, O> implements AutoCloseable {

    private static final long POLL_MILLIS = 20;
    private static final int LOGGED_WARNINGS_PER_COUNTER = 10;
    private static final String SOURCE = "source";
    private static final Object END = new Object();

    private final String name;
    private final List<Stage<Object, Object>> stages;
    private final List<String> stageNames;
    private final List<BlockingQueue<Object>> buffers;
    private final List<Map<String, LongAdder>> counters;
    private final ExecutorService executor;
    private final CountDownLatch done;
    private final AtomicReference<PipelineException> failure = new AtomicReference<>();
    private final AtomicBoolean failureReported = new AtomicBoolean();
    private final AtomicBoolean stagesAborted = new AtomicBoolean();
    private volatile boolean aborted;
    private volatile boolean inputEnded;
    private boolean outputEnded;
    private long inputs;

    private Pipeline(String name, List<Stage<Object, Object>> stages, int bufferSize) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be at least 1");
        }
        this.name = name;
        this.stages = List.copyOf(stages);
        this.stageNames = uniqueNames(this.stages);
        this.buffers = new ArrayList<>();
        this.counters = new ArrayList<>();
        for (int i = 0; i <= stages.size(); i++) {
            buffers.add(new ArrayBlockingQueue<>(bufferSize));
        }
        for (int i = 0; i < stages.size(); i++) {
            counters.add(new ConcurrentHashMap<>());
        }
        this.done = new CountDownLatch(stages.size());
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(stages.size() + 1, r -> {
            Thread t = new Thread(r, "dragnet-" + name + "-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < stages.size(); i++) {
            int index = i;
            executor.submit(() -> runStage(index));
        }
        log.debug("Pipeline {} started stages={} bufferSize={}", name, stageNames, bufferSize);
    }

    public static <T> Builder<T, T> builder(String name, int bufferSize) {
        return new Builder<>(name, bufferSize, new ArrayList<>());
    }

    private static List<String> uniqueNames(List<Stage<Object, Object>> stages) {
        Set<String> seen = new HashSet<>();
        List<String> names = new ArrayList<>();
        for (int i = 0; i < stages.size(); i++) {
            String n = stages.get(i).name();
            names.add(seen.add(n) ? n : n + "-" + i);
        }
        return List.copyOf(names);
    }

    public String name() {
        return name;
    }

    /**
     * Hands one item to the first stage, blocking while its buffer is full.
     *
     * @return {@code false} if the pipeline stopped (failed or aborted) and no longer accepts input
     */
    public boolean write(I item) {
        if (inputEnded) {
            throw new IllegalStateException("pipeline " + name + ": write after end of input");
        }
        return offer(buffers.get(0), new Envelope<>(item, List.of(new ProvenanceEntry(SOURCE, inputs++))));
    }

    /** Signals end of input. Items already written are still processed. */
    public void end() {
        if (inputEnded) {
            return;
        }
        inputEnded = true;
        offer(buffers.get(0), END);
    }

    /**
     * Feeds the pipeline from {@code source} on a separate thread, pulling one item at a time as buffer space allows,
     * then ends input. The source is closed afterwards if it is {@link AutoCloseable}.
     */
    public void start(Iterator<? extends I> source) {
        executor.submit(() -> {
            try {
                while (!stopped() && source.hasNext()) {
                    if (!write(source.next())) {
                        break;
                    }
                }
                if (!stopped()) {
                    end();
                }
            } catch (RuntimeException e) {
                fail(SOURCE, e);
            } finally {
                if (source instanceof AutoCloseable closeable) {
                    try {
                        closeable.close();
                    } catch (Exception e) {
                        log.warn("Pipeline {} failed to close source", name, e);
                    }
                }
            }
        });
    }

    /**
     * Next output of the last stage, blocking until one is available.
     *
     * @return {@code null} once the last stage has finished, or the pipeline was aborted
     * @throws PipelineException the first stage failure, reported once
     */
    public Envelope<O> take() {
        if (outputEnded) {
            return null;
        }
        BlockingQueue<Object> out = buffers.get(stages.size());
        try {
            while (true) {
                PipelineException f = failure.get();
                if (f != null) {
                    outputEnded = true;
                    if (failureReported.compareAndSet(false, true)) {
                        throw f;
                    }
                    return null;
                }
                if (aborted) {
                    outputEnded = true;
                    return null;
                }
                Object signal = out.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (signal == END) {
                    outputEnded = true;
                    return null;
                }
                if (signal != null) {
                    @SuppressWarnings("unchecked")
                    Envelope<O> envelope = (Envelope<O>) signal;
                    return envelope;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while reading pipeline " + name, e);
        }
    }

    /** Reads every output value, then waits for completion. */
    public List<O> drain() {
        List<O> values = new ArrayList<>();
        Envelope<O> envelope;
        while ((envelope = take()) != null) {
            values.add(envelope.value());
        }
        await();
        return values;
    }

    /**
     * Blocks until every stage has finished or the pipeline stopped.
     *
     * @throws PipelineException the first stage failure, if not already reported by {@link #take()}
     */
    public PipelineStats await() {
        try {
            while (!done.await(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (aborted) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for pipeline " + name, e);
        }
        PipelineException f = failure.get();
        if (f != null && failureReported.compareAndSet(false, true)) {
            throw f;
        }
        return stats();
    }

    /** Stops pulling from the source, stops every stage and lets each release its resources. Idempotent. */
    public void abort() {
        if (aborted) {
            return;
        }
        aborted = true;
        log.info("Pipeline {} aborted", name);
        abortStages();
        executor.shutdownNow();
    }

    /** Aborts the pipeline unless it already completed. */
    @Override
    public void close() {
        if (done.getCount() > 0 || failure.get() != null) {
            abort();
        }
        executor.shutdown();
    }

    public boolean failed() {
        return failure.get() != null;
    }

    public PipelineStats stats() {
        Map<String, Map<String, Long>> snapshot = new LinkedHashMap<>();
        for (int i = 0; i < stages.size(); i++) {
            Map<String, Long> values = new LinkedHashMap<>();
            counters.get(i).forEach((k, v) -> values.put(k, v.sum()));
            snapshot.put(stageNames.get(i), values);
        }
        return new PipelineStats(snapshot);
    }

    private boolean stopped() {
        return aborted || failure.get() != null;
    }

    private boolean offer(BlockingQueue<Object> buffer, Object signal) {
        try {
            while (!buffer.offer(signal, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (stopped()) {
                    return false;
                }
            }
            return !stopped();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void runStage(int index) {
        Stage<Object, Object> stage = stages.get(index);
        String stageName = stageNames.get(index);
        BlockingQueue<Object> in = buffers.get(index);
        StageContextImpl context = new StageContextImpl(stageName, buffers.get(index + 1), counters.get(index));
        long ordinal = 0;
        try {
            while (!stopped()) {
                Object signal = in.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (signal == null || stopped()) {
                    continue;
                }
                if (signal == END) {
                    context.current = List.of();
                    stage.finish(context);
                    context.finished = true;
                    context.push(END);
                    log.debug("Pipeline {} stage {} finished", name, stageName);
                    return;
                }
                Envelope<?> envelope = (Envelope<?>) signal;
                List<ProvenanceEntry> path = new ArrayList<>(envelope.provenance());
                path.add(new ProvenanceEntry(stageName, ordinal++));
                context.current = path;
                context.bump("ninputs");
                stage.process(envelope.value(), context);
            }
        } catch (Stopped e) {
            log.debug("Pipeline {} stage {} stopped", name, stageName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!stopped()) {
                fail(stageName, e);
            }
        } catch (Exception e) {
            fail(stageName, e);
        } finally {
            done.countDown();
            if (done.getCount() == 0) {
                executor.shutdown();
            }
        }
    }

    private void fail(String stageName, Exception cause) {
        PipelineException wrapped = new PipelineException(stageName, cause);
        if (failure.compareAndSet(null, wrapped)) {
            log.error("Pipeline {} stage {} failed", name, stageName, cause);
            abortStages();
        }
    }

    private void abortStages() {
        if (!stagesAborted.compareAndSet(false, true)) {
            return;
        }
        for (int i = 0; i < stages.size(); i++) {
            try {
                stages.get(i).abort();
            } catch (RuntimeException e) {
                log.warn("Pipeline {} stage {} failed to abort cleanly", name, stageNames.get(i), e);
            }
        }
    }

    /** Unwinds a stage blocked on a full buffer once the pipeline stopped. */
    private static final class Stopped extends RuntimeException {
        Stopped() {
            super(null, null, false, false);
        }
    }

    private final class StageContextImpl implements StageContext<Object> {
        private final String stageName;
        private final BlockingQueue<Object> out;
        private final Map<String, LongAdder> stageCounters;
        private List<ProvenanceEntry> current = List.of();
        private boolean finished;

        StageContextImpl(String stageName, BlockingQueue<Object> out, Map<String, LongAdder> stageCounters) {
            this.stageName = stageName;
            this.out = out;
            this.stageCounters = stageCounters;
        }

        @Override
        public void emit(Object value) {
            if (finished) {
                throw new IllegalStateException("stage " + stageName + " emitted after it finished");
            }
            bump("noutputs");
            push(new Envelope<>(value, current));
        }

        void push(Object signal) {
            if (!offer(out, signal)) {
                throw new Stopped();
            }
        }

        @Override
        public void bump(String counter) {
            bump(counter, 1);
        }

        @Override
        public void bump(String counter, long delta) {
            stageCounters.computeIfAbsent(counter, k -> new LongAdder()).add(delta);
        }

        @Override
        public void warn(String counter, Throwable cause) {
            LongAdder adder = stageCounters.computeIfAbsent(counter, k -> new LongAdder());
            adder.increment();
            if (adder.sum() <= LOGGED_WARNINGS_PER_COUNTER) {
                log.warn("Pipeline {} stage {} {} at {}: {}", name, stageName, counter, current, cause.getMessage());
            } else {
                log.debug("Pipeline {} stage {} {} at {}: {}", name, stageName, counter, current, cause.getMessage());
            }
        }

        @Override
        public List<ProvenanceEntry> provenance() {
            return current;
        }
    }

    public static final class Builder<I, O> {
        private final String name;
        private final int bufferSize;
        private final List<Stage<?, ?>> stages;

        private Builder(String name, int bufferSize, List<Stage<?, ?>> stages) {
            this.name = name;
            this.bufferSize = bufferSize;
            this.stages = stages;
        }

        public <N> Builder<I, N> then(Stage<? super O, N> stage) {
            List<Stage<?, ?>> next = new ArrayList<>(stages);
            next.add(stage);
            return new Builder<>(name, bufferSize, next);
        }

        @SuppressWarnings("unchecked")
        public Pipeline<I, O> build() {
            if (stages.isEmpty()) {
                throw new IllegalStateException("pipeline " + name + " has no stages");
            }
            List<Stage<Object, Object>> raw = new ArrayList<>();
            for (Stage<?, ?> s : stages) {
                raw.add((Stage<Object, Object>) s);
            }
            return new Pipeline<>(name, raw, bufferSize);
        }
    }
}
