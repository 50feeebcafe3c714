package com.dragnet.service.storage.sink;

import com.dragnet.core.model.AggregatedPoint;
import com.dragnet.core.pipeline.Stage;
import com.dragnet.core.pipeline.StageContext;
import java.nio.file.Path;
import java.util.List;

/** Last stage of an index build: writes every point to a sink and publishes on end of input. */
public final class IndexSinkStage implements Stage<AggregatedPoint, Void> {

    public static final String NAME = "sink";

    private final PointSink sink;
    private volatile List<Path> published = List.of();

    public IndexSinkStage(PointSink sink) {
        this.sink = sink;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void process(AggregatedPoint point, StageContext<Void> context) {
        sink.write(point);
        context.bump("nwritten");
    }

    @Override
    public void finish(StageContext<Void> context) {
        published = sink.flush();
    }

    @Override
    public void abort() {
        sink.abort();
    }

    public List<Path> published() {
        return published;
    }
}
