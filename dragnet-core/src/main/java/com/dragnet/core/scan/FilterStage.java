package com.dragnet.core.scan;

import com.dragnet.core.exception.FilterEvaluationException;
import com.dragnet.core.filter.FilterPredicate;
import com.dragnet.core.pipeline.Stage;
import com.dragnet.core.pipeline.StageContext;
import java.util.Map;

/** Passes records that satisfy a predicate. Records the predicate cannot be evaluated on are dropped and counted. */
public final class FilterStage implements Stage<Map<String, Object>, Map<String, Object>> {

    public static final String FILTERED_OUT = "nfilteredout";
    public static final String FAILED_EVAL = "nfailedeval";

    private final String name;
    private final FilterPredicate predicate;

    public FilterStage(String name, FilterPredicate predicate) {
        this.name = name;
        this.predicate = predicate;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void process(Map<String, Object> record, StageContext<Map<String, Object>> context) {
        boolean keep;
        try {
            keep = predicate.eval(record);
        } catch (FilterEvaluationException e) {
            context.warn(FAILED_EVAL, e);
            return;
        }
        if (keep) {
            context.emit(record);
        } else {
            context.bump(FILTERED_OUT);
        }
    }
}
