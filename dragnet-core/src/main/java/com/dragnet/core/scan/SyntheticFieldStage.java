package com.dragnet.core.scan;

import com.dragnet.core.filter.Records;
import com.dragnet.core.model.Breakdown;
import com.dragnet.core.pipeline.Stage;
import com.dragnet.core.pipeline.StageContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds date-derived fields: each synthetic breakdown reads its source field, parses it as a date and stores epoch
 * seconds under the breakdown's name. Records missing a source field or holding an unparseable date are dropped.
 */
public final class SyntheticFieldStage implements Stage<Map<String, Object>, Map<String, Object>> {

    public static final String NAME = "synthetic";
    public static final String UNDEFINED = "nerr_undef";
    public static final String BAD_DATE = "nerr_baddate";

    private final List<Breakdown> fields;

    public SyntheticFieldStage(List<Breakdown> fields) {
        this.fields = List.copyOf(fields);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void process(Map<String, Object> record, StageContext<Map<String, Object>> context) {
        Map<String, Object> out = new LinkedHashMap<>(record);
        String error = derive(record, fields, out);
        if (error == null) {
            context.emit(out);
        } else {
            context.bump(error);
        }
    }

    /**
     * Writes each date field of {@code record} into {@code out} as epoch seconds.
     *
     * @return {@code null} on success, otherwise the counter naming why the record has to be dropped
     */
    public static String derive(Map<String, ?> record, List<Breakdown> fields, Map<String, Object> out) {
        for (Breakdown field : fields) {
            Object raw = Records.pluck(record, field.field());
            if (raw == null) {
                return UNDEFINED;
            }
            Long seconds = DateFieldParser.toEpochSeconds(raw);
            if (seconds == null) {
                return BAD_DATE;
            }
            out.put(field.name(), seconds);
        }
        return null;
    }
}
