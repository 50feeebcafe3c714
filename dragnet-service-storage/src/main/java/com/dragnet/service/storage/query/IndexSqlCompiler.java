package com.dragnet.service.storage.query;

import com.dragnet.core.filter.FilterPredicate;
import com.dragnet.core.model.DragnetFields;
import com.dragnet.core.model.QueryConfig;
import com.dragnet.core.query.QueryCompiler;
import com.dragnet.service.storage.sqlite.IndexSchema;
import com.dragnet.service.storage.sqlite.SqlIdentifiers;
import java.util.List;

/**
 * Translates a query against a selected metric into one aggregate {@code SELECT}, e.g.
 * {@code SELECT host,SUM(value) AS value FROM dragnet_index_0 WHERE (host = 'a') GROUP BY host}.
 */
public final class IndexSqlCompiler {

    private IndexSqlCompiler() {}

    /** @throws com.dragnet.core.exception.CompileException if the filter cannot be expressed in SQL */
    public static String compile(QueryConfig query, MetricSelection selection) {
        List<String> columns =
                query.breakdownNames().stream().map(SqlIdentifiers::escape).toList();
        String grouped = String.join(",", columns);

        FilterPredicate where = FilterPredicate.and(
                selection.filterApplied() ? null : query.filter(),
                QueryCompiler.timeBoundsFilter(query, DragnetFields.TIMESTAMP));
        String condition = where == null ? null : where.toRestrictedExpression(SqlIdentifiers::escape);

        StringBuilder sql = new StringBuilder("SELECT ");
        if (!columns.isEmpty()) {
            sql.append(grouped).append(',');
        }
        sql.append("SUM(").append(IndexSchema.VALUE_COLUMN).append(") AS ").append(IndexSchema.VALUE_COLUMN);
        sql.append(" FROM ").append(selection.tableName());
        if (condition != null) {
            sql.append(" WHERE ").append(condition);
        }
        if (!columns.isEmpty()) {
            sql.append(" GROUP BY ").append(grouped);
        }
        return sql.toString();
    }
}
