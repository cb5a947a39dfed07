package org.exposql.engine;

import java.util.List;
import org.exposql.expr.SelectQuery;

/**
 * Runs a compiled plan. Implementations own timeouts and retries; callers pass their
 * exceptions through unchanged.
 */
public interface QueryExecutor {
    List<ResultRow> execute(SelectQuery query);
}
