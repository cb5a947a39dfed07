package org.exposql.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;
import org.exposql.expr.Expr;
import org.exposql.expr.FromClause;
import org.exposql.expr.SelectQuery;

/**
 * Reference executor that evaluates plans over an {@link EventStore} in memory.
 *
 * <p>Rows keep insertion order through scans, joins and groups (groups are emitted in order of
 * first appearance), so results are deterministic for a given store.
 */
public final class InMemoryQueryEngine implements QueryExecutor {
    private final EventStore store;
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    public InMemoryQueryEngine(final EventStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public List<ResultRow> execute(final SelectQuery query) {
        Objects.requireNonNull(query, "query");
        final List<Document> rows = run(query, Map.of());
        final List<ResultRow> results = new ArrayList<>(rows.size());
        for (final Document row : rows) {
            results.add(new ResultRow(row));
        }
        return List.copyOf(results);
    }

    private List<Document> run(final SelectQuery query, final Map<String, List<Document>> outerCtes) {
        final Map<String, List<Document>> ctes = new LinkedHashMap<>(outerCtes);
        for (final SelectQuery.Cte cte : query.ctes()) {
            ctes.put(cte.name(), run(cte.query(), ctes));
        }

        List<RowScope> scopes = scan(query.from(), ctes);
        if (query.where().isPresent()) {
            final Expr where = query.where().get();
            final List<RowScope> kept = new ArrayList<>();
            for (final RowScope scope : scopes) {
                if (Values.isTruthy(evaluator.evaluate(where, scope))) {
                    kept.add(scope);
                }
            }
            scopes = kept;
        }

        if (!query.groupBy().isEmpty() || selectsAggregates(query)) {
            return aggregate(query, scopes);
        }
        final List<Document> output = new ArrayList<>(scopes.size());
        for (final RowScope scope : scopes) {
            final Document row = new Document();
            for (final SelectQuery.Alias alias : query.select()) {
                row.put(alias.name(), evaluator.evaluate(alias.expr(), scope));
            }
            output.add(row);
        }
        return output;
    }

    private List<Document> aggregate(final SelectQuery query, final List<RowScope> scopes) {
        final Map<GroupKey, List<RowScope>> groups = new LinkedHashMap<>();
        if (query.groupBy().isEmpty()) {
            groups.put(new GroupKey(List.of()), scopes);
        } else {
            for (final RowScope scope : scopes) {
                final List<Object> key = new ArrayList<>(query.groupBy().size());
                for (final Expr expr : query.groupBy()) {
                    key.add(Values.groupingKey(evaluator.evaluate(expr, scope)));
                }
                groups.computeIfAbsent(new GroupKey(key), ignored -> new ArrayList<>()).add(scope);
            }
        }

        final List<Document> output = new ArrayList<>(groups.size());
        for (final List<RowScope> members : groups.values()) {
            final RowScope representative = members.isEmpty() ? RowScope.EMPTY : members.get(0);
            if (query.having().isPresent()
                    && !Values.isTruthy(evaluator.evaluateGroup(query.having().get(), representative, members))) {
                continue;
            }
            final Document row = new Document();
            for (final SelectQuery.Alias alias : query.select()) {
                row.put(alias.name(), evaluator.evaluateGroup(alias.expr(), representative, members));
            }
            output.add(row);
        }
        return output;
    }

    private static boolean selectsAggregates(final SelectQuery query) {
        for (final SelectQuery.Alias alias : query.select()) {
            if (ExpressionEvaluator.containsAggregate(alias.expr())) {
                return true;
            }
        }
        return query.having().isPresent();
    }

    private List<RowScope> scan(final FromClause from, final Map<String, List<Document>> ctes) {
        if (from instanceof FromClause.Table table) {
            final List<Document> rows = ctes.containsKey(table.name()) ? ctes.get(table.name()) : store.table(table.name());
            final List<RowScope> scopes = new ArrayList<>(rows.size());
            for (final Document row : rows) {
                scopes.add(RowScope.of(table.alias(), row));
            }
            return scopes;
        }
        if (from instanceof FromClause.Subquery subquery) {
            final List<Document> rows = run(subquery.query(), ctes);
            final List<RowScope> scopes = new ArrayList<>(rows.size());
            for (final Document row : rows) {
                scopes.add(RowScope.of(subquery.alias(), row));
            }
            return scopes;
        }
        return join((FromClause.Join) from, ctes);
    }

    /**
     * Nested-loop join. Unmatched left rows of a LEFT JOIN see null for every right-side alias.
     */
    private List<RowScope> join(final FromClause.Join join, final Map<String, List<Document>> ctes) {
        final List<RowScope> left = scan(join.left(), ctes);
        final List<RowScope> right = scan(join.right(), ctes);
        final List<String> rightAliases = aliases(join.right());
        final List<RowScope> output = new ArrayList<>();
        for (final RowScope leftRow : left) {
            boolean matched = false;
            for (final RowScope rightRow : right) {
                final RowScope combined = leftRow.merge(rightRow);
                if (join.type() == FromClause.JoinType.CROSS
                        || Values.isTruthy(evaluator.evaluate(join.on(), combined))) {
                    output.add(combined);
                    matched = true;
                }
            }
            if (!matched && join.type() == FromClause.JoinType.LEFT) {
                output.add(leftRow.withNull(rightAliases));
            }
        }
        return output;
    }

    private static List<String> aliases(final FromClause from) {
        if (from instanceof FromClause.Table table) {
            return List.of(table.alias());
        }
        if (from instanceof FromClause.Subquery subquery) {
            return List.of(subquery.alias());
        }
        final FromClause.Join join = (FromClause.Join) from;
        final List<String> aliases = new ArrayList<>(aliases(join.left()));
        aliases.addAll(aliases(join.right()));
        return aliases;
    }

    private static final class GroupKey {
        private final List<Object> values;
        private final int hashCode;

        private GroupKey(final List<Object> values) {
            this.values = values;
            this.hashCode = Arrays.deepHashCode(values.toArray());
        }

        @Override
        public boolean equals(final Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof GroupKey that)) {
                return false;
            }
            return Arrays.deepEquals(values.toArray(), that.values.toArray());
        }

        @Override
        public int hashCode() {
            return hashCode;
        }
    }
}
