package org.exposql.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable SELECT with optional CTEs, filter, grouping and group filter.
 */
public record SelectQuery(
        List<Cte> ctes,
        List<Alias> select,
        FromClause from,
        Optional<Expr> where,
        List<Expr> groupBy,
        Optional<Expr> having) {

    public SelectQuery {
        ctes = List.copyOf(Objects.requireNonNull(ctes, "ctes"));
        select = List.copyOf(Objects.requireNonNull(select, "select"));
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(where, "where");
        groupBy = List.copyOf(Objects.requireNonNull(groupBy, "groupBy"));
        Objects.requireNonNull(having, "having");
        if (select.isEmpty()) {
            throw new IllegalArgumentException("select list must not be empty");
        }
        final List<String> names = new ArrayList<>();
        for (final Cte cte : ctes) {
            if (names.contains(cte.name())) {
                throw new IllegalArgumentException("duplicate CTE name: " + cte.name());
            }
            names.add(cte.name());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> columnNames() {
        final List<String> names = new ArrayList<>(select.size());
        for (final Alias alias : select) {
            names.add(alias.name());
        }
        return List.copyOf(names);
    }

    public Optional<Cte> cte(final String name) {
        for (final Cte cte : ctes) {
            if (cte.name().equals(name)) {
                return Optional.of(cte);
            }
        }
        return Optional.empty();
    }

    /**
     * Named output column.
     */
    public record Alias(String name, Expr expr) {
        public Alias {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(expr, "expr");
        }
    }

    /**
     * Named common table expression, visible to later CTEs and to the body.
     */
    public record Cte(String name, SelectQuery query) {
        public Cte {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(query, "query");
        }
    }

    public static final class Builder {
        private final List<Cte> ctes = new ArrayList<>();
        private final List<Alias> select = new ArrayList<>();
        private FromClause from;
        private Expr where;
        private final List<Expr> groupBy = new ArrayList<>();
        private Expr having;

        private Builder() {}

        public Builder with(final String name, final SelectQuery query) {
            ctes.add(new Cte(name, query));
            return this;
        }

        public Builder with(final List<Cte> values) {
            ctes.addAll(values);
            return this;
        }

        public Builder select(final String name, final Expr expr) {
            select.add(new Alias(name, expr));
            return this;
        }

        public Builder from(final FromClause value) {
            this.from = value;
            return this;
        }

        public Builder from(final String table) {
            this.from = FromClause.Table.of(table);
            return this;
        }

        public Builder where(final Expr value) {
            this.where = value;
            return this;
        }

        public Builder groupBy(final Expr... values) {
            groupBy.addAll(List.of(values));
            return this;
        }

        public Builder having(final Expr value) {
            this.having = value;
            return this;
        }

        public SelectQuery build() {
            return new SelectQuery(
                    ctes,
                    select,
                    from,
                    Optional.ofNullable(where).filter(expr -> !Exprs.isTrue(expr)),
                    groupBy,
                    Optional.ofNullable(having));
        }
    }
}
