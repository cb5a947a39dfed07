package org.exposql.expr;

import java.util.Objects;

/**
 * Row source of a {@link SelectQuery}: a table or CTE name, a subquery, or a join of two sources.
 */
public sealed interface FromClause permits FromClause.Table, FromClause.Subquery, FromClause.Join {
    /**
     * Table or CTE reference. Columns are addressable through {@code alias}.
     */
    record Table(String name, String alias) implements FromClause {
        public Table {
            Objects.requireNonNull(name, "name");
            alias = alias == null ? name : alias;
        }

        public static Table of(final String name) {
            return new Table(name, name);
        }
    }

    record Subquery(SelectQuery query, String alias) implements FromClause {
        public Subquery {
            Objects.requireNonNull(query, "query");
            Objects.requireNonNull(alias, "alias");
        }
    }

    /**
     * Join of two sources. {@code on} is ignored for {@link JoinType#CROSS}.
     */
    record Join(FromClause left, FromClause right, JoinType type, Expr on) implements FromClause {
        public Join {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
            Objects.requireNonNull(type, "type");
            if (type != JoinType.CROSS) {
                Objects.requireNonNull(on, "on");
            }
        }
    }

    enum JoinType {
        INNER("INNER JOIN"),
        LEFT("LEFT JOIN"),
        CROSS("CROSS JOIN");

        private final String keyword;

        JoinType(final String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }
}
