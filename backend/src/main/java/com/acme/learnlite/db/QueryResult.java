package com.acme.learnlite.db;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record QueryResult(List<Map<String, Object>> rows, Integer rowCount) {
    public QueryResult {
        rows = rows == null ? List.of() : rows;
    }

    public static QueryResult of(List<Map<String, Object>> rows) {
        return new QueryResult(rows, rows.size());
    }

    public static QueryResult updated(int count) {
        return new QueryResult(List.of(), count);
    }

    public Optional<Map<String, Object>> firstRow() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
