package com.acme.learnlite.db;

import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class JdbcSqlClient implements SqlClient {
    private final JdbcTemplate jdbc;

    public JdbcSqlClient(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public QueryResult query(String sql, List<?> params) {
        Object[] args = params == null ? new Object[0] : params.toArray();
        return jdbc.execute(sql, (PreparedStatementCallback<QueryResult>) ps -> {
            new ArgumentPreparedStatementSetter(args).setValues(ps);
            if (!ps.execute()) {
                return QueryResult.updated(ps.getUpdateCount());
            }
            ColumnMapRowMapper mapper = new ColumnMapRowMapper();
            List<Map<String, Object>> rows = new ArrayList<>();
            try (ResultSet rs = ps.getResultSet()) {
                int rowNum = 0;
                while (rs.next()) {
                    rows.add(mapper.mapRow(rs, rowNum++));
                }
            }
            return QueryResult.of(rows);
        });
    }
}
