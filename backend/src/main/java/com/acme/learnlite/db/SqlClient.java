package com.acme.learnlite.db;

import java.util.List;

public interface SqlClient {
    QueryResult query(String sql, List<?> params);
}
