package com.acme.learnlite.common;

public record Pagination(int page, int limit) {
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public long offset() {
        return (long) (page - 1) * limit;
    }
}
