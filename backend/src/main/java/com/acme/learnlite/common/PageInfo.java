package com.acme.learnlite.common;

public record PageInfo(int page, int limit, long total, long totalPages) {
    public static PageInfo of(Pagination pagination, long total) {
        long pages = (total + pagination.limit() - 1) / pagination.limit();
        return new PageInfo(pagination.page(), pagination.limit(), total, pages);
    }
}
