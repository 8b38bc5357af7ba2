package com.acme.learnlite.validation;

import com.acme.learnlite.common.Pagination;

import java.util.Map;

public final class QueryParams {
    private QueryParams() {}

    public static Pagination validatePagination(Map<String, ?> params) {
        Integer page = InputValues.toInt(params.get("page"));
        Integer limit = InputValues.toInt(params.get("limit"));
        int effectivePage = page == null || page < 1 ? Pagination.DEFAULT_PAGE : page;
        int effectiveLimit = limit == null || limit < 1 || limit > Pagination.MAX_LIMIT ? Pagination.DEFAULT_LIMIT : limit;
        return new Pagination(effectivePage, effectiveLimit);
    }

    public static String sanitizeSearch(Object value) {
        return InputValues.trimmedOrNull(value);
    }
}
