package com.example.sheetsync.model;

import lombok.Value;

@Value
public class Pagination {
    int page;
    int limit;

    public static Pagination of(Integer page, Integer limit) {
        if (page == null && limit == null) return null;
        return new Pagination(page != null ? page : 1, limit != null ? limit : 50);
    }
}
