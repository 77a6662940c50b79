package io.b2mash.b2b.projecthub.pagination;

public record PageInfo(
    boolean hasNextPage, boolean hasPreviousPage, String startCursor, String endCursor) {}
