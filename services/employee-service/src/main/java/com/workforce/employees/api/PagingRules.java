package com.workforce.employees.api;

/** Paging limits and messages shared by the list endpoints. */
public final class PagingRules {

    public static final int MAX_RECORDS_PER_PAGE = 100;

    public static final String PAGE_MESSAGE = "Page number must be set to a positive non-zero integer.";
    public static final String MIN_RECORDS_MESSAGE = "You must return at least one record.";
    public static final String MAX_RECORDS_MESSAGE = "You cannot return more than 100 records.";

    private PagingRules() {}

    /** Returns {@code page}, or 1 when absent. */
    public static int pageOrDefault(Integer page) {
        return page == null ? 1 : page;
    }

    /** Returns {@code recordsPerPage}, or {@code fallback} when absent. */
    public static int recordsOrDefault(Integer recordsPerPage, int fallback) {
        return recordsPerPage == null ? fallback : recordsPerPage;
    }
}
