package com.brandmetrics.backend.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of counting one default table: either a row count, or absent
 * (the table does not exist or could not be queried on a healthy connection).
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class TableCount {
    private final String table;
    private final Long rows;
    private final String absenceReason;

    public static TableCount counted(String table, long rows) {
        return new TableCount(table, rows, null);
    }

    public static TableCount absent(String table, String reason) {
        return new TableCount(table, null, reason);
    }

    public boolean isPresent() {
        return rows != null;
    }
}
