package com.brandmetrics.backend.util;

public final class SnapshotKeys {

    private static final String PREVIOUS_SUFFIX = ":old";

    private SnapshotKeys() {
    }

    /** {@code metrics:<tenantId>} for the default prefix. */
    public static String current(String prefix, String tenantId) {
        return prefix + ":" + tenantId;
    }

    public static String previous(String prefix, String tenantId) {
        return current(prefix, tenantId) + PREVIOUS_SUFFIX;
    }
}
