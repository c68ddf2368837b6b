package com.brandmetrics.backend.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Naming conventions for per-tenant configuration variables.
 * For tenant {@code brandA} and suffix {@code DATABASE_URL} the candidates are, in order:
 * {@code BRANDA_DATABASE_URL}, {@code BRAND_BRANDA_DATABASE_URL}, {@code branda_DATABASE_URL}.
 */
public final class TenantVariableResolver {

    public static final String DATABASE_URL = "DATABASE_URL";
    public static final String METRICS_QUERY = "METRICS_QUERY";
    public static final String INDEXED_CONNECTION_PREFIX = "MYSQL_CONNECT_";

    private static final List<Function<String, String>> KEY_BUILDERS = List.of(
            id -> id.toUpperCase(Locale.ROOT),
            id -> "BRAND_" + id.toUpperCase(Locale.ROOT),
            id -> id.toLowerCase(Locale.ROOT));

    private TenantVariableResolver() {
    }

    public static List<String> candidateNames(String tenantId, String suffix) {
        List<String> names = new ArrayList<>(KEY_BUILDERS.size());
        for (Function<String, String> builder : KEY_BUILDERS) {
            String name = builder.apply(tenantId) + "_" + suffix;
            if (!names.contains(name)) {
                names.add(name);
            }
        }
        return names;
    }

    public static String indexedConnectionName(int slot) {
        return INDEXED_CONNECTION_PREFIX + slot;
    }

    /**
     * First candidate with a non-blank value, trimmed.
     */
    public static Optional<String> firstNonBlank(List<String> candidates, Map<String, String> variables) {
        for (String name : candidates) {
            String value = variables.get(name);
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }
}
