package com.brandmetrics.backend.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Works out which tenants are configured.
 * An explicit comma separated list wins; otherwise tenants are read from
 * indexed slots {@code BRAND_TAG_<i>}, {@code X_BRAND_NAME_<i>} or
 * {@code SHOP_NAME_<i>} for {@code i < totalConfigCount}.
 */
public final class TenantDiscovery {

    static final List<String> SLOT_TAG_PREFIXES = List.of("BRAND_TAG_", "X_BRAND_NAME_", "SHOP_NAME_");

    private TenantDiscovery() {
    }

    public static List<String> discoverTenants(String explicitList, int totalConfigCount,
            Map<String, String> variables) {
        List<String> explicit = parseCommaSeparated(explicitList);
        if (!explicit.isEmpty()) {
            return explicit;
        }
        return new ArrayList<>(slotIndex(totalConfigCount, variables).keySet());
    }

    /**
     * Map every tenant tag found in an indexed slot to the slot number.
     * The first slot wins when a tag appears twice.
     */
    public static Map<String, Integer> slotIndex(int totalConfigCount, Map<String, String> variables) {
        Map<String, Integer> slots = new LinkedHashMap<>();
        for (int i = 0; i < totalConfigCount; i++) {
            String tag = slotTag(i, variables);
            if (tag != null) {
                slots.putIfAbsent(tag, i);
            }
        }
        return slots;
    }

    private static String slotTag(int index, Map<String, String> variables) {
        for (String prefix : SLOT_TAG_PREFIXES) {
            String value = variables.get(prefix + index);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    public static List<String> parseCommaSeparated(String input) {
        if (input == null || input.trim().isEmpty()) {
            return Collections.emptyList();
        }

        return Arrays.stream(input.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }
}
