package com.brandmetrics.backend.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.temporal.TemporalAccessor;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts JDBC driver values into JSON-safe values for the snapshot cache.
 * Numbers, booleans and strings pass through, temporal values become ISO-8601 strings,
 * binary values become UTF-8 text when they decode cleanly and Base64 otherwise.
 */
public final class JdbcValues {

    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;

    private JdbcValues() {
    }

    /**
     * Current row as column label to value, in column order.
     */
    public static Map<String, Object> readRow(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        Map<String, Object> row = new LinkedHashMap<>(columnCount * 2);
        for (int i = 1; i <= columnCount; i++) {
            String label = meta.getColumnLabel(i);
            if (label == null || label.isEmpty()) {
                label = meta.getColumnName(i);
            }
            row.put(label, toJsonSafe(rs.getObject(i)));
        }
        return row;
    }

    public static Object toJsonSafe(Object value) throws SQLException {
        if (value == null) {
            return null;
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toLocalDateTime().toString();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().toString();
        }
        if (value instanceof java.sql.Time) {
            return ((java.sql.Time) value).toLocalTime().toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof byte[]) {
            return decodeBytes((byte[]) value);
        }
        if (value instanceof Clob) {
            Clob clob = (Clob) value;
            int toRead = (int) Math.min(clob.length(), MAX_LOB_CHARS);
            return toRead <= 0 ? "" : clob.getSubString(1, toRead);
        }
        if (value instanceof Blob) {
            Blob blob = (Blob) value;
            int toRead = (int) Math.min(blob.length(), MAX_BLOB_BYTES);
            return toRead <= 0 ? "" : decodeBytes(blob.getBytes(1, toRead));
        }
        return String.valueOf(value);
    }

    static String decodeBytes(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return Base64.getEncoder().encodeToString(bytes);
        }
    }
}
