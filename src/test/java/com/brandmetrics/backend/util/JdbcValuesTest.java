package com.brandmetrics.backend.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcValuesTest {

    @Test
    void testToJsonSafe_ScalarsPassThrough() throws Exception {
        assertNull(JdbcValues.toJsonSafe(null));
        assertEquals(42L, JdbcValues.toJsonSafe(42L));
        assertEquals(new BigDecimal("19.99"), JdbcValues.toJsonSafe(new BigDecimal("19.99")));
        assertEquals(Boolean.TRUE, JdbcValues.toJsonSafe(Boolean.TRUE));
        assertEquals("mug", JdbcValues.toJsonSafe("mug"));
    }

    @Test
    void testToJsonSafe_TemporalsBecomeIsoStrings() throws Exception {
        assertEquals("2024-05-01T10:15:30",
                JdbcValues.toJsonSafe(Timestamp.valueOf(LocalDateTime.of(2024, 5, 1, 10, 15, 30))));
        assertEquals("2024-05-01", JdbcValues.toJsonSafe(Date.valueOf(LocalDate.of(2024, 5, 1))));
        assertEquals("2024-05-01", JdbcValues.toJsonSafe(LocalDate.of(2024, 5, 1)));
    }

    @Test
    void testToJsonSafe_BytesAsTextOrBase64() throws Exception {
        assertEquals("héllo", JdbcValues.toJsonSafe("héllo".getBytes(StandardCharsets.UTF_8)));
        assertEquals("/w==", JdbcValues.toJsonSafe(new byte[] { (byte) 0xFF }));
    }

    @Test
    void testToJsonSafe_OtherTypesUseToString() throws Exception {
        UUID id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");

        assertEquals(id.toString(), JdbcValues.toJsonSafe(id));
    }
}
