package io.offsync.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

    @Test
    void validTableNameReturnsName() {
        assertEquals("offsync_kv", TableNames.validate("offsync_kv"));
        assertEquals("AppState", TableNames.validate("AppState"));
        assertEquals("_kv2", TableNames.validate("_kv2"));
    }

    @Test
    void defaultTableConstant() {
        assertEquals("offsync_kv", TableNames.DEFAULT_TABLE);
    }

    @Test
    void nullTableNameThrows() {
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    }

    @Test
    void sqlFragmentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1kv"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("kv; DROP TABLE users"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("app.kv"));
    }

    @Test
    void overlongNameRejected() {
        assertEquals("k".repeat(63), TableNames.validate("k".repeat(63)));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("k".repeat(64)));
    }
}
