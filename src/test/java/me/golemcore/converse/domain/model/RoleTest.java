package me.golemcore.converse.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class RoleTest {

    @Test
    void fromValue_acceptsTheFourWireValues() {
        assertEquals(Role.SYSTEM, Role.fromValue("system"));
        assertEquals(Role.USER, Role.fromValue("user"));
        assertEquals(Role.ASSISTANT, Role.fromValue("assistant"));
        assertEquals(Role.TOOL, Role.fromValue("tool"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "moderator", "USER", "", " user" })
    void fromValue_rejectsUnknownRoles(String value) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Role.fromValue(value));
        assertTrue(e.getMessage().contains("Invalid role"));
    }

    @Test
    void fromValue_rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> Role.fromValue(null));
    }

    @Test
    void toString_returnsWireValue() {
        assertEquals("assistant", Role.ASSISTANT.toString());
    }
}
