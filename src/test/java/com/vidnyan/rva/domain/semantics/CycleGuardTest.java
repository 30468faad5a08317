package com.vidnyan.rva.domain.semantics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CycleGuardTest {

    @Test
    void add_ShouldReportOnlyFirstVisit() {
        CycleGuard guard = new CycleGuard();

        assertTrue(guard.add("com.example.A"));
        assertFalse(guard.add("com.example.A"));
        assertTrue(guard.add("com.example.B"));

        assertTrue(guard.contains("com.example.A"));
        assertFalse(guard.contains("com.example.C"));
        assertEquals(2, guard.size());
    }

    @Test
    void add_ShouldUseEqualityOfIdentities() {
        CycleGuard guard = new CycleGuard();

        guard.add(new String("java.util.List<java.lang.String>"));

        assertFalse(guard.add("java.util.List<java.lang.String>"));
    }
}
