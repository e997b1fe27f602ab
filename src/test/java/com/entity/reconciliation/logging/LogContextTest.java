package com.entity.reconciliation.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forQuery should set correlationId, entityType, and operation in MDC")
    void forQuerySetsMDC() {
        try (LogContext ctx = LogContext.forQuery("q0", "person")) {
            assertEquals("q0", MDC.get("correlationId"));
            assertEquals("person", MDC.get("entityType"));
            assertEquals("query", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forPrefix should set prefix, operation and a generated correlationId")
    void forPrefixSetsMDC() {
        try (LogContext ctx = LogContext.forPrefix("Doug")) {
            assertEquals("Doug", MDC.get("prefix"));
            assertEquals("prefix", MDC.get("operation"));
            assertNotNull(MDC.get("correlationId"));
        }
    }

    @Test
    @DisplayName("forLookup should set entityId and operation in MDC")
    void forLookupSetsMDC() {
        try (LogContext ctx = LogContext.forLookup("person:q42")) {
            assertEquals("person:q42", MDC.get("entityId"));
            assertEquals("lookup", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forLoad should set location and operation in MDC")
    void forLoadSetsMDC() {
        try (LogContext ctx = LogContext.forLoad("/data/people.sqlite")) {
            assertEquals("/data/people.sqlite", MDC.get("location"));
            assertEquals("load", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("close should remove all keys that were added")
    void closeRemovesKeys() {
        LogContext ctx = LogContext.forQuery("q0", "person").with("backend", "sqlite");
        assertEquals("sqlite", MDC.get("backend"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("entityType"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("backend"));
    }

    @Test
    @DisplayName("close should leave keys set outside the context alone")
    void closeKeepsForeignKeys() {
        MDC.put("requestPath", "/reconcile");

        try (LogContext ctx = LogContext.forLookup("person:q42")) {
            assertEquals("/reconcile", MDC.get("requestPath"));
        }

        assertEquals("/reconcile", MDC.get("requestPath"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique values")
    void generateCorrelationIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
