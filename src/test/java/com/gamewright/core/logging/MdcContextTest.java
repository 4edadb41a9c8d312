package com.gamewright.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRequest puts requestId and projectName in MDC")
    void setRequest() {
        MdcContext.setRequest("req-1", "Chemistry");
        assertEquals("req-1", MDC.get("requestId"));
        assertEquals("Chemistry", MDC.get("projectName"));
    }

    @Test
    @DisplayName("setGeneration adds taskKind and provider")
    void setGeneration() {
        MdcContext.setGeneration("req-2", "Physics", "spec", "anthropic");
        assertEquals("req-2", MDC.get("requestId"));
        assertEquals("Physics", MDC.get("projectName"));
        assertEquals("spec", MDC.get("taskKind"));
        assertEquals("anthropic", MDC.get("provider"));
    }

    @Test
    @DisplayName("clear removes all Gamewright keys and leaves others alone")
    void clear() {
        MDC.put("other", "kept");
        MdcContext.setGeneration("req-3", "Biology", "game", "google-files");
        MdcContext.clear();

        assertNull(MDC.get("requestId"));
        assertNull(MDC.get("projectName"));
        assertNull(MDC.get("taskKind"));
        assertNull(MDC.get("provider"));
        assertEquals("kept", MDC.get("other"));
        MDC.remove("other");
    }
}
