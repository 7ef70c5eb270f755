package com.ryuqq.workflow.core.engine;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkflowConfig 테스트.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class WorkflowConfigTest {

    @Test
    void defaultConstructor_AuditDisabledWithUtcClock() {
        // When
        WorkflowConfig config = new WorkflowConfig();

        // Then
        assertFalse(config.auditLogging());
        assertEquals(ZoneOffset.UTC, config.clock().getZone());
    }

    @Test
    void withAuditLogging_ReturnsCopy() {
        // Given
        WorkflowConfig config = new WorkflowConfig();

        // When
        WorkflowConfig enabled = config.withAuditLogging(true);

        // Then
        assertTrue(enabled.auditLogging());
        assertFalse(config.auditLogging());
        assertSame(config.clock(), enabled.clock());
    }

    @Test
    void withClock_ReplacesClock() {
        // Given
        Clock fixed = Clock.fixed(Instant.EPOCH, ZoneOffset.UTC);

        // When
        WorkflowConfig config = new WorkflowConfig().withAuditLogging(true).withClock(fixed);

        // Then
        assertSame(fixed, config.clock());
        assertTrue(config.auditLogging());
    }

    @Test
    void constructor_NullClock_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new WorkflowConfig(true, null)
        );
        assertTrue(exception.getMessage().contains("clock cannot be null"));
    }
}
