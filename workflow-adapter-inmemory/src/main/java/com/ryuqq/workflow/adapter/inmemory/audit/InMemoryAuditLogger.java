package com.ryuqq.workflow.adapter.inmemory.audit;

import com.ryuqq.workflow.core.spi.AuditLogger;
import com.ryuqq.workflow.core.spi.Subject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link AuditLogger} SPI for testing and reference purposes.
 *
 * <p>Every call to {@link #log} is appended to an in-memory list as an {@link AuditEntry}.
 * Entries are kept in call order and can be inspected after a transition.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryAuditLogger auditLogger = new InMemoryAuditLogger();
 *
 * WorkflowDefinition&lt;Order&gt; definition = WorkflowDefinition.builder("order", accessor)
 *     .states("draft", "submitted")
 *     .transition(Transition.of("submit", "draft", "submitted"))
 *     .auditLogger(auditLogger)
 *     .config(new WorkflowConfig().withAuditLogging(true))
 *     .build();
 *
 * new Workflow&lt;&gt;(definition, order).run("submit");
 *
 * auditLogger.getEntries();   // [AuditEntry[submit, draft -&gt; submitted]]
 * </pre>
 *
 * <p>Thread-safe through {@link CopyOnWriteArrayList}; intended for small test volumes.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class InMemoryAuditLogger implements AuditLogger {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void log(String transitionName, String fromState, String toState, Subject subject, List<Object> params) {
        entries.add(new AuditEntry(transitionName, fromState, toState, subject, params));
    }

    /**
     * Returns a snapshot of recorded entries in call order.
     *
     * @return immutable copy of entries
     */
    public List<AuditEntry> getEntries() {
        return List.copyOf(entries);
    }

    /**
     * Returns entries recorded for one subject.
     *
     * @param subject the audited subject (identity comparison)
     * @return entries for the subject, in call order
     */
    public List<AuditEntry> getEntriesFor(Subject subject) {
        List<AuditEntry> result = new ArrayList<>();
        for (AuditEntry entry : entries) {
            if (entry.subject() == subject) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * @return number of recorded entries
     */
    public int size() {
        return entries.size();
    }

    /**
     * Clears all entries (for test cleanup).
     */
    public void clear() {
        entries.clear();
    }

    /**
     * One audit record.
     *
     * @param transitionName executed transition
     * @param fromState exact state before the transition
     * @param toState destination state
     * @param subject audited subject
     * @param params transition call arguments
     */
    public record AuditEntry(
        String transitionName,
        String fromState,
        String toState,
        Subject subject,
        List<Object> params
    ) {

        public AuditEntry {
            params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
        }

        @Override
        public String toString() {
            return "AuditEntry[" + transitionName + ", " + fromState + " -> " + toState + "]";
        }
    }
}
