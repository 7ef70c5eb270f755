package com.ryuqq.workflow.core.spi;

import java.util.function.Supplier;

/**
 * Scoped unit of work wrapping a whole transition run.
 *
 * <p>Implementations guarantee that either all persistence effects of {@code work}
 * commit or none do (e.g. a database transaction). In-memory side effects of hooks
 * are not covered by this guarantee.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * UnitOfWork jdbc = new UnitOfWork() {
 *     public &lt;R&gt; R execute(Supplier&lt;R&gt; work) {
 *         return transactionTemplate.execute(status -&gt; work.get());
 *     }
 * };
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public interface UnitOfWork {

    /**
     * Executes {@code work} atomically with respect to storage.
     *
     * @param work the transition run
     * @param <R> result type
     * @return the result of {@code work}
     * @throws RuntimeException whatever {@code work} throws, after rolling back
     */
    <R> R execute(Supplier<R> work);
}
