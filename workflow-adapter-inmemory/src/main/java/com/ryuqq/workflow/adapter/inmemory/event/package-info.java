/**
 * Event manager adapters.
 *
 * <p>Reference implementations of the {@link com.ryuqq.workflow.core.spi.EventManager} SPI.
 * Event managers receive one {@link com.ryuqq.workflow.core.model.TransitionRecord} per
 * committed transition, after persistence and audit logging.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.workflow.adapter.inmemory.event.InMemoryEventManager}: collects records for assertions</li>
 *   <li>{@link com.ryuqq.workflow.adapter.inmemory.event.LoggingEventManager}: writes records through SLF4J</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>In-Memory Only:</strong> records are lost on process restart</li>
 *   <li><strong>No Delivery Guarantees:</strong> a failing event manager aborts the transition call after the state was persisted</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.adapter.inmemory.event;
