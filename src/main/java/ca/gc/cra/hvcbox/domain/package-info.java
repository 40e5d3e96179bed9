/**
 * Core domain model for HVCBOX: box framing, stream primitives, and the HEVC sample description records.
 * <p><strong>Role:</strong> Domain layer without CLI or configuration dependencies; logs through SLF4J only.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; stream wrappers are single-owner.</p>
 */
package ca.gc.cra.hvcbox.domain;
