package com.phillippitts.granupose.domain.osc;

/**
 * Aggregate outcome of a batch send. Items that failed for other reasons (not ready,
 * invalid) count toward {@code total} only.
 */
public record BatchSendResult(int total, int sentCount, int droppedCount) {
}
