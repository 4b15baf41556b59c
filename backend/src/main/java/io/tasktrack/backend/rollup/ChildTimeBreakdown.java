package io.tasktrack.backend.rollup;

import io.tasktrack.backend.timeentry.EntityType;
import java.util.UUID;

/** Rolled-up time of one descendant in a summary. {@code parentId} locates it in the tree. */
public record ChildTimeBreakdown(
    UUID id, EntityType entityType, UUID parentId, String label, long directUs, long totalUs) {}
