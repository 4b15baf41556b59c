package io.tasktrack.backend.rollup;

import io.tasktrack.backend.timeentry.EntityKey;

/**
 * A task or project placed in a rollup tree. {@code parent} is null for the root and for nodes
 * outside the subtree being summarized.
 */
record RollupNode(EntityKey key, EntityKey parent, String label) {}
