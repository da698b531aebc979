package io.entryrender.core.model;

import java.util.Objects;

/**
 * A parsed entry document: the root node plus the number of nodes in the arena. Node indexes
 * run from 0 (the root) to {@code size - 1}.
 *
 * <p>
 * Built fresh per parse and never shared across render calls.
 */
public record SourceTree(SourceNode root, int size) {

    public SourceTree {
        Objects.requireNonNull(root, "root must not be null");
        if (size < 1) {
            throw new IllegalArgumentException("size must be positive, got: " + size);
        }
    }
}
