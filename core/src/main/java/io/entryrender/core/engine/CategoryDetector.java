package io.entryrender.core.engine;

import io.entryrender.core.model.NodeKind;
import io.entryrender.core.model.SourceNode;
import io.entryrender.core.model.SourceTree;
import java.util.Optional;

/**
 * Finds the grammatical category shared by all senses of an entry, so it can be shown once at
 * entry level instead of under every sense.
 */
final class CategoryDetector {

    private CategoryDetector() {
        // utility class
    }

    /**
     * Returns the category value when the entry has at least one sense and every sense carries
     * the same {@code grammatical-info} value (compared case-insensitively).
     */
    static Optional<String> detect(SourceTree tree) {
        SourceNode root = tree.root();
        if (root.kind() != NodeKind.ENTRY) {
            return Optional.empty();
        }
        String shared = null;
        for (SourceNode child : root.children()) {
            if (!"sense".equals(child.tag())) {
                continue;
            }
            SourceNode info = child.firstChild("grammatical-info");
            String value = info != null ? info.nonBlankAttribute("value") : null;
            if (value == null) {
                return Optional.empty();
            }
            if (shared == null) {
                shared = value;
            } else if (!shared.equalsIgnoreCase(value)) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(shared);
    }
}
