package com.egg.pipeline;

import java.util.List;
import java.util.UUID;

/**
 * One eggbook row proposed by the extraction model.
 *
 * @param kind which eggbook table the entry goes to
 * @param title short text (idea headline, todo text, alert text); may be null for comments
 * @param content longer text (idea detail, comment body); may be null for todos and alerts
 * @param sourceEventIds events the model attributed the entry to, most relevant first
 */
public record ExtractedEntry(Kind kind, String title, String content, List<UUID> sourceEventIds) {

    public ExtractedEntry {
        sourceEventIds = sourceEventIds == null ? List.of() : List.copyOf(sourceEventIds);
    }

    public enum Kind {
        IDEA,
        TODO,
        NOTIFICATION,
        COMMENT
    }
}
