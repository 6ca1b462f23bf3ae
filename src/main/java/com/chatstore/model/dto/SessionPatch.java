package com.chatstore.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Optional;

/**
 * Partial update of a chat session.
 *
 * A null field is left untouched. Metadata is merged into the stored map
 * (shallow union, supplied keys win) instead of replacing it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionPatch {

    private String currentPage;

    private Map<String, Object> metadata;

    public boolean isEmpty() {
        return currentPage == null && metadata == null;
    }

    /**
     * The statement variant this patch compiles to, or empty when there is nothing to update.
     */
    public Optional<Kind> kind() {
        if (currentPage != null && metadata != null) {
            return Optional.of(Kind.PAGE_AND_METADATA);
        }
        if (currentPage != null) {
            return Optional.of(Kind.PAGE);
        }
        if (metadata != null) {
            return Optional.of(Kind.METADATA);
        }
        return Optional.empty();
    }

    public enum Kind {
        PAGE,
        METADATA,
        PAGE_AND_METADATA;

        public boolean touchesPage() {
            return this != METADATA;
        }

        public boolean touchesMetadata() {
            return this != PAGE;
        }
    }
}
