package com.questrail.dxf.observability;

import java.util.Objects;

/**
 * A soft consistency problem. Parsing or writing continues.
 *
 * @param kind       the category of the warning
 * @param recordKind the record or section the warning concerns
 * @param message    human-readable detail
 */
public record DxfWarningEvent(Kind kind, String recordKind, String message) {
    public DxfWarningEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(recordKind, "recordKind");
        Objects.requireNonNull(message, "message");
    }

    public enum Kind {
        /** A declared count disagrees with the number of items actually read. */
        COUNT_MISMATCH,
        /** A record lacks the field it is keyed by and was dropped. */
        MISSING_NAME,
        /** A group code outside every typed range was read or written as text. */
        UNDEFINED_VALUE_TYPE,
        /** A top-level section was not recognized and its content was dropped. */
        SKIPPED_SECTION,
        /** No codec is registered for an entity kind. */
        UNSUPPORTED_ENTITY,
        /** A symbol table kind is not supported and was skipped. */
        UNSUPPORTED_TABLE,
        /** A nested structure or section ended without its closing marker. */
        UNTERMINATED_STRUCTURE,
        /** A group appeared outside of any section or where a marker was expected. */
        STRAY_GROUP
    }
}
