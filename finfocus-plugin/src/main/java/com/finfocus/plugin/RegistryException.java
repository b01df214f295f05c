package com.finfocus.plugin;

import com.finfocus.common.infra.Archive;

/**
 * Failure of a registry, release or install operation, classified by
 * {@link Kind} so callers can react without parsing messages.
 */
public class RegistryException extends RuntimeException {

    public enum Kind {
        INVALID_SPECIFIER,
        PLUGIN_NOT_FOUND,
        ALREADY_INSTALLED,
        NOT_INSTALLED,
        LOCK_HELD,
        BINARY_NOT_FOUND,
        RELEASE_NOT_FOUND,
        RATE_LIMITED,
        FETCH_FAILED,
        NO_COMPATIBLE_ASSET,
        UNSUPPORTED_ARCHIVE,
        PATH_TRAVERSAL,
        ENTRY_TOO_LARGE,
        INVALID_BINARY,
        METADATA_NOT_FOUND,
        METADATA_INVALID,
        INVALID_VERSION,
        INVALID_CONSTRAINT,
        INVALID_OPTIONS,
        CANCELLED,
        IO
    }

    private final Kind kind;

    public RegistryException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RegistryException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Classify an archive/binary validation failure.
     */
    public static RegistryException fromArchiveError(Archive.ArchiveError e, String context) {
        Kind kind = switch (e.getReason()) {
            case UNSUPPORTED_FORMAT -> Kind.UNSUPPORTED_ARCHIVE;
            case PATH_TRAVERSAL -> Kind.PATH_TRAVERSAL;
            case ENTRY_TOO_LARGE -> Kind.ENTRY_TOO_LARGE;
            case INVALID_BINARY -> Kind.INVALID_BINARY;
        };
        return new RegistryException(kind, context + ": " + e.getMessage(), e);
    }
}
