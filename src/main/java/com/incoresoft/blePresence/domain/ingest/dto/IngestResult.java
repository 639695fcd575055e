package com.incoresoft.blePresence.domain.ingest.dto;

/**
 * What happened to one report.
 *
 * @param accepted  false when the report was dropped as a whole
 * @param merged    beacon entries written to the registry
 * @param skipped   beacon entries dropped for a missing address
 * @param persisted whether the registry document was saved afterwards
 */
public record IngestResult(boolean accepted, String receiverId, int merged, int skipped,
                           boolean persisted, String message) {

    public static IngestResult rejected(String message) {
        return new IngestResult(false, null, 0, 0, false, message);
    }
}
