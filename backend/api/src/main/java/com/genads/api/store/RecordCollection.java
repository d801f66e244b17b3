package com.genads.api.store;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Record type to table mapping. Mapper XML and schema.sql use these names;
 * {@link RecordStore#missingCollections()} checks the live store against them.
 */
@Getter
@RequiredArgsConstructor
public enum RecordCollection {

    USER("users"),
    PROJECT("projects"),
    VIDEO_JOB("video_jobs");

    private final String tableName;
}
