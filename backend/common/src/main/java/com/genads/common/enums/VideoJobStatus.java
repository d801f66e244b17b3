package com.genads.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;

/**
 * Video job state. Jobs start in {@link #PROCESSING}; the only transition
 * performed by the service is to {@link #FINALIZED}.
 */
@Getter
@RequiredArgsConstructor
public enum VideoJobStatus {

    QUEUED("queued", "Waiting in queue"),
    PROCESSING("processing", "Generating"),
    COMPLETED("completed", "Completed"),
    FAILED("failed", "Failed"),
    FINALIZED("finalized", "Finalized by owner");

    /** States counted as "in progress" on the dashboard. */
    public static final List<VideoJobStatus> IN_PROGRESS = List.of(QUEUED, PROCESSING);

    private final String code;
    private final String description;

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static VideoJobStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown video job status: " + code));
    }

    public static List<String> codesOf(List<VideoJobStatus> statuses) {
        return statuses.stream().map(VideoJobStatus::getCode).toList();
    }
}
