package com.genads.api.service;

import com.genads.api.dto.VideoJobDto;
import com.genads.api.entity.VideoJob;
import com.genads.api.mapper.VideoJobMapper;
import com.genads.api.store.RecordIds;
import com.genads.api.store.RecordStore;
import com.genads.common.enums.AspectRatio;
import com.genads.common.enums.VideoJobStatus;
import com.genads.common.exception.ApiException;
import com.genads.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class VideoJobService {

    private final VideoJobMapper videoJobMapper;
    private final RecordStore recordStore;

    /**
     * Records the job as {@code processing}. Nothing picks it up afterwards.
     */
    public VideoJobDto.StatusResponse create(VideoJobDto.CreateRequest request) {
        AspectRatio aspectRatio = request.getAspectRatio() != null ? request.getAspectRatio() : AspectRatio.DEFAULT;
        int durationSeconds = request.getDurationSeconds() != null
                ? request.getDurationSeconds()
                : VideoJobDto.DEFAULT_DURATION_SECONDS;
        LocalDateTime now = recordStore.now();

        VideoJob job = VideoJob.builder()
                .id(recordStore.newId())
                .ownerEmail(request.getOwnerEmail())
                .projectId(request.getProjectId())
                .projectName(request.getProjectName())
                .brandName(request.getBrandName())
                .brandDetail(request.getBrandDetail() != null ? request.getBrandDetail() : "")
                .creativePrompt(request.getCreativePrompt())
                .targetAudience(request.getTargetAudience())
                .videoStyle(request.getVideoStyle())
                .aspectRatio(aspectRatio.getCode())
                .durationSeconds(durationSeconds)
                .productImageUrl(request.getProductImageUrl())
                .brandLogoUrl(request.getBrandLogoUrl())
                .brandGuidelineUrl(request.getBrandGuidelineUrl())
                .referenceImageUrl(request.getReferenceImageUrl())
                .status(VideoJobStatus.PROCESSING.getCode())
                .createdAt(now)
                .updatedAt(now)
                .build();

        videoJobMapper.insert(job);
        log.info("[VideoJob] Created - id: {}, ratio: {}, duration: {}s",
                job.getId(), job.getAspectRatio(), job.getDurationSeconds());

        return VideoJobDto.StatusResponse.builder()
                .id(job.getId())
                .status(VideoJobStatus.PROCESSING)
                .build();
    }

    public VideoJobDto.Detail get(String jobId) {
        if (!RecordIds.isWellFormed(jobId)) {
            throw new ApiException(ErrorCode.VIDEO_JOB_NOT_FOUND);
        }
        return videoJobMapper.findById(RecordIds.normalize(jobId))
                .map(VideoJobDto.Detail::from)
                .orElseThrow(() -> new ApiException(ErrorCode.VIDEO_JOB_NOT_FOUND));
    }

    /**
     * Sets the job to {@code finalized}. Repeating the call is harmless, and an
     * id that matches no job still answers {@code finalized}.
     */
    public VideoJobDto.StatusResponse finalizeJob(String jobId) {
        if (!RecordIds.isWellFormed(jobId)) {
            throw new ApiException(ErrorCode.INVALID_VIDEO_JOB_ID);
        }
        String id = RecordIds.normalize(jobId);

        int updated = videoJobMapper.updateStatus(id, VideoJobStatus.FINALIZED.getCode(), recordStore.now());
        if (updated == 0) {
            log.warn("[VideoJob] Finalize matched no job - id: {}", id);
        } else {
            log.info("[VideoJob] Finalized - id: {}", id);
        }

        return VideoJobDto.StatusResponse.builder()
                .id(id)
                .status(VideoJobStatus.FINALIZED)
                .build();
    }
}
