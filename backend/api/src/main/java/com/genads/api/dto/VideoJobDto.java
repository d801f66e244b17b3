package com.genads.api.dto;

import com.genads.api.entity.VideoJob;
import com.genads.api.validation.AbsoluteUrl;
import com.genads.api.validation.AccountEmail;
import com.genads.common.enums.AspectRatio;
import com.genads.common.enums.VideoJobStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

public class VideoJobDto {

    public static final int MIN_DURATION_SECONDS = 5;
    public static final int MAX_DURATION_SECONDS = 120;
    public static final int DEFAULT_DURATION_SECONDS = 15;

    /**
     * Final step of the create-video wizard: brand, creative brief and asset links.
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateRequest {
        @AccountEmail
        private String ownerEmail;
        private String projectId;
        @NotNull
        private String projectName;
        @NotNull
        private String brandName;
        private String brandDetail;

        @NotNull
        private String creativePrompt;
        @NotNull
        private String targetAudience;
        @NotNull
        private String videoStyle;
        private AspectRatio aspectRatio;            // null -> 16:9
        @Min(MIN_DURATION_SECONDS)
        @Max(MAX_DURATION_SECONDS)
        private Integer durationSeconds;            // null -> 15

        @AbsoluteUrl
        private String productImageUrl;
        @AbsoluteUrl
        private String brandLogoUrl;
        @AbsoluteUrl
        private String brandGuidelineUrl;
        @AbsoluteUrl
        private String referenceImageUrl;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatusResponse {
        private String id;
        private VideoJobStatus status;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Detail {
        private String id;
        private String ownerEmail;
        private String projectId;
        private String projectName;
        private String brandName;
        private String brandDetail;
        private String creativePrompt;
        private String targetAudience;
        private String videoStyle;
        private String aspectRatio;
        private Integer durationSeconds;
        private String productImageUrl;
        private String brandLogoUrl;
        private String brandGuidelineUrl;
        private String referenceImageUrl;
        private String status;
        private String thumbnailUrl;
        private String videoUrl;
        private String notes;
        private LocalDateTime createdAt;
        private LocalDateTime updatedAt;

        public static Detail from(VideoJob job) {
            return Detail.builder()
                    .id(job.getId())
                    .ownerEmail(job.getOwnerEmail())
                    .projectId(job.getProjectId())
                    .projectName(job.getProjectName())
                    .brandName(job.getBrandName())
                    .brandDetail(job.getBrandDetail())
                    .creativePrompt(job.getCreativePrompt())
                    .targetAudience(job.getTargetAudience())
                    .videoStyle(job.getVideoStyle())
                    .aspectRatio(job.getAspectRatio())
                    .durationSeconds(job.getDurationSeconds())
                    .productImageUrl(job.getProductImageUrl())
                    .brandLogoUrl(job.getBrandLogoUrl())
                    .brandGuidelineUrl(job.getBrandGuidelineUrl())
                    .referenceImageUrl(job.getReferenceImageUrl())
                    .status(job.getStatus())
                    .thumbnailUrl(job.getThumbnailUrl())
                    .videoUrl(job.getVideoUrl())
                    .notes(job.getNotes())
                    .createdAt(job.getCreatedAt())
                    .updatedAt(job.getUpdatedAt())
                    .build();
        }
    }
}
