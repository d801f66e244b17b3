package com.genads.api.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoJob {
    private String id;
    private String ownerEmail;          // soft reference to users.email
    private String projectId;           // soft reference to projects.id, never populated yet
    private String projectName;
    private String brandName;
    private String brandDetail;

    private String creativePrompt;
    private String targetAudience;
    private String videoStyle;
    private String aspectRatio;         // AspectRatio code, e.g. "16:9"
    private Integer durationSeconds;    // 5 ~ 120

    private String productImageUrl;
    private String brandLogoUrl;
    private String brandGuidelineUrl;
    private String referenceImageUrl;

    private String status;              // VideoJobStatus code
    private String thumbnailUrl;
    private String videoUrl;
    private String notes;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
