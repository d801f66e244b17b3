package com.genads.api.controller;

import com.genads.api.dto.VideoJobDto;
import com.genads.api.service.VideoJobService;
import com.genads.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/video")
@Tag(name = "Video", description = "Video ad jobs")
public class VideoJobController {

    private final VideoJobService videoJobService;

    @PostMapping("/create")
    @Operation(summary = "Create video job", description = "Records a job from the create-video wizard with status processing.")
    public ApiResponse<VideoJobDto.StatusResponse> create(@Valid @RequestBody VideoJobDto.CreateRequest request) {
        log.info("[VideoJob] Create - owner: {}, project: {}", request.getOwnerEmail(), request.getProjectName());
        return ApiResponse.success("Video job created", videoJobService.create(request));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get video job")
    public ApiResponse<VideoJobDto.Detail> get(@PathVariable String jobId) {
        return ApiResponse.success(videoJobService.get(jobId));
    }

    @PostMapping("/{jobId}/finalize")
    @Operation(summary = "Finalize video job", description = "Marks the job finalized. Safe to repeat.")
    public ApiResponse<VideoJobDto.StatusResponse> finalizeJob(@PathVariable String jobId) {
        log.info("[VideoJob] Finalize - id: {}", jobId);
        return ApiResponse.success("Video job finalized", videoJobService.finalizeJob(jobId));
    }
}
