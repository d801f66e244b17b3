package com.genads.api.controller;

import com.genads.api.dto.SystemDto;
import com.genads.api.service.storage.StorageService;
import com.genads.common.dto.ApiResponse;
import com.genads.common.exception.ApiException;
import com.genads.common.exception.ErrorCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Upload", description = "Asset uploads")
public class UploadController {

    private final StorageService storageService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload file", description = "Stages the file locally and returns the path it is served from.")
    public ApiResponse<SystemDto.UploadResponse> upload(@RequestPart("file") MultipartFile file) {
        String filename = file.getOriginalFilename();
        log.info("[Upload] {} ({} bytes)", filename, file.getSize());

        try (InputStream inputStream = file.getInputStream()) {
            String url = storageService.upload(filename, inputStream);
            return ApiResponse.success(new SystemDto.UploadResponse(url));
        } catch (IOException e) {
            log.error("[Upload] Failed to read upload: {}", filename, e);
            throw new ApiException(ErrorCode.UPLOAD_FAILED, "Failed to read uploaded file", e);
        }
    }
}
