package com.genads.api.controller;

import com.genads.api.dto.SystemDto;
import com.genads.api.service.SystemDiagnosticService;
import com.genads.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "System", description = "Health and diagnostics")
public class SystemController {

    private final SystemDiagnosticService systemDiagnosticService;

    @GetMapping("/")
    @Operation(summary = "Health check")
    public ApiResponse<SystemDto.Health> health() {
        return ApiResponse.success(new SystemDto.Health("GenAds Backend Running"));
    }

    @GetMapping("/test")
    @Operation(summary = "Database diagnostic", description = "Reports store connectivity and collections. Never fails.")
    public ApiResponse<SystemDto.DatabaseReport> testDatabase() {
        return ApiResponse.success(systemDiagnosticService.inspect());
    }
}
