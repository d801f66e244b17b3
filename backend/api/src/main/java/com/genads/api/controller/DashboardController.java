package com.genads.api.controller;

import com.genads.api.dto.DashboardDto;
import com.genads.api.service.DashboardService;
import com.genads.api.validation.AccountEmail;
import com.genads.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/dashboard")
@Tag(name = "Dashboard", description = "Per-owner job overview")
public class DashboardController {

    private final DashboardService dashboardService;

    @GetMapping("/summary")
    @Operation(summary = "Dashboard summary", description = "Job totals and the 20 most recent jobs for an owner.")
    public ApiResponse<DashboardDto.Summary> summary(@RequestParam @AccountEmail String email) {
        return ApiResponse.success(dashboardService.summary(email));
    }
}
