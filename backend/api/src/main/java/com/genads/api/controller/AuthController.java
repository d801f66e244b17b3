package com.genads.api.controller;

import com.genads.api.dto.AuthDto;
import com.genads.api.service.AuthService;
import com.genads.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
@Tag(name = "Auth", description = "Signup and signin")
public class AuthController {

    private final AuthService authService;

    @PostMapping("/signup")
    @Operation(summary = "Sign up", description = "Registers a new account. Emails must be unused.")
    public ApiResponse<AuthDto.SignupResponse> signup(@Valid @RequestBody AuthDto.SignupRequest request) {
        log.info("Signup attempt: {}", request.getEmail());
        return ApiResponse.success("Signed up", authService.signup(request));
    }

    @PostMapping("/signin")
    @Operation(summary = "Sign in", description = "Checks email and password.")
    public ApiResponse<AuthDto.SigninResponse> signin(@Valid @RequestBody AuthDto.SigninRequest request) {
        log.info("Signin attempt: {}", request.getEmail());
        return ApiResponse.success("Signed in", authService.signin(request));
    }
}
