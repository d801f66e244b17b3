package com.genads.api.dto;

import com.genads.api.validation.AccountEmail;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

public class AuthDto {

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SignupRequest {
        @NotBlank
        private String name;
        @AccountEmail
        private String email;
        @NotNull
        private String password;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SigninRequest {
        @AccountEmail
        private String email;
        @NotNull
        private String password;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SignupResponse {
        private String id;
        private String name;
        private String email;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SigninResponse {
        private String message;
        private String email;
        private String name;
        private String avatarUrl;
    }
}
