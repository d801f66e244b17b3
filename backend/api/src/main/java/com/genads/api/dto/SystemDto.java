package com.genads.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

public class SystemDto {

    @Getter
    @AllArgsConstructor
    public static class Health {
        private String message;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DatabaseReport {
        private String backend;
        private String database;
        private String databaseUrl;
        private String databaseName;
        private String connectionStatus;
        private List<String> collections;
    }

    @Getter
    @AllArgsConstructor
    public static class UploadResponse {
        private String url;
    }
}
