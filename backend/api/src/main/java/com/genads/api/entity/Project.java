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
public class Project {
    private String id;
    private String ownerEmail;     // soft reference to users.email
    private String projectName;
    private String brandName;
    @Builder.Default
    private String brandDetail = "";

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
