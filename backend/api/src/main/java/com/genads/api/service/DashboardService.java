package com.genads.api.service;

import com.genads.api.dto.DashboardDto;
import com.genads.api.dto.VideoJobDto;
import com.genads.api.mapper.VideoJobMapper;
import com.genads.common.enums.VideoJobStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class DashboardService {

    static final int LATEST_LIMIT = 20;

    private final VideoJobMapper videoJobMapper;

    public DashboardDto.Summary summary(String ownerEmail) {
        long total = videoJobMapper.countByOwnerEmail(ownerEmail);
        long processing = videoJobMapper.countByOwnerEmailAndStatusIn(
                ownerEmail, VideoJobStatus.codesOf(VideoJobStatus.IN_PROGRESS));
        List<VideoJobDto.Detail> videos = videoJobMapper.findLatestByOwnerEmail(ownerEmail, LATEST_LIMIT).stream()
                .map(VideoJobDto.Detail::from)
                .toList();

        return DashboardDto.Summary.builder()
                .total(total)
                .processing(processing)
                .videos(videos)
                .build();
    }
}
