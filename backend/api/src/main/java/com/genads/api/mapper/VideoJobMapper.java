package com.genads.api.mapper;

import com.genads.api.entity.VideoJob;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Mapper
public interface VideoJobMapper {

    int insert(VideoJob videoJob);

    Optional<VideoJob> findById(@Param("id") String id);

    /**
     * Newest first by created_at.
     */
    List<VideoJob> findLatestByOwnerEmail(@Param("ownerEmail") String ownerEmail, @Param("limit") int limit);

    long countByOwnerEmail(@Param("ownerEmail") String ownerEmail);

    long countByOwnerEmailAndStatusIn(@Param("ownerEmail") String ownerEmail,
                                      @Param("statuses") List<String> statuses);

    /**
     * @return updated row count (0 if the id matches no job)
     */
    int updateStatus(@Param("id") String id,
                     @Param("status") String status,
                     @Param("updatedAt") LocalDateTime updatedAt);
}
