package com.genads.api.mapper;

import com.genads.api.entity.Project;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface ProjectMapper {

    int insert(Project project);

    Optional<Project> findById(@Param("id") String id);

    List<Project> findByOwnerEmail(@Param("ownerEmail") String ownerEmail);
}
