package com.example.cliporganizer.infrastructure.persistence.mapper;

import com.example.cliporganizer.infrastructure.persistence.entity.ClipTagRow;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ClipTagMapper {

    @Select("SELECT ct.clip_id, t.id AS tag_id, t.category, t.tag_value "
            + "FROM clip_tag ct "
            + "JOIN tag t ON t.id = ct.tag_id "
            + "JOIN clip c ON c.id = ct.clip_id "
            + "WHERE c.storage_type = #{storageType} "
            + "ORDER BY ct.clip_id, t.category, t.tag_value")
    List<ClipTagRow> selectByStorageType(@Param("storageType") String storageType);

    @Select("SELECT ct.clip_id, t.id AS tag_id, t.category, t.tag_value "
            + "FROM clip_tag ct JOIN tag t ON t.id = ct.tag_id "
            + "WHERE ct.clip_id = #{clipId} "
            + "ORDER BY t.category, t.tag_value")
    List<ClipTagRow> selectByClipId(@Param("clipId") Long clipId);

    @Delete("DELETE FROM clip_tag WHERE clip_id = #{clipId}")
    int deleteByClipId(@Param("clipId") Long clipId);
}
