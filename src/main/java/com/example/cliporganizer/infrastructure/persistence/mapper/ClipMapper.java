package com.example.cliporganizer.infrastructure.persistence.mapper;

import com.example.cliporganizer.infrastructure.persistence.entity.ClipEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface ClipMapper {

    String COLUMNS = "id, title, description, storage_type, location_string, location_key_md5, "
            + "duration_sec, thumbnail_path, created_at, updated_at";

    @Insert("INSERT INTO clip(title, description, storage_type, location_string, location_key_md5, duration_sec) "
            + "VALUES (#{title}, #{description}, #{storageType}, #{locationString}, #{locationKeyMd5}, #{durationSec})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(ClipEntity entity);

    @Select("SELECT " + COLUMNS + " FROM clip WHERE id = #{id}")
    ClipEntity selectById(@Param("id") Long id);

    @Select("SELECT id FROM clip WHERE location_key_md5 = #{locationKeyMd5}")
    Long selectIdByLocationKeyMd5(@Param("locationKeyMd5") String locationKeyMd5);

    @Select("SELECT " + COLUMNS + " FROM clip WHERE storage_type = #{storageType} ORDER BY id")
    List<ClipEntity> selectByStorageType(@Param("storageType") String storageType);

    @Update("UPDATE clip SET thumbnail_path = #{thumbnailPath}, updated_at = CURRENT_TIMESTAMP WHERE id = #{id}")
    int updateThumbnailPath(@Param("id") Long id, @Param("thumbnailPath") String thumbnailPath);

    @Delete("DELETE FROM clip WHERE id = #{id}")
    int deleteById(@Param("id") Long id);
}
