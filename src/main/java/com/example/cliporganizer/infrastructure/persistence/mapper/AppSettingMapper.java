package com.example.cliporganizer.infrastructure.persistence.mapper;

import com.example.cliporganizer.infrastructure.persistence.entity.AppSettingEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface AppSettingMapper {

    @Select("SELECT id, setting_key, setting_value, updated_at FROM app_setting WHERE setting_key = #{settingKey}")
    AppSettingEntity selectByKey(@Param("settingKey") String settingKey);

    @Insert("INSERT INTO app_setting(setting_key, setting_value) VALUES (#{settingKey}, #{settingValue})")
    int insert(@Param("settingKey") String settingKey, @Param("settingValue") String settingValue);

    @Update("UPDATE app_setting SET setting_value = #{settingValue}, updated_at = CURRENT_TIMESTAMP "
            + "WHERE setting_key = #{settingKey}")
    int updateValue(@Param("settingKey") String settingKey, @Param("settingValue") String settingValue);
}
