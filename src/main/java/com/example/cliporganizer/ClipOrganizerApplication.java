package com.example.cliporganizer;

import com.example.cliporganizer.common.config.AppSyncProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@MapperScan("com.example.cliporganizer.infrastructure.persistence.mapper")
@EnableConfigurationProperties({
        AppSyncProperties.class
})
public class ClipOrganizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClipOrganizerApplication.class, args);
    }
}
