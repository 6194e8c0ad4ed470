package com.example.cliporganizer.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI clipOrganizerOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Clip Organizer API")
                        .description("Video clip catalog and library folder synchronization")
                        .version("v1")
                        .contact(new Contact().name("clip-organizer")));
    }
}
