package com.bookcatalog.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI catalogOpenAPI(CatalogProperties properties) {
        return new OpenAPI()
            .info(new Info()
                .title(properties.title())
                .description(properties.description())
                .version(properties.version()));
    }
}
