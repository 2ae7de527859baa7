package com.quantdesk.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI quantdeskOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Quantdesk Indicator API")
                        .description("Indicator catalog, dependency graph and dataset application")
                        .version("1.0"));
    }
}
