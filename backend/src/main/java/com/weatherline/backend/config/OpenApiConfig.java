package com.weatherline.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI weatherlineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Weatherline API")
                        .description("Weather-production correlation, parameter recommendations and weather alerts")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Weatherline Team")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development Server")));
    }
}
