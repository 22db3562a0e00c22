package com.openrangelabs.donpetre.mlssync.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration for OpenAPI 3 / Swagger documentation of the MLS sync API.
 *
 * @author OpenRange Labs
 * @version 1.0
 */
@Configuration
public class SwaggerConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    /**
     * Configures the OpenAPI specification for the MLS sync service.
     *
     * @return configured OpenAPI instance
     */
    @Bean
    public OpenAPI mlsSyncOpenAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(serverList())
                .addSecurityItem(new SecurityRequirement().addList("bearerAuth"))
                .components(securityComponents());
    }

    private Info apiInfo() {
        return new Info()
                .title("DonPetre MLS Sync API")
                .description("""
                # DonPetre MLS Sync Service

                Keeps the local property catalog synchronized with upstream MLS providers.

                ## Key Features

                * **Provider Families**: RETS, RESO Web API and custom JSON providers
                * **Sync Runs**: start, stop, resume and abandon runs; progress and error history
                * **Data Quality**: completeness, accuracy and consistency scoring per listing
                * **Duplicate Detection**: fuzzy matching with merge suggestions and resolution
                * **Scheduling**: periodic per-provider syncs with single-flight protection

                ## Security

                Read endpoints require an authenticated user. Starting or controlling syncs,
                scheduler changes and duplicate resolution require the Admin role.
                """)
                .version("1.0.0")
                .contact(new Contact()
                        .name("OpenRange Labs Development Team")
                        .email("dev@openrangelabs.com")
                        .url("https://openrangelabs.com"))
                .license(new License()
                        .name("Proprietary")
                        .url("https://openrangelabs.com/license"));
    }

    private List<Server> serverList() {
        return List.of(
                new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local development server"),
                new Server()
                        .url("https://api.donpetre.com")
                        .description("Production environment")
        );
    }

    private Components securityComponents() {
        return new Components()
                .addSecuritySchemes("bearerAuth", new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT")
                        .description("JWT token obtained from authentication service"));
    }
}
