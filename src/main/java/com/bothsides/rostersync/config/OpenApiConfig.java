package com.bothsides.rostersync.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration for OpenAPI 3 documentation.
 *
 * @author BothSides Platform
 * @version 1.0
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    /**
     * Configures the OpenAPI document for the roster sync engine.
     *
     * @return configured OpenAPI instance
     */
    @Bean
    public OpenAPI rosterSyncOpenAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local development server")))
                .addSecurityItem(new SecurityRequirement().addList("bearerAuth"))
                .components(new Components()
                        .addSecuritySchemes("bearerAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")
                                .description("JWT token obtained from the authentication service")));
    }

    private Info apiInfo() {
        return new Info()
                .title("BothSides Roster Sync Engine API")
                .description("""
                # Roster Sync Engine

                Schedules and tracks roster synchronization jobs against external
                school information systems.

                ## Key Features

                * **Strategies**: full, incremental, real-time (webhook driven) and manual syncs
                * **Admission control**: per-integration requests per minute and per hour
                * **Job tracking**: status polling, cancellation and engine statistics

                ## Security

                Sync endpoints require the ADMIN or USER role. Webhook intake requires the
                INTEGRATION or ADMIN role.
                """)
                .version("1.0.0")
                .contact(new Contact()
                        .name("BothSides Platform Team"));
    }
}
