package com.keystone.auth.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger Configuration
 *
 * Accessible at: /swagger-ui.html
 */
@Configuration
public class OpenApiConfig {

    public static final String BEARER_AUTH = "bearerAuth";

    @Value("${server.port:8081}")
    private String serverPort;

    @Bean
    public OpenAPI authServiceOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Keystone Auth Service API")
                .version("1.0.0")
                .description("""
                    Registration, login, token lifecycle and role administration.

                    Protected endpoints expect the access token of a login or refresh response:

                    ```
                    Authorization: Bearer {access_token}
                    ```

                    Errors use one envelope:

                    ```json
                    {
                      "timestamp": "2024-05-01T10:00:00.000",
                      "status": 401,
                      "error": "Unauthorized",
                      "code": "AUTH_001",
                      "message": "Incorrect email or password",
                      "path": "/auth/login",
                      "errorId": "..."
                    }
                    ```
                    """))
            .servers(List.of(new Server()
                .url("http://localhost:" + serverPort)
                .description("Local Development")))
            .components(new Components()
                .addSecuritySchemes(BEARER_AUTH, new SecurityScheme()
                    .type(SecurityScheme.Type.HTTP)
                    .scheme("bearer")
                    .bearerFormat("JWT")
                    .description("Access token issued by /auth/login or /auth/refresh-tokens")));
    }
}
