package com.transittracker.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation, served at /swagger-ui.html and /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI transitOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Real-Time Transit API")
                        .description("Live bus and train positions with proximity alerts.\n\n" +
                                "## Features\n\n" +
                                "- **Shared feed cache** - one upstream call per feed per TTL, however many clients poll\n" +
                                "- **Graceful degradation** - the `source` field reports live, partial, error or mock\n" +
                                "- **Geofence alerts** - priority-ordered zones near a location\n" +
                                "- **WebSocket streaming** - vehicle broadcast and per-client alerts over STOMP\n\n" +
                                "## WebSocket Endpoints\n\n" +
                                "Connect to WebSocket at: `ws://localhost:8080/ws/transit`\n\n" +
                                "- `/app/location` - Send a location update\n" +
                                "- `/app/ping` - Health check\n" +
                                "- `/topic/vehicles` - Receive vehicle positions\n" +
                                "- `/user/queue/alerts` - Receive geofence alerts")
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
