package com.brandmetrics.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

        @Value("${server.port:8080}")
        private int serverPort;

        @Bean
        public OpenAPI brandMetricsOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title("Brand Metrics Refresher API")
                                                .description(
                                                                "### Brand Metrics Refresher\n\n" +
                                                                                "Pulls metrics from each brand's own database and caches a JSON snapshot per brand "
                                                                                +
                                                                                "under `metrics:<brand>` so dashboards can read them cheaply.\n\n"
                                                                                +
                                                                                "#### Endpoints:\n" +
                                                                                "- **POST /api/v1/refresh** (or **/qstash**): refresh every configured brand. "
                                                                                +
                                                                                "Send `Authorization: Bearer <token>` when a trigger token is configured.\n"
                                                                                +
                                                                                "- **GET /api/v1/metrics/{brand}**: latest cached snapshot, 204 when there is none.\n"
                                                                                +
                                                                                "- **GET /health**: liveness and configured brands.")
                                                .version("v1.0.0"))
                                .servers(List.of(
                                                new Server().url("http://localhost:" + serverPort)
                                                                .description("Local Development (HTTP)")));
        }
}
