package com.subwayly.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class OpenApiConfig implements WebMvcConfigurer {

        /**
         * Maps "/docs" to the Swagger UI.
         */
        @Override
        public void addViewControllers(ViewControllerRegistry registry) {
                registry.addRedirectViewController("/docs", "/swagger-ui.html");
                registry.addRedirectViewController("/docs/", "/swagger-ui.html");
        }

        @Bean
        public OpenAPI subwaylyOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title("Subwayly API documentation")
                                                .description(
                                                                "### Subwayly API\n\n" +
                                                                                "Answers questions about the MBTA subway network, sourced from the MBTA v3 API.\n\n"
                                                                                +
                                                                                "#### Key Features:\n" +
                                                                                "- **Lines**: All light and heavy rail lines with stop counts.\n"
                                                                                +
                                                                                "- **Extremes**: Lines with the most and the fewest stops, ties included.\n"
                                                                                +
                                                                                "- **Transfers**: Stops that connect two or more lines.\n"
                                                                                +
                                                                                "- **Routes**: A rail route between two named stops, preferring fewer line changes.\n")
                                                .version("v1.0.0")
                                                .license(new License()
                                                                .name("Apache 2.0")
                                                                .url("http://springdoc.org")))
                                .servers(List.of(
                                                new Server().url("http://localhost:8080")
                                                                .description("Local Development (HTTP)")));
        }
}
