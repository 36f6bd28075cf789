package com.grid.analytics.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI gridAnalyticsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Grid Analytics API")
                        .version("1.0.0")
                        .description(
                                "Batch analysis pipeline for electrical-grid measurements.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Submit measurements via `POST /api/v1/pipeline/runs`\n" +
                                "2. Clean, impute and engineer features (lags, rolling mean, calendar)\n" +
                                "3. In parallel: train demand models, cluster consumption patterns, flag anomalies\n" +
                                "4. Attribute the best model's predictions to features (TreeSHAP)\n" +
                                "5. Publish the run bundle atomically under the artifact directory\n\n" +
                                "**Model families:**\n" +
                                "- `random-forest` (bootstrap, per-split feature sampling)\n" +
                                "- `gradient-boosted-trees` (squared loss, row subsampling)\n\n" +
                                "Both are compared against a 24-step moving-average baseline on a temporal hold-out.")
                        .contact(new Contact().name("Grid Analytics Team")));
    }
}
