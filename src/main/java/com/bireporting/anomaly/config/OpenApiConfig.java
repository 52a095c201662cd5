package com.bireporting.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI anomalyDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("BI Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Multi-modal anomaly detection for BI query results.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Submit a query result via `POST /anomalies/detect`\n" +
                                "2. Enabled detectors scan the result concurrently\n" +
                                "3. Overlapping findings are merged per (type, column)\n" +
                                "4. Severity is escalated by business context (revenue, deposit columns)\n" +
                                "5. Anomalies are ranked by severity, then confidence\n" +
                                "6. Insights and recommendations are derived; HIGH anomalies raise alerts\n\n" +
                                "**Detectors:**\n" +
                                "- `STATISTICAL` : Z-score and IQR outliers over numeric columns\n" +
                                "- `TEMPORAL` : date/time columns (extension point)\n" +
                                "- `PATTERN` : sequence/frequency patterns (extension point)\n" +
                                "- `BUSINESS_RULE` : configurable row conditions such as `revenue < 0`\n\n" +
                                "Alerts are de-duplicated per (type, column, user) within a cooldown window.")
                        .contact(new Contact().name("BI Reporting Team")));
    }
}
