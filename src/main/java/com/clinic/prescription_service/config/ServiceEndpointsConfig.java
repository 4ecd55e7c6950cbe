package com.clinic.prescription_service.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Locations and timeouts of the collaborating services, bound from {@code services.*}.
 */
@ConfigurationProperties(prefix = "services")
@Data
public class ServiceEndpointsConfig {
    private Endpoint appointment = new Endpoint("http://localhost:8004", Duration.ofSeconds(10));
    private Endpoint notification = new Endpoint("http://localhost:8007", Duration.ofSeconds(5));

    @Data
    public static class Endpoint {
        private String baseUrl;
        private Duration timeout;

        public Endpoint() {
        }

        public Endpoint(String baseUrl, Duration timeout) {
            this.baseUrl = baseUrl;
            this.timeout = timeout;
        }
    }
}
