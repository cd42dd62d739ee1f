package com.realestate.compatibility.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.Arrays;
import java.util.List;

@Configuration
public class WebConfig {

    @Value("${spring.mvc.cors.allowed-origins:*}")
    private String allowedOrigins;

    @Bean
    public CorsFilter corsFilter() {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();

        // Stored audits are GET, submitted ones POST; report downloads name their file in Content-Disposition
        CorsConfiguration audits = baseConfiguration(List.of("GET", "POST", "OPTIONS"));
        audits.addExposedHeader(HttpHeaders.CONTENT_DISPOSITION);
        source.registerCorsConfiguration("/api/compatibility/**", audits);

        source.registerCorsConfiguration("/api/runs/**", baseConfiguration(List.of("GET", "OPTIONS")));
        return new CorsFilter(source);
    }

    CorsConfiguration baseConfiguration(List<String> methods) {
        CorsConfiguration config = new CorsConfiguration();
        if (allowedOrigins.contains("*")) {
            config.addAllowedOriginPattern("*");
        } else {
            Arrays.stream(allowedOrigins.split(","))
                    .map(String::trim)
                    .filter(origin -> !origin.isEmpty())
                    .forEach(config::addAllowedOrigin);
        }
        config.setAllowedMethods(methods);
        config.addAllowedHeader("*");
        config.setAllowCredentials(false);
        config.setMaxAge(3600L);
        return config;
    }
}
