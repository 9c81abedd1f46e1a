package com.example.safespace.config;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Browser access to the API. Every origin is allowed unless {@code cors.allowed-origins} narrows it. */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private final List<String> configuredOrigins;

    public CorsConfig(@Value("${cors.allowed-origins:*}") String rawOrigins) {
        this.configuredOrigins = parseOrigins(rawOrigins);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(configuredOrigins.toArray(String[]::new))
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);
    }

    List<String> getConfiguredOrigins() {
        return configuredOrigins;
    }

    static List<String> parseOrigins(String rawOrigins) {
        if (!StringUtils.hasText(rawOrigins)) {
            return List.of("*");
        }

        List<String> origins = Arrays.stream(rawOrigins.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .collect(Collectors.toList());
        return origins.isEmpty() ? List.of("*") : origins;
    }
}
