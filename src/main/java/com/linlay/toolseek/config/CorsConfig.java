package com.linlay.toolseek.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class CorsConfig {

    @Bean
    public CorsWebFilter corsWebFilter(CorsProperties properties) {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOriginPatterns(compact(properties.getAllowedOriginPatterns()));
        configuration.setAllowedMethods(compact(properties.getAllowedMethods()));
        configuration.setAllowedHeaders(compact(properties.getAllowedHeaders()));
        // SSE 客户端需要读取 Content-Type 判断是否为事件流
        configuration.setExposedHeaders(List.of("Content-Type"));
        configuration.setAllowCredentials(false);
        configuration.setMaxAge(properties.getMaxAgeSeconds());

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration(properties.getPathPattern(), configuration);
        return new CorsWebFilter(source);
    }

    private List<String> compact(List<String> input) {
        List<String> output = new ArrayList<>();
        if (input == null) {
            return output;
        }
        for (String item : input) {
            if (item != null && !item.isBlank()) {
                output.add(item.trim());
            }
        }
        return output;
    }
}
