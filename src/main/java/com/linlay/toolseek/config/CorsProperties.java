package com.linlay.toolseek.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 原 Python 代理对所有来源放开 CORS，这里保持默认放开但允许按部署收紧。
 */
@ConfigurationProperties(prefix = "toolseek.cors")
public class CorsProperties {

    private String pathPattern = "/v1/**";
    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));
    private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "OPTIONS"));
    private List<String> allowedHeaders = new ArrayList<>(List.of("*"));
    private long maxAgeSeconds = 3600;

    public String getPathPattern() {
        return pathPattern;
    }

    public void setPathPattern(String pathPattern) {
        this.pathPattern = pathPattern;
    }

    public List<String> getAllowedOriginPatterns() {
        return allowedOriginPatterns;
    }

    public void setAllowedOriginPatterns(List<String> allowedOriginPatterns) {
        this.allowedOriginPatterns = allowedOriginPatterns;
    }

    public List<String> getAllowedMethods() {
        return allowedMethods;
    }

    public void setAllowedMethods(List<String> allowedMethods) {
        this.allowedMethods = allowedMethods;
    }

    public List<String> getAllowedHeaders() {
        return allowedHeaders;
    }

    public void setAllowedHeaders(List<String> allowedHeaders) {
        this.allowedHeaders = allowedHeaders;
    }

    public long getMaxAgeSeconds() {
        return maxAgeSeconds;
    }

    public void setMaxAgeSeconds(long maxAgeSeconds) {
        this.maxAgeSeconds = maxAgeSeconds;
    }
}
