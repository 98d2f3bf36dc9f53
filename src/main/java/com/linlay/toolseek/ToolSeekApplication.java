package com.linlay.toolseek;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ToolSeekApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolSeekApplication.class, args);
    }
}
