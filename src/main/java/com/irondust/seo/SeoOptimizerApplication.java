package com.irondust.seo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SeoOptimizerApplication {
    public static void main(String[] args) {
        SpringApplication.run(SeoOptimizerApplication.class, args);
    }
}
