package com.example.main_image_selection.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({PipelineProperties.class, ScoringProperties.class, SelectorProperties.class})
public class AppPropertiesConfig {
}
