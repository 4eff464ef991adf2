package com.hrflow.onboarding.config;

import com.hrflow.onboarding.template.TemplateProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TemplateProperties.class)
public class EngineConfig {

    /** Every timestamp and due-date comparison reads this clock; tests swap in a fixed one. */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
