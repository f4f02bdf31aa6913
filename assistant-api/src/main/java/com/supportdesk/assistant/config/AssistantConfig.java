package com.supportdesk.assistant.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AssistantConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
