package com.barometer.core.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OutputConfig {

    @Bean
    public Emitter statusEmitter(ObjectMapper objectMapper) {
        return JsonLineEmitter.stdout(objectMapper);
    }
}
