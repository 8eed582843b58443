package com.eainde.flowconverter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/**
 * Spring wiring for the converter. Components are picked up by scanning;
 * defaults come from {@code flowconverter.properties}.
 */
@Configuration
@ComponentScan("com.eainde.flowconverter")
@PropertySource("classpath:flowconverter.properties")
public class FlowConverterConfig {

    @Bean
    public ObjectMapper flowObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public ConverterSettings converterSettings(
            @Value("${flowconverter.validate:true}") boolean validate,
            @Value("${flowconverter.bootstrap-input:Test input}") String bootstrapInput,
            @Value("${flowconverter.state-class-name:GraphState}") String stateClassName) {
        return ConverterSettings.builder()
                .validate(validate)
                .bootstrapInput(bootstrapInput)
                .stateClassName(stateClassName)
                .build();
    }
}
