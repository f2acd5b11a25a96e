package org.jstats.cricketlens_api.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    @Bean
    Jackson2ObjectMapperBuilderCustomizer jacksonCustomizer() {
        return builder -> builder
                // Reject repeated keys in match files
                .featuresToEnable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY)
                // Omit nulls when serializing
                .serializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
