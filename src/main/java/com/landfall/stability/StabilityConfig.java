package com.landfall.stability;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StabilityConfig {

    @Bean
    public StabilityClassifier stabilityClassifier(StabilityProperties properties) {
        return properties.getKinds().isEmpty()
                ? StabilityClassifier.defaults()
                : StabilityClassifier.withKinds(properties.getKinds());
    }
}
