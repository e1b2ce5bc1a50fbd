package org.jstats.pitchlens_api.core.config;

import org.jstats.pitchlens_api.modules.state.StateBuilderRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PitchLensProperties.class)
public class PitchLensConfig {

    // Fixed table of the built-in builders; callers wanting others build their own registry.
    @Bean
    StateBuilderRegistry stateBuilderRegistry() {
        return StateBuilderRegistry.defaults();
    }
}
