package org.jstats.pitchlens_api.core.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    OpenAPI apiInfo() {
        return new OpenAPI()
                .info(new Info()
                        .title("PitchLens API")
                        .description("Re-express football event and tracking datasets in any coordinate system "
                                + "and orientation, and annotate them with running match state.")
                        .version("v1")
                        .license(new License().name("Apache 2.0")));
    }
}
