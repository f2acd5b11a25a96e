package org.jstats.cricketlens_api.modules.match_report.config;

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
                        .title("CricketLens Report API")
                        .description("Turns ball-by-ball cricket match records into statistical match reports.")
                        .version("v1")
                        .license(new License().name("Apache 2.0")));
    }
}
