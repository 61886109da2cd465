package tech.yump.gateway.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        // The gateway does not authenticate callers, so no security scheme is declared.
        return new OpenAPI()
                .info(new Info()
                        .title("Secrets Gateway API")
                        .version("2.0.0")
                        .description("Static key/value secrets and cached dynamic database credentials served from HashiCorp Vault."));
    }
}
