package tech.yump.rotator.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.rotator.auth.StaticTokenAuthFilter;

@Configuration
public class OpenApiConfig {

    private static final String SECURITY_SCHEME_NAME = "RotatorTokenAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        SecurityScheme apiKeyScheme = new SecurityScheme()
                .name(StaticTokenAuthFilter.TOKEN_HEADER)
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .description("Static API token ('" + StaticTokenAuthFilter.TOKEN_HEADER + "') required when token authentication is enabled.");

        return new OpenAPI()
                .info(new Info()
                        .title("Secret Rotator API")
                        .description("Rotates and creates application secrets in a directory tenant before they expire."))
                .components(new Components().addSecuritySchemes(SECURITY_SCHEME_NAME, apiKeyScheme))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME));
    }
}
