package dev.catananti.passwordlab.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Password Security Lab API")
                        .description("""
                                Educational API for password strength analysis.

                                ## Features
                                - Strength scoring with entropy and pattern detection
                                - Crack-time estimates for five storage schemes
                                - Actionable suggestions and stronger variants
                                - Secure random password generation
                                - Demonstration hashes (MD5, SHA256, bcrypt, Argon2)

                                Submitted passwords are never stored or logged.
                                """)
                        .version(appVersion)
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Development Server")));
    }
}
