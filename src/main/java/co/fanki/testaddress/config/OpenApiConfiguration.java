package co.fanki.testaddress.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI description of the address endpoints.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Describes the API.
     *
     * @return the OpenAPI description
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Test Address Resolver API")
                        .description("""
                                Resolves test specifiers into canonical test addresses.

                                A specifier has the form `location[:callable]`, where the
                                location is a source path or a dotted module name. The
                                address is the (file, module, callable) triple used to
                                report, rerun and deduplicate tests.
                                """)
                        .version("0.0.1")
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local")));
    }

}
