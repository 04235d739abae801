package co.fanki.archgraph.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI configuration for the Architecture Graph service.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Architecture Graph API")
                        .description("""
                                Builds a size-bounded import dependency graph of a hosted
                                repository for visualization.

                                ## Languages
                                Python, JavaScript/TypeScript, Go, Java, C#, PHP and Ruby,
                                matched heuristically from source text.

                                ## Caching
                                Graphs are cached per repository, default-branch commit
                                and file cap; a new commit always triggers a rebuild.
                                """)
                        .version("0.0.1"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
