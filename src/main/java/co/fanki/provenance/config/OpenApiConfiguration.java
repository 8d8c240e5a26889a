package co.fanki.provenance.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Source Provenance Server.
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
                        .title("Source Provenance Server API")
                        .description("""
                                Source Provenance Server - Maps rendered UI elements back to the
                                source spans that produced their data.

                                ## Features
                                - **Provenance**: Trace the data of every JSX element of a module
                                - **Module Graphs**: Imports, exports, definitions, mutations and literals per file
                                - **Module Map**: Export the current build as a JSON module map

                                ## MCP Tools
                                - `list_modules` - List the analyzed modules
                                - `get_module_graph` - Get the graph of a module
                                - `find_literal` - Find exported string literals
                                - `find_mutations` - Find mutations of a root identifier
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
