package co.fanki.provenance.config;

import co.fanki.provenance.analysis.application.ModuleGraphQueryService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;

/**
 * Configures the MCP stdio server transport for editor and agent
 * integration.
 *
 * <p>When the {@code mcp.server.stdio} property is set to {@code true},
 * this configuration starts an MCP server that communicates via
 * stdin/stdout using the JSON-RPC protocol. The tools expose the module
 * graphs of the current build; modules are analyzed through the REST
 * surface.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "true")
public class McpStdioServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            McpStdioServerConfiguration.class);

    private static final String LIST_MODULES_SCHEMA = """
            {
              "type": "object",
              "properties": {}
            }
            """;

    private static final String GET_MODULE_GRAPH_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "file": {
                  "type": "string",
                  "description": "The module's file path, as analyzed"
                }
              },
              "required": ["file"]
            }
            """;

    private static final String FIND_LITERAL_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "text": {
                  "type": "string",
                  "description": "Text the literal contains, case-insensitive"
                }
              },
              "required": ["text"]
            }
            """;

    private static final String FIND_MUTATIONS_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "root": {
                  "type": "string",
                  "description": "The mutated root identifier, e.g. state"
                }
              },
              "required": ["root"]
            }
            """;

    /**
     * Creates the stdio transport provider for MCP communication.
     *
     * @param objectMapper the Jackson ObjectMapper for JSON serialization
     * @return the stdio server transport provider
     */
    @Bean
    StdioServerTransportProvider stdioServerTransportProvider(
            final ObjectMapper objectMapper) {
        return new StdioServerTransportProvider(objectMapper);
    }

    /**
     * Creates and configures the MCP synchronous server with all tools.
     *
     * @param transportProvider the stdio transport provider
     * @param queryService the service answering module graph queries
     * @param objectMapper the Jackson ObjectMapper for response serialization
     * @return the configured MCP sync server
     */
    @Bean
    McpSyncServer mcpSyncServer(
            final StdioServerTransportProvider transportProvider,
            final ModuleGraphQueryService queryService,
            final ObjectMapper objectMapper) {

        final McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo("source-provenance-server", "0.0.1")
                .capabilities(ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .build();

        server.addTool(tool("list_modules",
                "List the modules analyzed in the current build. Use this"
                        + " first to see which file paths get_module_graph"
                        + " accepts.",
                LIST_MODULES_SCHEMA, objectMapper,
                arguments -> queryService.modules()));

        server.addTool(tool("get_module_graph",
                "Get the module graph of one file: imports, exports,"
                        + " reexports, definitions, mutations and the"
                        + " literal index, each row with its source span.",
                GET_MODULE_GRAPH_SCHEMA, objectMapper,
                arguments -> queryService.graph(
                        (String) arguments.get("file"))));

        server.addTool(tool("find_literal",
                "Find exported string literals containing a text. Use"
                        + " this to locate where a visible label or URL is"
                        + " declared.",
                FIND_LITERAL_SCHEMA, objectMapper,
                arguments -> queryService.findLiteral(
                        (String) arguments.get("text"))));

        server.addTool(tool("find_mutations",
                "Find every assignment, update or mutating call on a root"
                        + " identifier across the analyzed modules.",
                FIND_MUTATIONS_SCHEMA, objectMapper,
                arguments -> queryService.findMutations(
                        (String) arguments.get("root"))));

        LOG.info("MCP stdio server initialized with 4 tools");

        return server;
    }

    /**
     * Keeps the JVM alive while the MCP server is running.
     *
     * @return the command line runner that blocks on a latch
     */
    @Bean
    CommandLineRunner mcpServerRunner() {
        return args -> {
            LOG.info("MCP stdio server is running. Waiting for input...");
            new CountDownLatch(1).await();
        };
    }

    private McpServerFeatures.SyncToolSpecification tool(final String name,
            final String description, final String schema,
            final ObjectMapper objectMapper,
            final Function<Map<String, Object>, Object> query) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool(name, description, schema),
                (exchange, arguments) -> {
                    try {
                        final Object result = query.apply(arguments);
                        return toCallToolResult(objectMapper, result);
                    } catch (final Exception e) {
                        return errorResult(name, e);
                    }
                }
        );
    }

    private CallToolResult toCallToolResult(final ObjectMapper objectMapper,
            final Object result) {
        try {
            final String json = objectMapper.writeValueAsString(result);
            return new CallToolResult(
                    List.of(new McpSchema.TextContent(json)), false);
        } catch (final Exception e) {
            return errorResult("serialization", e);
        }
    }

    private CallToolResult errorResult(final String toolName,
            final Exception e) {
        LOG.warn("Tool {} failed: {}", toolName, e.getMessage());
        return new CallToolResult(
                List.of(new McpSchema.TextContent(
                        "Error: " + e.getMessage())), true);
    }

}
