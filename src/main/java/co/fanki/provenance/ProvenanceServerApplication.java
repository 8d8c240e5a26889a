package co.fanki.provenance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Source Provenance Server Application.
 *
 * <p>This is the main entry point for the Source Provenance Server, which
 * lets a visual source editor map a rendered UI element back to the source
 * spans that produced its data. Hosts post the Babel AST of each module;
 * the server traces JSX elements, keeps the module graphs of the current
 * build and answers queries over them via REST and MCP tools.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class ProvenanceServerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(ProvenanceServerApplication.class, args);
    }

}
