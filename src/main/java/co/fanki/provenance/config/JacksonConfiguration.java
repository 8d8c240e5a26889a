package co.fanki.provenance.config;

import co.fanki.provenance.analysis.domain.babel.BabelAstReader;
import com.fasterxml.jackson.core.StreamReadConstraints;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Lets request bodies carry deeply nested ASTs.
 *
 * <p>Jackson rejects documents nested deeper than 1000 levels by default.
 * Long operator chains and JSX trees of generated modules exceed that, so
 * the limit is raised to the one the AST reader uses.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class JacksonConfiguration {

    /**
     * Raises the read nesting limit of the application object mapper.
     *
     * @return the builder customizer
     */
    @Bean
    Jackson2ObjectMapperBuilderCustomizer astNestingDepthCustomizer() {
        return builder -> builder.postConfigurer(objectMapper ->
                objectMapper.getFactory().setStreamReadConstraints(
                        StreamReadConstraints.builder()
                                .maxNestingDepth(
                                        BabelAstReader.MAX_NESTING_DEPTH)
                                .build()));
    }

}
