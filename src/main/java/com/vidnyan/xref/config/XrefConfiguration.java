package com.vidnyan.xref.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.xref.XrefProperties;
import com.vidnyan.xref.domain.convert.CstConverter;
import com.vidnyan.xref.domain.cst.Symbol;
import com.vidnyan.xref.domain.cst.TreeBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Spring configuration for the converter components.
 * The domain classes carry no Spring annotations, so they are wired here.
 */
@Slf4j
@Configuration
public class XrefConfiguration {

    /**
     * ObjectMapper for the cooked AST dump.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public TreeBuilder treeBuilder(XrefProperties properties) {
        Set<Symbol> collapsible = EnumSet.noneOf(Symbol.class);
        for (String name : properties.getParser().getCollapsibleSymbols()) {
            Symbol symbol = Symbol.forGrammarName(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown grammar symbol: " + name));
            collapsible.add(symbol);
        }
        log.info("Tree builder collapses {} symbols", collapsible.size());
        return new TreeBuilder(collapsible);
    }

    @Bean
    public CstConverter cstConverter() {
        return new CstConverter();
    }
}
