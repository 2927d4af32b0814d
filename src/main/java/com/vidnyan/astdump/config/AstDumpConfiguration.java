package com.vidnyan.astdump.config;

import com.github.javaparser.ParserConfiguration;
import com.vidnyan.astdump.DumpProperties;
import com.vidnyan.astdump.domain.printer.RecursiveTreePrinter;
import com.vidnyan.astdump.domain.printer.TreePrinter;
import com.vidnyan.astdump.domain.printer.WorklistTreePrinter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.Locale;

/**
 * Spring configuration for ast-dump components.
 * Wires the printer variant and validates the front-end settings.
 */
@Slf4j
@Configuration
public class AstDumpConfiguration {

    @Bean
    public TreePrinter treePrinter(DumpProperties properties) {
        TreePrinter printer = switch (properties.getTraversal()) {
            case RECURSIVE -> new RecursiveTreePrinter();
            case WORKLIST -> new WorklistTreePrinter();
        };
        log.debug("Using {} tree printer", properties.getTraversal());
        return printer;
    }

    /**
     * Language level JavaParser is configured with.
     */
    @Bean
    public ParserConfiguration.LanguageLevel languageLevel(DumpProperties properties) {
        String level = properties.getLanguageLevel().trim().toUpperCase(Locale.ROOT);
        try {
            return ParserConfiguration.LanguageLevel.valueOf(level);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown astdump.language-level '" + properties.getLanguageLevel()
                    + "', expected one of " + Arrays.toString(ParserConfiguration.LanguageLevel.values()), e);
        }
    }

    @Bean
    public Charset sourceCharset(DumpProperties properties) {
        return Charset.forName(properties.getCharset());
    }
}
