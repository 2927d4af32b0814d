package com.vidnyan.astdump.application.port.out;

import com.vidnyan.astdump.domain.model.SyntaxNode;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for the parsing front end that turns a source file into a syntax tree.
 * Implemented by adapters (e.g., JavaParser adapter).
 */
public interface SourceCodeParser {

    /**
     * Parse one source file.
     * @param file Source file to parse
     * @param options Parsing options
     * @return Parsing result with the syntax tree root
     * @throws ParseFailureException if the file is missing, unreadable or unparsable
     */
    ParsingResult parse(Path file, ParsingOptions options) throws ParseFailureException;

    /**
     * Parsing options.
     */
    record ParsingOptions(
        boolean resolveSymbols,
        boolean includeComments,
        List<Path> sourceRoots
    ) {
        public static ParsingOptions defaults() {
            return new ParsingOptions(true, false, List.of());
        }
    }

    /**
     * Parsing result.
     */
    record ParsingResult(
        Path file,
        SyntaxNode root,
        ParsingStats stats
    ) {}

    /**
     * Parsing statistics.
     */
    record ParsingStats(
        int nodesConverted,
        int foreignNodes,
        int definitionsResolved,
        long durationMs
    ) {}
}
