package com.vidnyan.astdump.application.service;

import com.vidnyan.astdump.DumpProperties;
import com.vidnyan.astdump.application.port.in.DumpSyntaxTreeUseCase;
import com.vidnyan.astdump.application.port.out.ParseFailureException;
import com.vidnyan.astdump.application.port.out.SourceCodeParser;
import com.vidnyan.astdump.domain.printer.DumpException;
import com.vidnyan.astdump.domain.printer.TreePrinter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Orchestrates parse and dump for a single file.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DumpApplicationService implements DumpSyntaxTreeUseCase {

    private final SourceCodeParser sourceCodeParser;
    private final TreePrinter treePrinter;
    private final DumpProperties properties;

    @Override
    public DumpResult dump(DumpRequest request, Appendable out) throws ParseFailureException, DumpException {
        Instant startTime = Instant.now();
        log.debug("Dumping syntax tree of: {}", request.file());

        SourceCodeParser.ParsingResult parsingResult = sourceCodeParser.parse(
                request.file(),
                new SourceCodeParser.ParsingOptions(
                        properties.isResolveSymbols(),
                        properties.isIncludeComments(),
                        properties.getSourceRoots().stream().map(Path::of).toList()
                )
        );
        log.debug("Parsed {} nodes ({} foreign, {} definitions resolved) in {}ms",
                parsingResult.stats().nodesConverted(),
                parsingResult.stats().foreignNodes(),
                parsingResult.stats().definitionsResolved(),
                parsingResult.stats().durationMs());

        // Render fully before touching the sink
        StringBuilder buffer = new StringBuilder();
        int lines = treePrinter.dump(parsingResult.root(), buffer);
        try {
            out.append(buffer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write dump of " + request.file(), e);
        }

        long duration = Duration.between(startTime, Instant.now()).toMillis();
        log.debug("Dumped {} lines from {} in {}ms", lines, request.file(), duration);

        return new DumpResult(request.file(), lines, parsingResult.stats().nodesConverted(), duration);
    }
}
