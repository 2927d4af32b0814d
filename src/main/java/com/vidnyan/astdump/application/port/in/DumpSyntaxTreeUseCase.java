package com.vidnyan.astdump.application.port.in;

import com.vidnyan.astdump.application.port.out.ParseFailureException;
import com.vidnyan.astdump.domain.printer.DumpException;

import java.nio.file.Path;

/**
 * Primary use case: dump the syntax tree of a source file.
 * This is the main entry point to the application.
 */
public interface DumpSyntaxTreeUseCase {

    /**
     * Parse a file and write its tree dump to {@code out}.
     * Output is all-or-nothing: on failure nothing reaches {@code out}.
     * @param request Dump request parameters
     * @param out Sink receiving the dump
     * @return Dump result with statistics
     */
    DumpResult dump(DumpRequest request, Appendable out) throws ParseFailureException, DumpException;

    /**
     * Dump request parameters.
     */
    record DumpRequest(Path file) {
        public static DumpRequest forPath(Path path) {
            return new DumpRequest(path);
        }
    }

    /**
     * Dump result.
     */
    record DumpResult(
        Path file,
        int linesWritten,
        int nodesParsed,
        long totalDurationMs
    ) {}
}
