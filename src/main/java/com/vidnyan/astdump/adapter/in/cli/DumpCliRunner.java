package com.vidnyan.astdump.adapter.in.cli;

import com.vidnyan.astdump.application.port.in.DumpSyntaxTreeUseCase;
import com.vidnyan.astdump.application.port.in.DumpSyntaxTreeUseCase.DumpRequest;
import com.vidnyan.astdump.application.port.in.DumpSyntaxTreeUseCase.DumpResult;
import com.vidnyan.astdump.application.port.out.ParseFailureException;
import com.vidnyan.astdump.domain.printer.DumpException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI runner: {@code ast-dump <file>}.
 * The dump goes to stdout, a single error line to stderr on failure.
 */
@Slf4j
@Component
public class DumpCliRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final DumpSyntaxTreeUseCase dumpSyntaxTreeUseCase;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_OK;

    @Autowired
    public DumpCliRunner(DumpSyntaxTreeUseCase dumpSyntaxTreeUseCase) {
        this(dumpSyntaxTreeUseCase, System.out, System.err);
    }

    DumpCliRunner(DumpSyntaxTreeUseCase dumpSyntaxTreeUseCase, PrintStream out, PrintStream err) {
        this.dumpSyntaxTreeUseCase = dumpSyntaxTreeUseCase;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> files = args.getNonOptionArgs();
        if (files.size() != 1) {
            err.println("Usage: ast-dump <file>");
            exitCode = EXIT_USAGE;
            return;
        }
        exitCode = dump(Path.of(files.get(0)));
    }

    int dump(Path file) {
        try {
            DumpResult result = dumpSyntaxTreeUseCase.dump(DumpRequest.forPath(file), out);
            out.flush();
            log.debug("{} nodes parsed, {} lines written", result.nodesParsed(), result.linesWritten());
            return EXIT_OK;
        } catch (ParseFailureException e) {
            err.println("Could not parse '" + file + "': " + e.getMessage());
            return EXIT_FAILURE;
        } catch (DumpException e) {
            err.println("Could not dump '" + file + "': " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
