package com.vidnyan.astdump.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import com.vidnyan.astdump.application.port.out.ParseFailureException;
import com.vidnyan.astdump.application.port.out.SourceCodeParser;
import com.vidnyan.astdump.domain.model.SyntaxNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JavaParser front end. Parses one file, optionally with the symbol solver
 * attached, and converts the result into the syntax tree model.
 */
@Slf4j
@Component
public class JavaParserAdapter implements SourceCodeParser {

    private final ParserConfiguration.LanguageLevel languageLevel;
    private final Charset charset;

    public JavaParserAdapter(ParserConfiguration.LanguageLevel languageLevel, Charset charset) {
        this.languageLevel = languageLevel;
        this.charset = charset;
    }

    @Override
    public ParsingResult parse(Path file, ParsingOptions options) throws ParseFailureException {
        long startTime = System.currentTimeMillis();
        log.debug("Parsing {} (symbols: {}, comments: {})",
                file, options.resolveSymbols(), options.includeComments());

        String sourceCode;
        try {
            sourceCode = Files.readString(file, charset);
        } catch (IOException e) {
            throw ParseFailureException.unreadable(file, e);
        }

        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(languageLevel)
                .setAttributeComments(options.includeComments())
                .setCharacterEncoding(charset);
        if (options.resolveSymbols()) {
            config.setSymbolResolver(new JavaSymbolSolver(typeSolverFor(file, options)));
        }

        ParseResult<CompilationUnit> parseResult = new JavaParser(config).parse(sourceCode);
        if (!parseResult.isSuccessful() || parseResult.getResult().isEmpty()) {
            throw ParseFailureException.unparsable(file, describe(parseResult));
        }

        CompilationUnit cu = parseResult.getResult().get();
        SyntaxTreeBuilder builder = new SyntaxTreeBuilder(cu, options.resolveSymbols(), options.includeComments());
        SyntaxNode root = builder.build();

        long duration = System.currentTimeMillis() - startTime;
        log.debug("Converted {} nodes from {} in {}ms", builder.nodesConverted(), file, duration);

        return new ParsingResult(
                file,
                root,
                new ParsingStats(
                        builder.nodesConverted(),
                        builder.foreignNodes(),
                        builder.definitionsResolved(),
                        duration));
    }

    /**
     * Reflection for the JDK, then the source root the file lives in, then any
     * configured extra roots.
     */
    private CombinedTypeSolver typeSolverFor(Path file, ParsingOptions options) {
        CombinedTypeSolver combinedTypeSolver = new CombinedTypeSolver();
        combinedTypeSolver.add(new ReflectionTypeSolver());

        Set<Path> roots = new LinkedHashSet<>();
        roots.add(detectSourceRoot(file));
        roots.addAll(options.sourceRoots());
        for (Path root : roots) {
            addSourceDirIfExists(combinedTypeSolver, root);
        }
        return combinedTypeSolver;
    }

    /**
     * Walk up from the file to the enclosing {@code src/main/java} or
     * {@code src/test/java}; fall back to the file's own directory.
     */
    static Path detectSourceRoot(Path file) {
        Path directory = file.toAbsolutePath().normalize().getParent();
        Path current = directory;
        while (current != null) {
            if (current.endsWith("src/main/java") || current.endsWith("src/test/java")) {
                log.debug("Auto-detected source root: {}", current);
                return current;
            }
            current = current.getParent();
        }
        return directory;
    }

    private void addSourceDirIfExists(CombinedTypeSolver solver, Path dir) {
        if (dir != null && Files.isDirectory(dir)) {
            solver.add(new JavaParserTypeSolver(dir, new ParserConfiguration().setLanguageLevel(languageLevel)));
        } else {
            log.warn("Ignoring missing source root: {}", dir);
        }
    }

    private static String describe(ParseResult<CompilationUnit> parseResult) {
        if (parseResult.getProblems().isEmpty()) {
            return "parser returned no compilation unit";
        }
        return parseResult.getProblems().stream()
                .map(Problem::getVerboseMessage)
                .map(message -> message.replace('\n', ' ').replace('\r', ' '))
                .collect(Collectors.joining("; "));
    }
}
