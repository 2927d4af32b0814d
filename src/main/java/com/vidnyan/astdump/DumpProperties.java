package com.vidnyan.astdump;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the dump tool.
 * Can be configured via application.yml or --astdump.* arguments.
 */
@Data
@Component
@ConfigurationProperties(prefix = "astdump")
public class DumpProperties {

    /**
     * JavaParser language level, e.g. JAVA_17.
     */
    private String languageLevel = "JAVA_17";

    /**
     * Resolve expression types and declaration references with the symbol solver.
     */
    private boolean resolveSymbols = true;

    /**
     * Emit comment nodes.
     */
    private boolean includeComments = false;

    private Traversal traversal = Traversal.RECURSIVE;

    /**
     * Charset used to read source files.
     */
    private String charset = "UTF-8";

    /**
     * Extra source roots for the type solver, in addition to the auto-detected one.
     */
    private List<String> sourceRoots = new ArrayList<>();

    public enum Traversal {
        RECURSIVE,
        WORKLIST
    }
}
