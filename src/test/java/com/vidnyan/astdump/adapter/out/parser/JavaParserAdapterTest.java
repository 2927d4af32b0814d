package com.vidnyan.astdump.adapter.out.parser;

import com.github.javaparser.ParserConfiguration;
import com.vidnyan.astdump.application.port.out.ParseFailureException;
import com.vidnyan.astdump.application.port.out.SourceCodeParser.ParsingOptions;
import com.vidnyan.astdump.application.port.out.SourceCodeParser.ParsingResult;
import com.vidnyan.astdump.domain.model.SourcePosition;
import com.vidnyan.astdump.domain.model.SourceRange;
import com.vidnyan.astdump.domain.model.SyntaxNode;
import com.vidnyan.astdump.domain.printer.DumpException;
import com.vidnyan.astdump.domain.printer.RecursiveTreePrinter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JavaParserAdapterTest {

    private static final String SAMPLE = """
            package demo;

            public class Sample {
                private int count;

                public int next(int step) {
                    int local = step + 1;
                    count += local;
                    return count;
                }

                int twice() {
                    return next(2);
                }

                void empty() {
                    /* nothing */
                }
            }
            """;

    @TempDir
    Path tempDir;

    private JavaParserAdapter adapter;
    private Path sampleFile;

    @BeforeEach
    void setUp() throws IOException {
        adapter = new JavaParserAdapter(ParserConfiguration.LanguageLevel.JAVA_17, StandardCharsets.UTF_8);
        sampleFile = tempDir.resolve("Sample.java");
        Files.writeString(sampleFile, SAMPLE);
    }

    @Test
    void parse_ShouldConvertDeclarations() throws ParseFailureException {
        SyntaxNode root = adapter.parse(sampleFile, ParsingOptions.defaults()).root();

        assertEquals("CompilationUnit", root.kindLabel());
        assertEquals(SourcePosition.ORIGIN, root.pointLocation());

        SyntaxNode type = find(root, "ClassOrInterfaceDeclaration", "Sample");
        assertEquals("demo.Sample", type.typeText());
        assertEquals(SourceRange.of(3, 1, 19, 2), type.range());
        assertEquals(SourcePosition.of(3, 14), type.pointLocation());

        SyntaxNode method = find(root, "MethodDeclaration", "next");
        assertEquals("int (int)", method.typeText());
        assertEquals(SourcePosition.of(6, 16), method.pointLocation());

        assertEquals("int", find(root, "Parameter", "step").typeText());
        assertEquals("int", find(root, "VariableDeclarator", "local").typeText());
        assertEquals("2", find(root, "IntegerLiteralExpr", "2").spelling());
    }

    @Test
    void parse_ShouldKeepChildrenInSourceOrder() throws ParseFailureException {
        SyntaxNode root = adapter.parse(sampleFile, ParsingOptions.defaults()).root();

        for (SyntaxNode node : flatten(root)) {
            for (int i = 1; i < node.children().size(); i++) {
                SourcePosition previous = node.children().get(i - 1).range().start();
                SourcePosition current = node.children().get(i).range().start();
                assertTrue(previous.compareTo(current) <= 0, node.kindLabel() + " children out of order");
            }
        }
    }

    @Test
    void parse_ShouldLinkUsagesToDeclarations() throws ParseFailureException {
        ParsingResult result = adapter.parse(sampleFile, ParsingOptions.defaults());
        SyntaxNode root = result.root();
        Map<Long, SyntaxNode> byId = flatten(root).stream()
                .collect(Collectors.toMap(SyntaxNode::id, Function.identity()));

        SyntaxNode parameter = find(root, "Parameter", "step");
        SyntaxNode stepUsage = find(root, "NameExpr", "step");
        assertEquals(parameter.id(), stepUsage.definitionId());

        SyntaxNode call = find(root, "MethodCallExpr", "next");
        assertEquals(find(root, "MethodDeclaration", "next").id(), call.definitionId());
        assertEquals("int", call.typeText());

        SyntaxNode localUsage = find(root, "NameExpr", "local");
        assertEquals(find(root, "VariableDeclarator", "local").id(), localUsage.definitionId());

        SyntaxNode countUsage = find(root, "NameExpr", "count");
        assertEquals(find(root, "VariableDeclarator", "count").id(), countUsage.definitionId());
        assertEquals("VariableDeclarator", byId.get(countUsage.definitionId()).kindLabel());

        assertTrue(result.stats().definitionsResolved() >= 4);
        // declarations never carry a definition id
        assertNull(find(root, "MethodDeclaration", "next").definitionId());
        assertNull(find(root, "Parameter", "step").definitionId());
    }

    @Test
    void parse_Declarators_ShouldNotLookLikeUsages() throws IOException, ParseFailureException, DumpException {
        Path file = tempDir.resolve("T.java");
        Files.writeString(file, """
                class T {
                    java.util.List<String> xs;
                    Other o;
                    int a, b;
                    int sum() { return a + b; }
                    void m() { Other loc = o; }
                }
                class Other {}
                """);

        SyntaxNode root = adapter.parse(file, ParsingOptions.defaults()).root();
        List<SyntaxNode> declarators = flatten(root).stream()
                .filter(node -> node.kindLabel().equals("VariableDeclarator"))
                .toList();
        String dump = new RecursiveTreePrinter().dumpToString(root);

        assertEquals(5, declarators.size());
        for (SyntaxNode declarator : declarators) {
            assertNull(declarator.definitionId(), declarator.spelling());
            String line = dump.lines()
                    .filter(l -> l.contains("VariableDeclarator " + declarator.id() + " <"))
                    .findFirst()
                    .orElseThrow();
            // point location, spelling, type text and no definition id in between
            String tail = line.substring(line.indexOf("> ") + 2);
            assertEquals(3, tail.split(" ").length, line);
            assertTrue(tail.endsWith(" " + declarator.spelling() + " " + declarator.typeText()), line);
        }
    }

    @Test
    void parse_UsagesOfSharedDeclaration_ShouldPointAtOwnDeclarator() throws IOException, ParseFailureException {
        Path file = tempDir.resolve("T.java");
        Files.writeString(file, """
                class T {
                    Other o;
                    int a, b;
                    int sum() { return a + b; }
                    void m() { Other loc = o; }
                }
                class Other {}
                """);

        SyntaxNode root = adapter.parse(file, ParsingOptions.defaults()).root();

        long aDeclarator = find(root, "VariableDeclarator", "a").id();
        long bDeclarator = find(root, "VariableDeclarator", "b").id();
        assertNotEquals(aDeclarator, bDeclarator);
        assertEquals(aDeclarator, find(root, "NameExpr", "a").definitionId());
        assertEquals(bDeclarator, find(root, "NameExpr", "b").definitionId());
        assertEquals(find(root, "VariableDeclarator", "o").id(), find(root, "NameExpr", "o").definitionId());
    }

    @Test
    void parse_WithoutSymbolResolution_ShouldLeaveReferencesEmpty() throws ParseFailureException {
        SyntaxNode root = adapter.parse(sampleFile, new ParsingOptions(false, false, List.of())).root();

        assertTrue(flatten(root).stream().allMatch(node -> node.definitionId() == null));
        assertEquals("", find(root, "NameExpr", "step").typeText());
        assertEquals("int (int)", find(root, "MethodDeclaration", "next").typeText());
    }

    @Test
    void parse_ShouldExcludeCommentsUnlessRequested() throws ParseFailureException {
        SyntaxNode withoutComments = adapter.parse(sampleFile, ParsingOptions.defaults()).root();
        SyntaxNode withComments = adapter.parse(sampleFile, new ParsingOptions(true, true, List.of())).root();

        assertTrue(flatten(withoutComments).stream().noneMatch(node -> node.kindLabel().endsWith("Comment")));
        SyntaxNode comment = flatten(withComments).stream()
                .filter(node -> node.kindLabel().equals("BlockComment"))
                .findFirst()
                .orElseThrow();
        assertFalse(comment.foreignOrigin());
    }

    @Test
    void parse_SameFileTwice_ShouldProduceIdenticalDumps() throws ParseFailureException, DumpException {
        RecursiveTreePrinter printer = new RecursiveTreePrinter();

        SyntaxNode first = adapter.parse(sampleFile, ParsingOptions.defaults()).root();
        SyntaxNode second = adapter.parse(sampleFile, ParsingOptions.defaults()).root();

        assertEquals(first, second);
        assertEquals(printer.dumpToString(first), printer.dumpToString(second));
    }

    @Test
    void parse_ShouldAssignDistinctIds() throws ParseFailureException {
        ParsingResult result = adapter.parse(sampleFile, ParsingOptions.defaults());
        List<SyntaxNode> nodes = flatten(result.root());

        assertEquals(nodes.size(), nodes.stream().map(SyntaxNode::id).distinct().count());
        assertEquals(nodes.size(), result.stats().nodesConverted());
    }

    @Test
    void parse_DeclaredTypes_ShouldStayVisible() throws IOException, ParseFailureException, DumpException {
        Path file = tempDir.resolve("T.java");
        Files.writeString(file, """
                class T {
                    java.util.List<String> xs;
                    Other o;
                    void m() { Other loc = o; }
                }
                class Other {}
                """);

        ParsingResult result = adapter.parse(file, ParsingOptions.defaults());
        SyntaxNode root = result.root();
        String dump = new RecursiveTreePrinter().dumpToString(root);

        assertEquals(0, result.stats().foreignNodes());
        assertTrue(flatten(root).stream().noneMatch(SyntaxNode::foreignOrigin));

        // the element type starts before the declarator it hangs under
        SyntaxNode xs = find(root, "VariableDeclarator", "xs");
        SyntaxNode list = find(xs, "ClassOrInterfaceType", "List");
        assertTrue(list.range().start().compareTo(xs.range().start()) < 0);
        assertTrue(dump.contains("ClassOrInterfaceType " + list.id() + " <"), dump);
        assertTrue(dump.contains("ClassOrInterfaceType " + find(xs, "ClassOrInterfaceType", "String").id() + " <"),
                dump);

        SyntaxNode otherType = find(find(root, "VariableDeclarator", "o"), "ClassOrInterfaceType", "Other");
        assertEquals(find(root, "ClassOrInterfaceDeclaration", "Other").id(), otherType.definitionId());
        assertTrue(dump.contains("ClassOrInterfaceType " + otherType.id() + " <"), dump);
    }

    @Test
    void parse_SampleFile_ShouldHaveNoForeignNodes() throws ParseFailureException, DumpException {
        ParsingResult result = adapter.parse(sampleFile, ParsingOptions.defaults());

        assertEquals(0, result.stats().foreignNodes());
        SyntaxNode localType = find(find(result.root(), "VariableDeclarator", "local"), "PrimitiveType", "");
        String dump = new RecursiveTreePrinter().dumpToString(result.root());
        assertTrue(dump.contains("PrimitiveType " + localType.id() + " <"), dump);
    }

    @Test
    void parse_MissingFile_ShouldFailAsUnreadable() {
        Path missing = tempDir.resolve("Missing.java");

        ParseFailureException e = assertThrows(ParseFailureException.class,
                () -> adapter.parse(missing, ParsingOptions.defaults()));

        assertEquals(ParseFailureException.Reason.UNREADABLE, e.getReason());
        assertEquals(missing, e.getFile());
    }

    @Test
    void parse_InvalidSource_ShouldFailAsUnparsable() throws IOException {
        Path broken = tempDir.resolve("Broken.java");
        Files.writeString(broken, "public class Broken {\n    void run( {\n}\n");

        ParseFailureException e = assertThrows(ParseFailureException.class,
                () -> adapter.parse(broken, ParsingOptions.defaults()));

        assertEquals(ParseFailureException.Reason.UNPARSABLE, e.getReason());
        assertFalse(e.getMessage().isBlank());
        assertFalse(e.getMessage().contains("\n"));
    }

    @Test
    void detectSourceRoot_ShouldPreferMavenLayout() throws IOException {
        Path root = tempDir.resolve("project/src/main/java");
        Path nested = Files.createDirectories(root.resolve("com/example"));

        assertEquals(root.toAbsolutePath().normalize(),
                JavaParserAdapter.detectSourceRoot(nested.resolve("Example.java")));
        assertEquals(tempDir.toAbsolutePath().normalize(), JavaParserAdapter.detectSourceRoot(sampleFile));
    }

    private static SyntaxNode find(SyntaxNode root, String kind, String spelling) {
        return flatten(root).stream()
                .filter(node -> node.kindLabel().equals(kind) && node.spelling().equals(spelling))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No " + kind + " '" + spelling + "'"));
    }

    private static List<SyntaxNode> flatten(SyntaxNode root) {
        List<SyntaxNode> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    private static void collect(SyntaxNode node, List<SyntaxNode> nodes) {
        nodes.add(node);
        node.children().forEach(child -> collect(child, nodes));
    }
}
