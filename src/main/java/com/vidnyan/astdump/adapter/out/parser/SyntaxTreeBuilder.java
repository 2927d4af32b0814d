package com.vidnyan.astdump.adapter.out.parser;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithIdentifier;
import com.github.javaparser.ast.nodeTypes.NodeWithName;
import com.github.javaparser.ast.nodeTypes.NodeWithParameters;
import com.github.javaparser.ast.nodeTypes.NodeWithSimpleName;
import com.github.javaparser.ast.nodeTypes.NodeWithVariables;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.resolution.Resolvable;
import com.github.javaparser.resolution.declarations.AssociableToAST;
import com.github.javaparser.resolution.declarations.ResolvedDeclaration;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import com.vidnyan.astdump.domain.model.SourcePosition;
import com.vidnyan.astdump.domain.model.SourceRange;
import com.vidnyan.astdump.domain.model.SyntaxNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.zip.CRC32;

/**
 * Converts a JavaParser compilation unit into an immutable {@link SyntaxNode} tree.
 *
 * Two passes: the first assigns every node its id, so that the second can
 * attach definition ids that point forward in the file.
 * One instance per compilation unit.
 */
@Slf4j
class SyntaxTreeBuilder {

    private static final Comparator<Node> SOURCE_ORDER = Comparator
            .comparingInt((Node n) -> n.getRange().isPresent() ? 0 : 1)
            .thenComparingInt(n -> n.getRange().map(r -> r.begin.line).orElse(0))
            .thenComparingInt(n -> n.getRange().map(r -> r.begin.column).orElse(0));

    private final CompilationUnit compilationUnit;
    private final boolean resolveSymbols;
    private final boolean includeComments;

    private final Map<Node, Long> ids = new IdentityHashMap<>();
    private int foreignNodes;
    private int definitionsResolved;

    SyntaxTreeBuilder(CompilationUnit compilationUnit, boolean resolveSymbols, boolean includeComments) {
        this.compilationUnit = compilationUnit;
        this.resolveSymbols = resolveSymbols;
        this.includeComments = includeComments;
    }

    SyntaxNode build() {
        ids.clear();
        foreignNodes = 0;
        definitionsResolved = 0;

        long rootId = hash(kindOf(compilationUnit) + "@" + rangeOf(compilationUnit));
        ids.put(compilationUnit, rootId);
        assignIds(compilationUnit, rootId);

        return SyntaxNode.builder(rootId, kindOf(compilationUnit))
                .range(rangeOf(compilationUnit))
                .pointLocation(SourcePosition.ORIGIN)
                .children(convertChildren(compilationUnit, false))
                .build();
    }

    int nodesConverted() {
        return ids.size();
    }

    int foreignNodes() {
        return foreignNodes;
    }

    int definitionsResolved() {
        return definitionsResolved;
    }

    /**
     * Children in source order, comments dropped unless requested.
     */
    List<Node> childrenOf(Node node) {
        return node.getChildNodes().stream()
                .filter(child -> includeComments || !(child instanceof Comment))
                .sorted(SOURCE_ORDER)
                .toList();
    }

    private void assignIds(Node parent, long parentId) {
        List<Node> children = childrenOf(parent);
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            long id = hash(parentId + "/" + i + ":" + kindOf(child) + "@" + rangeOf(child));
            ids.put(child, id);
            assignIds(child, id);
        }
    }

    private List<SyntaxNode> convertChildren(Node parent, boolean parentForeign) {
        List<SyntaxNode> converted = new ArrayList<>();
        for (Node child : childrenOf(parent)) {
            converted.add(convert(child, parentForeign || isForeign(child)));
        }
        return converted;
    }

    private SyntaxNode convert(Node node, boolean foreign) {
        if (foreign) {
            foreignNodes++;
        }
        SourceRange range = rangeOf(node);
        Long definitionId = foreign ? null : definitionOf(node);
        if (definitionId != null) {
            definitionsResolved++;
        }
        return SyntaxNode.builder(ids.get(node), kindOf(node))
                .range(range)
                .pointLocation(pointLocationOf(node, range))
                .spelling(singleLine(spellingOf(node)))
                .typeText(singleLine(foreign ? "" : typeTextOf(node)))
                .foreignOrigin(foreign)
                .definitionId(definitionId)
                .children(convertChildren(node, foreign))
                .build();
    }

    /**
     * A node is foreign when it has no position in this file. Nodes whose
     * range lies outside their parent's (the element type JavaParser hangs
     * under every declarator) still come from this file and are kept.
     */
    static boolean isForeign(Node node) {
        return node.getRange().isEmpty();
    }

    static String kindOf(Node node) {
        return node.getClass().getSimpleName();
    }

    /**
     * JavaParser ends are inclusive; the model wants them exclusive.
     */
    static SourceRange rangeOf(Node node) {
        return node.getRange()
                .map(r -> SourceRange.of(r.begin.line, r.begin.column, r.end.line, r.end.column + 1))
                .orElseGet(SourceRange::empty);
    }

    static SourcePosition pointLocationOf(Node node, SourceRange range) {
        if (node instanceof NodeWithSimpleName<?> named) {
            Optional<SourcePosition> namePosition = named.getName().getBegin()
                    .map(p -> SourcePosition.of(p.line, p.column));
            if (namePosition.isPresent()) {
                return namePosition.get();
            }
        }
        return range.start();
    }

    static String spellingOf(Node node) {
        if (node instanceof NodeWithSimpleName<?> named) {
            return named.getNameAsString();
        }
        if (node instanceof NodeWithName<?> named) {
            return named.getNameAsString();
        }
        if (node instanceof NodeWithIdentifier<?> identifier) {
            return identifier.getIdentifier();
        }
        if (node instanceof LiteralStringValueExpr literal) {
            return literal.getValue();
        }
        if (node instanceof BooleanLiteralExpr literal) {
            return String.valueOf(literal.getValue());
        }
        return "";
    }

    String typeTextOf(Node node) {
        if (node instanceof VariableDeclarator variable) {
            return variable.getType().asString();
        }
        if (node instanceof Parameter parameter) {
            return parameterType(parameter);
        }
        if (node instanceof MethodDeclaration method) {
            return method.getType().asString() + " " + parameterList(method);
        }
        if (node instanceof ConstructorDeclaration constructor) {
            return parameterList(constructor);
        }
        if (node instanceof TypeDeclaration<?> type) {
            return type.getFullyQualifiedName().orElse(type.getNameAsString());
        }
        if (node instanceof Type type) {
            return type.asString();
        }
        if (resolveSymbols && node instanceof Expression expression) {
            try {
                return expression.calculateResolvedType().describe();
            } catch (RuntimeException e) {
                log.debug("Could not resolve type of {} at {}: {}",
                        kindOf(node), node.getBegin().orElse(null), e.getMessage());
            }
        }
        return "";
    }

    /**
     * Nodes that refer to a declaration rather than introduce one.
     */
    static boolean isUsage(Node node) {
        return node instanceof NameExpr
                || node instanceof MethodCallExpr
                || node instanceof FieldAccessExpr
                || node instanceof ObjectCreationExpr
                || node instanceof MethodReferenceExpr
                || node instanceof ClassOrInterfaceType
                || node instanceof ExplicitConstructorInvocationStmt;
    }

    /**
     * Id of the declaration a usage refers to, if that declaration lives in
     * this compilation unit and is not the node itself.
     */
    Long definitionOf(Node node) {
        if (!resolveSymbols || !isUsage(node) || !(node instanceof Resolvable<?> resolvable)) {
            return null;
        }
        try {
            Object resolved = resolvable.resolve();
            if (resolved instanceof ResolvedReferenceType referenceType) {
                resolved = referenceType.getTypeDeclaration().orElse(null);
            }
            if (!(resolved instanceof AssociableToAST associable)) {
                return null;
            }
            String name = resolved instanceof ResolvedDeclaration declaration ? declaration.getName() : null;
            Optional<?> ast = associable.toAst();
            return ast
                    .filter(Node.class::isInstance)
                    .map(Node.class::cast)
                    .map(target -> declaratorNamed(target, name))
                    .filter(target -> target != node)
                    .map(ids::get)
                    .orElse(null);
        } catch (RuntimeException e) {
            log.debug("Could not resolve declaration of {} at {}: {}",
                    kindOf(node), node.getBegin().orElse(null), e.getMessage());
            return null;
        }
    }

    /**
     * Fields and locals resolve to the whole declaration statement; narrow
     * that down to the declarator carrying the resolved name.
     */
    static Node declaratorNamed(Node declaration, String name) {
        if (name == null || !(declaration instanceof NodeWithVariables<?> withVariables)) {
            return declaration;
        }
        return withVariables.getVariables().stream()
                .filter(variable -> variable.getNameAsString().equals(name))
                .findFirst()
                .<Node>map(variable -> variable)
                .orElse(declaration);
    }

    private static String parameterList(NodeWithParameters<?> callable) {
        return callable.getParameters().stream()
                .map(SyntaxTreeBuilder::parameterType)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    private static String parameterType(Parameter parameter) {
        return parameter.getType().asString() + (parameter.isVarArgs() ? "..." : "");
    }

    private static String singleLine(String text) {
        return text.replace("\r", "\\r").replace("\n", "\\n");
    }

    private static long hash(String descriptor) {
        CRC32 crc = new CRC32();
        crc.update(descriptor.getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }
}
