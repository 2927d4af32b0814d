package com.vidnyan.astdump.domain.model;

import java.util.List;

/**
 * One node of a parsed source file, as handed over by the parser front end.
 * Immutable; the printer only reads it.
 *
 * @param id            stable identity, a pure function of the tree content
 * @param kindLabel     syntactic category, e.g. {@code MethodDeclaration}
 * @param range         source extent, exclusive end
 * @param pointLocation canonical reference location (e.g. the name token)
 * @param spelling      entity name, may be empty
 * @param typeText      static type rendering, may be empty
 * @param foreignOrigin true when the node does not come from the dumped file;
 *                      the parser guarantees all descendants are foreign too
 * @param definitionId  id of the declaration this node uses, or null
 * @param children      child nodes in source order
 */
public record SyntaxNode(
    long id,
    String kindLabel,
    SourceRange range,
    SourcePosition pointLocation,
    String spelling,
    String typeText,
    boolean foreignOrigin,
    Long definitionId,
    List<SyntaxNode> children
) {

    public SyntaxNode {
        if (kindLabel == null || kindLabel.isBlank()) {
            throw new IllegalArgumentException("Node kind label must not be blank");
        }
        range = range != null ? range : SourceRange.empty();
        pointLocation = pointLocation != null ? pointLocation : range.start();
        spelling = spelling != null ? spelling : "";
        typeText = typeText != null ? typeText : "";
        children = children != null ? List.copyOf(children) : List.of();
    }

    /**
     * True if this node refers to a declaration other than itself.
     */
    public boolean isUsage() {
        return definitionId != null && definitionId != id;
    }

    public static Builder builder(long id, String kindLabel) {
        return new Builder(id, kindLabel);
    }

    /**
     * Fluent builder, mostly for callers that assemble trees by hand.
     */
    public static final class Builder {
        private final long id;
        private final String kindLabel;
        private SourceRange range;
        private SourcePosition pointLocation;
        private String spelling;
        private String typeText;
        private boolean foreignOrigin;
        private Long definitionId;
        private List<SyntaxNode> children = List.of();

        private Builder(long id, String kindLabel) {
            this.id = id;
            this.kindLabel = kindLabel;
        }

        public Builder range(SourceRange range) {
            this.range = range;
            return this;
        }

        public Builder range(int startLine, int startColumn, int endLine, int endColumn) {
            return range(SourceRange.of(startLine, startColumn, endLine, endColumn));
        }

        public Builder pointLocation(SourcePosition pointLocation) {
            this.pointLocation = pointLocation;
            return this;
        }

        public Builder pointLocation(int line, int column) {
            return pointLocation(SourcePosition.of(line, column));
        }

        public Builder spelling(String spelling) {
            this.spelling = spelling;
            return this;
        }

        public Builder typeText(String typeText) {
            this.typeText = typeText;
            return this;
        }

        public Builder foreignOrigin(boolean foreignOrigin) {
            this.foreignOrigin = foreignOrigin;
            return this;
        }

        public Builder definitionId(Long definitionId) {
            this.definitionId = definitionId;
            return this;
        }

        public Builder children(List<SyntaxNode> children) {
            this.children = children;
            return this;
        }

        public Builder children(SyntaxNode... children) {
            return children(List.of(children));
        }

        public SyntaxNode build() {
            return new SyntaxNode(id, kindLabel, range, pointLocation, spelling, typeText,
                    foreignOrigin, definitionId, children);
        }
    }
}
