package im.arun.mathreader.model;

/**
 * Closed set of semantic node kinds. Each constant routes itself to the
 * matching {@link NodeVisitor} method.
 */
public enum NodeType {

    // Structural
    ROOT {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitRoot(node);
        }
    },
    GROUP {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitGroup(node);
        }
    },

    // Leaves
    NUMBER {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitNumber(node);
        }
    },
    IDENTIFIER {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitIdentifier(node);
        }
    },

    // Layout schemata
    FRACTION {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitFraction(node);
        }
    },
    SUPERSCRIPT {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitSuperscript(node);
        }
    },
    SUBSCRIPT {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitSubscript(node);
        }
    },
    SQRT {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitSqrt(node);
        }
    },
    NROOT {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitNRoot(node);
        }
    },

    // Operators
    OPERATOR {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitOperator(node);
        }
    },
    RELATION {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitRelation(node);
        }
    },
    FUNCTION {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitFunction(node);
        }
    },

    // Big operators
    SUM {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitSum(node);
        }
    },
    PRODUCT {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitProduct(node);
        }
    },
    INTEGRAL {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitIntegral(node);
        }
    },
    LIMIT {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitLimit(node);
        }
    },

    // Tables
    MATRIX {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitMatrix(node);
        }
    },
    MATRIX_ROW {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitMatrixRow(node);
        }
    },

    // Special
    TEXT {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitText(node);
        }
    },
    SPACE {
        @Override
        public <R> R accept(NodeVisitor<R> visitor, SemanticNode node) {
            return visitor.visitSpace(node);
        }
    };

    public abstract <R> R accept(NodeVisitor<R> visitor, SemanticNode node);

    /**
     * Grouping nodes only exist for precedence and are skipped by navigation.
     */
    public boolean isGrouping() {
        return this == ROOT || this == GROUP;
    }
}
