package org.tessera.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base class for all nodes of the template syntax tree.
 * <p>
 * Every node carries the position of the source construct it was built from. The parent
 * reference is non-owning: it is set by the pipeline while traversing and is only used for
 * lookups and diagnostics.
 */
public abstract class AstNode {

    private final int line;
    private final int column;
    private AstNode parent;

    protected AstNode(int line, int column) {
        this.line = line;
        this.column = column;
    }

    /**
     * @return The 1-based source line.
     */
    public int getLine() {
        return line;
    }

    /**
     * @return The 1-based source column.
     */
    public int getColumn() {
        return column;
    }

    /**
     * @return The enclosing node as of the last traversal, or {@code null} for the root.
     */
    public AstNode getParent() {
        return parent;
    }

    /**
     * @param parent The enclosing node.
     */
    public void setParent(AstNode parent) {
        this.parent = parent;
    }

    /**
     * Returns the ordered child nodes. Leaf nodes have none.
     * This allows the pipeline to traverse the tree without knowing the concrete node type.
     *
     * @return The child nodes.
     */
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * @return {@code true} if this node owns a child list that the pipeline traverses.
     */
    public boolean isContainer() {
        return false;
    }
}
