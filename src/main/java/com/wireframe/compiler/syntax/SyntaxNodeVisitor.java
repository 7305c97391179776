package com.wireframe.compiler.syntax;

/**
 * Visitor pattern interface for traversing layout bodies of the syntax tree.
 */
public interface SyntaxNodeVisitor {
    void visit(LayoutSyntax layout);
    void visit(ComponentSyntax component);
    void visit(CellSyntax cell);
}
