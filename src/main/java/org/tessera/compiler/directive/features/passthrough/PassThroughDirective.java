package org.tessera.compiler.directive.features.passthrough;

import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.List;

/**
 * A known directive that extraction leaves on its host, such as component slot and bind markers
 * and {@code s:raw}, whose region the lexer already handled.
 */
public class PassThroughDirective implements IDirectiveCompiler {

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        return node.getChildren();
    }

    @Override
    public DirectiveType getType() {
        return DirectiveType.PASS_THROUGH;
    }
}
