package org.tessera.compiler.backend.emit.features;

import org.tessera.compiler.backend.emit.CodeWriter;
import org.tessera.compiler.backend.emit.EmitContext;
import org.tessera.compiler.backend.emit.INodeEmitter;
import org.tessera.compiler.frontend.parser.ast.AttributeNode;
import org.tessera.compiler.frontend.parser.ast.AttributePart;
import org.tessera.compiler.frontend.parser.ast.AttributeValue;
import org.tessera.compiler.frontend.parser.ast.ElementNode;
import org.tessera.compiler.util.RuntimeSymbols;

import java.util.Optional;

/**
 * Emits an element: opening tag attribute by attribute, children, closing tag.
 * <p>
 * Static attribute values are written as they appear in the source, with only double quotes
 * replaced; dynamic values go through the escaper of their context.
 */
public final class ElementEmitter implements INodeEmitter<ElementNode> {

    @Override
    public void emit(ElementNode node, EmitContext ctx) {
        CodeWriter writer = ctx.writer();
        Optional<String> dynamicTag = node.getDynamicTag();

        writer.literal("<");
        tagName(node, writer);
        for (AttributeNode attribute : node.getAttributes()) {
            attribute(attribute, ctx);
        }
        if (node.isSelfClosing()) {
            writer.literal(" />");
            return;
        }
        writer.literal(">");

        boolean isVoid = dynamicTag.isEmpty() && ctx.compilation().getConfig().isVoidTag(node.getTag());
        if (isVoid && node.getChildren().isEmpty()) {
            return;
        }
        ctx.emitAll(node.getChildren());
        writer.literal("</");
        tagName(node, writer);
        writer.literal(">");
    }

    private static void tagName(ElementNode node, CodeWriter writer) {
        if (node.getDynamicTag().isPresent()) {
            writer.write(node.getDynamicTag().get());
        } else {
            writer.literal(node.getTag());
        }
    }

    private static void attribute(AttributeNode attribute, EmitContext ctx) {
        CodeWriter writer = ctx.writer();
        AttributeValue value = attribute.value();

        if (attribute.isSpread()) {
            if (value instanceof AttributeValue.Output o) {
                String variable = ctx.compilation().freshVariable("attr");
                writer.statement("{\nString " + variable + " = " + OutputEmitter.escaped(o.output()) + ";\n"
                        + "if (!" + variable + ".isEmpty()) {\n"
                        + RuntimeSymbols.OUT + ".write(\" \");\n"
                        + RuntimeSymbols.OUT + ".write(" + variable + ");\n"
                        + "}\n}");
            }
            return;
        }

        writer.literal(" " + attribute.name());
        if (value.isBoolean()) {
            return;
        }
        writer.literal("=\"");
        for (AttributePart part : value.toParts()) {
            if (part instanceof AttributePart.Literal literal) {
                writer.literal(literal.text().replace("\"", "&quot;"));
            } else if (part instanceof AttributePart.Dynamic dynamic) {
                writer.write(OutputEmitter.escaped(dynamic.output()));
            }
        }
        writer.literal("\"");
    }
}
