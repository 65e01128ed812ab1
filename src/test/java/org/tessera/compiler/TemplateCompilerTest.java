package org.tessera.compiler;

import org.tessera.compiler.api.CompilationException;
import org.tessera.compiler.api.CompiledTemplate;
import org.tessera.compiler.api.DependencySink;
import org.tessera.compiler.api.TemplateLoader;
import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.diagnostics.Diagnostic;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end tests of the {@link TemplateCompiler}: template source in, Java render body out.
 * These are unit tests and do not require external resources.
 */
public class TemplateCompilerTest {

    private static final String PREAMBLE = "// Generated by the Tessera template compiler. Do not edit.\n";

    private static String compile(String source) throws CompilationException {
        return new TemplateCompiler().compile(source, null).source();
    }

    /**
     * Verifies that static markup is coalesced into a single write call.
     */
    @Test
    @Tag("unit")
    void staticMarkupIsWrittenAsOneLiteral() throws Exception {
        // Act
        String generated = compile("<div class=\"box\">\n  <p>Hello</p>\n</div>");

        // Assert
        assertThat(generated).isEqualTo(PREAMBLE
                + "out.write(\"<div class=\\\"box\\\">\\n  <p>Hello</p>\\n</div>\");\n");
    }

    @Test
    @Tag("unit")
    void outputIsHtmlEscapedByDefault() throws Exception {
        // Act
        String generated = compile("<p><%= user.name() %></p>");

        // Assert
        assertThat(generated).isEqualTo(PREAMBLE
                + "out.write(\"<p>\");\n"
                + "out.write(org.tessera.runtime.Escaper.html(user.name()));\n"
                + "out.write(\"</p>\");\n");
    }

    @Test
    @Tag("unit")
    void rawAndJsonMarkersSelectTheWriter() throws Exception {
        // Act
        String raw = compile("<div><%= body |> raw() %></div>");
        String json = compile("<script>var data = <%= model |> json() %>;</script>");

        // Assert
        assertThat(raw).contains("out.write(String.valueOf(body));");
        assertThat(json).contains("out.write(org.tessera.runtime.Escaper.json(model));");
    }

    @Test
    @Tag("unit")
    void filtersWrapTheExpressionInOrder() throws Exception {
        // Act
        String generated = compile("<%= name |> trim() |> abbreviate(10) %>");

        // Assert
        assertThat(generated).contains("out.write(org.tessera.runtime.Escaper.html(abbreviate(trim(name), 10)));");
    }

    /**
     * Verifies that outputs inside script and style elements and inside attributes get the escaper of their context.
     */
    @Test
    @Tag("unit")
    void escapingFollowsTheOutputContext() throws Exception {
        // Act
        String script = compile("<script>var user = <%= name %>;</script>");
        String style = compile("<style>.a { color: <%= color %>; }</style>");
        String attribute = compile("<a title=\"<%= title %>\">x</a>");
        String url = compile("<a href=\"/search?q=<%= query %>\">x</a>");
        String path = compile("<a href=\"/users/<%= id %>\">x</a>");

        // Assert
        assertThat(script).contains("org.tessera.runtime.Escaper.javascript(name)");
        assertThat(style).contains("org.tessera.runtime.Escaper.css(color)");
        assertThat(attribute).contains("out.write(\"<a title=\\\"\");\n"
                + "out.write(org.tessera.runtime.Escaper.attribute(title));\n"
                + "out.write(\"\\\">x</a>\");\n");
        assertThat(url).contains("org.tessera.runtime.Escaper.url(query)");
        assertThat(path).contains("org.tessera.runtime.Escaper.attribute(id)");
    }

    @Test
    @Tag("unit")
    void codeBlocksAreEmittedVerbatimAndTemplateCommentsDropped() throws Exception {
        // Act
        String generated = compile("<% int total = 0; %><%-- internal note --%><!-- kept -->");

        // Assert
        assertThat(generated).isEqualTo(PREAMBLE
                + "int total = 0;\n"
                + "out.write(\"<!-- kept -->\");\n");
    }

    @Test
    @Tag("unit")
    void commentsAreDroppedWhenPassThroughIsDisabled() throws Exception {
        // Arrange
        TemplateCompiler compiler = new TemplateCompiler(CompilerConfig.defaults().withPassThroughComments(false));

        // Act
        String generated = compiler.compile("<p>a</p><!-- secret --><p>b</p>", null).source();

        // Assert
        assertThat(generated).isEqualTo(PREAMBLE + "out.write(\"<p>a</p><p>b</p>\");\n");
    }

    /**
     * Verifies that the body of an element marked raw is written untouched, including template syntax.
     */
    @Test
    @Tag("unit")
    void rawElementBodyIsNotInterpreted() throws Exception {
        // Act
        String generated = compile("<pre s:raw><%= not.evaluated %> <p s:if=\"x\"></p></pre>");

        // Assert
        assertThat(generated).isEqualTo(PREAMBLE
                + "out.write(\"<pre><%= not.evaluated %> <p s:if=\\\"x\\\"></p></pre>\");\n");
    }

    @Test
    @Tag("unit")
    void voidElementsAreSelfClosed() throws Exception {
        // Act
        String generated = compile("<p>a<br>b</p><img src=\"logo.png\">");

        // Assert
        assertThat(generated).isEqualTo(PREAMBLE + "out.write(\"<p>a<br />b</p><img src=\\\"logo.png\\\" />\");\n");
    }

    @Test
    @Tag("unit")
    void debugHeaderNamesTheSourceTemplate() throws Exception {
        // Arrange
        TemplateCompiler compiler = new TemplateCompiler(CompilerConfig.defaults().withDebug(true));

        // Act
        CompiledTemplate compiled = compiler.compile("<p>x</p>", "views/index.html");

        // Assert
        assertThat(compiled.templatePath()).isEqualTo("views/index.html");
        assertThat(compiled.source()).startsWith(PREAMBLE + "// Source: views/index.html\n// Compiled: ");
    }

    @Test
    @Tag("unit")
    void customDirectivePrefixIsHonoured() throws Exception {
        // Arrange
        TemplateCompiler compiler = new TemplateCompiler(CompilerConfig.defaults().withDirectivePrefix("x"));

        // Act
        String generated = compiler.compile("<p x:if=\"ready\">A</p><p s:if=\"other\">B</p>", null).source();

        // Assert
        assertThat(generated).isEqualTo(PREAMBLE
                + "if (ready) {\n"
                + "out.write(\"<p>A</p>\");\n"
                + "}\n"
                + "out.write(\"<p s:if=\\\"other\\\">B</p>\");\n");
    }

    /**
     * Verifies that recoverable markup problems end up as warnings on the result instead of failing.
     */
    @Test
    @Tag("unit")
    void malformedMarkupIsReportedAsWarnings() throws Exception {
        // Act
        CompiledTemplate compiled = new TemplateCompiler().compile("<div><span>text</div>", "broken.html");

        // Assert
        assertThat(compiled.diagnostics())
                .extracting(Diagnostic::type, Diagnostic::message)
                .containsExactly(tuple(Diagnostic.Type.WARNING, "Missing closing tag for <span>"));
        assertThat(compiled.source()).contains("<div><span>text</span></div>");
    }

    @Test
    @Tag("unit")
    void syntaxErrorsCarryPositionSnippetAndSuggestion() {
        // Arrange
        String source = "<ul>\n  <li s:forech=\"items as item\"><%= item %></li>\n</ul>";

        // Act & Assert
        assertThatThrownBy(() -> new TemplateCompiler().compile(source, "list.html"))
                .isInstanceOf(CompilationException.class)
                .satisfies(e -> {
                    Diagnostic diagnostic = ((CompilationException) e).getDiagnostic();
                    assertThat(diagnostic.type()).isEqualTo(Diagnostic.Type.ERROR);
                    assertThat(diagnostic.message()).isEqualTo("Unknown directive \"forech\". Did you mean \"foreach\"?");
                    assertThat(diagnostic.fileName()).isEqualTo("list.html");
                    assertThat(diagnostic.lineNumber()).isEqualTo(2);
                    assertThat(diagnostic.column()).isEqualTo(9);
                    assertThat(diagnostic.suggestion()).isEqualTo("foreach");
                    assertThat(diagnostic.snippet()).contains(" 2 |   <li s:forech=\"items as item\">");
                    assertThat(e.getMessage()).endsWith("(template: list.html line:2 column:9)");
                });
    }

    @Test
    @Tag("unit")
    void unexpandedComponentsAreRejected() {
        // Act & Assert
        assertThatThrownBy(() -> compile("<s-card title=\"Hi\"></s-card>"))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Component <s-card> was not expanded");
    }

    @Test
    @Tag("unit")
    void nestingBeyondTheConfiguredDepthFails() {
        // Arrange
        CompilerConfig shallow = new CompilerConfig("s", "s-", null, "slot", "bind",
                CompilerConfig.DEFAULT_VOID_TAGS, true, false, 3, 10_000);
        String deep = "<div><div><div><div><div>x</div></div></div></div></div>";

        // Act & Assert
        assertThatThrownBy(() -> new TemplateCompiler(shallow).compile(deep, null))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Template nesting exceeds the maximum depth of 3");
    }

    @Test
    @Tag("unit")
    void pathologicallyDeepMarkupFailsWithPosition() {
        // Arrange
        String deep = "<div>".repeat(20_000);

        // Act & Assert
        assertThatThrownBy(() -> new TemplateCompiler().compile(deep, "deep.html"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Template nesting exceeds the maximum depth of 512")
                .hasMessageContaining("(template: deep.html line:1 column:2561)");
    }

    @Test
    @Tag("unit")
    void compilerInstancesAreReusable() throws Exception {
        // Arrange
        TemplateCompiler compiler = new TemplateCompiler();
        String source = "<li s:foreach=\"items as item\"><%= item %></li>";

        // Act
        String first = compiler.compile(source, null).source();
        String second = compiler.compile(source, null).source();

        // Assert
        assertThat(second).isEqualTo(first);
    }

    @Test
    @Tag("unit")
    void loaderResolvesAndLoadsTheTemplate() throws Exception {
        // Arrange
        TemplateLoader loader = mock(TemplateLoader.class);
        DependencySink dependencies = mock(DependencySink.class);
        when(loader.resolve(eq("home"), isNull())).thenReturn("/templates/home.html");
        when(loader.load("/templates/home.html")).thenReturn("<h1>Home</h1>");

        // Act
        CompiledTemplate compiled = new TemplateCompiler().compile("home", loader, dependencies);

        // Assert
        assertThat(compiled.templatePath()).isEqualTo("/templates/home.html");
        assertThat(compiled.source()).contains("out.write(\"<h1>Home</h1>\");");
        verify(loader).load("/templates/home.html");
    }

    @Test
    @Tag("unit")
    void loaderFailuresPropagate() throws Exception {
        // Arrange
        TemplateLoader loader = mock(TemplateLoader.class);
        when(loader.resolve(any(), any())).thenReturn("missing.html");
        when(loader.load("missing.html")).thenThrow(new IOException("not found"));

        // Act & Assert
        assertThatThrownBy(() -> new TemplateCompiler().compile("missing.html", loader, DependencySink.NONE))
                .isInstanceOf(IOException.class)
                .hasMessage("not found");
    }
}
