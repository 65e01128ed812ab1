package org.tessera.compiler.pipeline;

import org.tessera.compiler.api.TemplateException;
import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.diagnostics.CompilerLogger;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.ContainerNode;
import org.tessera.compiler.frontend.parser.ast.DocumentNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Runs an ordered list of {@link IAstPass}es over a document in a single traversal.
 * <p>
 * Passes are ordered by priority (lower first), ties broken by insertion order. For every node
 * all {@code before} hooks run, then the children are walked (each child starting again at the
 * first pass), then all {@code after} hooks run. A hook returning
 * {@link NodeAction.Replace} splices the replacements into the parent's child list; they continue
 * at the same pass when restarted, otherwise at the next one. Replacements are processed from an
 * explicit worklist whose length is capped by {@code maxReplays}; nesting is capped by {@code maxDepth}.
 */
public class AstPipeline {

    private record Entry(IAstPass pass, int priority, long sequence) {}

    private record Pending(AstNode node, int fromPass) {}

    private final int maxDepth;
    private final int maxReplays;
    private final List<Entry> entries = new ArrayList<>();
    private List<IAstPass> passes = List.of();
    private long nextSequence = 0;

    /**
     * Creates an empty pipeline with the limits of the given configuration.
     * @param config The compiler configuration.
     */
    public AstPipeline(CompilerConfig config) {
        this(config.maxDepth(), config.maxReplays());
    }

    /**
     * Creates an empty pipeline.
     * @param maxDepth The maximum nesting depth accepted.
     * @param maxReplays The maximum number of replacements processed for a single node.
     */
    public AstPipeline(int maxDepth, int maxReplays) {
        if (maxDepth <= 0 || maxReplays <= 0) {
            throw new IllegalArgumentException("Pipeline limits must be positive");
        }
        this.maxDepth = maxDepth;
        this.maxReplays = maxReplays;
    }

    /**
     * Adds a pass. Passes with equal priority run in insertion order.
     * @param pass The pass to add.
     * @param priority The ordering priority; lower runs first.
     * @return This pipeline, for chaining.
     */
    public AstPipeline addPass(IAstPass pass, int priority) {
        entries.add(new Entry(pass, priority, nextSequence++));
        reorder();
        return this;
    }

    /**
     * Inserts a pass directly before an already registered pass, at the anchor's priority.
     * @param anchor The registered pass.
     * @param pass The pass to insert.
     * @return This pipeline, for chaining.
     * @throws IllegalArgumentException if the anchor is not registered.
     */
    public AstPipeline insertBefore(IAstPass anchor, IAstPass pass) {
        return insertAnchored(anchor, pass, -1);
    }

    /**
     * Inserts a pass directly after an already registered pass, at the anchor's priority.
     * @param anchor The registered pass.
     * @param pass The pass to insert.
     * @return This pipeline, for chaining.
     * @throws IllegalArgumentException if the anchor is not registered.
     */
    public AstPipeline insertAfter(IAstPass anchor, IAstPass pass) {
        return insertAnchored(anchor, pass, 1);
    }

    private AstPipeline insertAnchored(IAstPass anchor, IAstPass pass, int offset) {
        // Spread the sequence numbers so the new entry fits between the anchor and its neighbour.
        for (int i = 0; i < entries.size(); i++) {
            Entry e = entries.get(i);
            entries.set(i, new Entry(e.pass(), e.priority(), 2L * i + 2));
        }
        Entry anchorEntry = entries.stream()
                .filter(e -> e.pass() == anchor)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Anchor pass is not registered: " + anchor.name()));
        entries.add(new Entry(pass, anchorEntry.priority(), anchorEntry.sequence() + offset));
        nextSequence = 2L * entries.size() + 2;
        reorder();
        return this;
    }

    private void reorder() {
        entries.sort(Comparator.comparingInt(Entry::priority).thenComparingLong(Entry::sequence));
        passes = entries.stream().map(Entry::pass).toList();
    }

    /**
     * @return The passes in execution order.
     */
    public List<IAstPass> getPasses() {
        return passes;
    }

    /**
     * Runs all passes over the document.
     * @param document The parsed document.
     * @param context The compilation context.
     * @return The rewritten document.
     * @throws TemplateException if a limit is exceeded or the result is not a single document.
     */
    public DocumentNode execute(DocumentNode document, CompilationContext context) {
        CompilerLogger.debug("Running {} passes: {}", passes.size(), passes.stream().map(IAstPass::name).toList());
        document.setParent(null);
        List<AstNode> result = walk(document, 0, new BitSet(), 0, context);
        if (result.size() != 1 || !(result.get(0) instanceof DocumentNode root)) {
            throw new TemplateException("Pipeline must produce exactly one document node, got " + result.size() + " nodes",
                    context.getTemplatePath(), 0, 0, null, null, null);
        }
        return root;
    }

    private List<AstNode> walk(AstNode start, int startPass, BitSet disabled, int depth, CompilationContext context) {
        if (depth > maxDepth) {
            throw new TemplateException("Template nesting exceeds the maximum depth of " + maxDepth,
                    context.getTemplatePath(), start.getLine(), start.getColumn(), null, null, null);
        }
        AstNode parent = start.getParent();
        Deque<Pending> worklist = new ArrayDeque<>();
        worklist.add(new Pending(start, startPass));
        List<AstNode> result = new ArrayList<>();
        int replays = 0;

        while (!worklist.isEmpty()) {
            Pending pending = worklist.removeFirst();
            AstNode node = pending.node();
            node.setParent(parent);

            NodeAction.Replace replacement = null;
            int replacedAt = -1;
            BitSet childDisabled = disabled;
            for (int i = pending.fromPass(); i < passes.size() && replacement == null; i++) {
                if (disabled.get(i)) {
                    continue;
                }
                NodeAction action = passes.get(i).before(node, context);
                if (action instanceof NodeAction.Replace replace) {
                    replacement = replace;
                    replacedAt = i;
                } else if (action instanceof NodeAction.SkipChildren) {
                    if (childDisabled == disabled) {
                        childDisabled = (BitSet) disabled.clone();
                    }
                    childDisabled.set(i);
                }
            }

            if (replacement == null) {
                if (node instanceof ContainerNode container) {
                    walkChildren(container, childDisabled, depth, context);
                }
                for (int i = pending.fromPass(); i < passes.size() && replacement == null; i++) {
                    if (disabled.get(i)) {
                        continue;
                    }
                    if (passes.get(i).after(node, context) instanceof NodeAction.Replace replace) {
                        replacement = replace;
                        replacedAt = i;
                    }
                }
            }

            if (replacement == null) {
                result.add(node);
                continue;
            }
            if (++replays > maxReplays) {
                throw new TemplateException("Node replacement limit of " + maxReplays + " exceeded",
                        context.getTemplatePath(), start.getLine(), start.getColumn(), null, null, null);
            }
            int next = replacement.restart() ? replacedAt : replacedAt + 1;
            List<AstNode> nodes = replacement.nodes();
            for (int k = nodes.size() - 1; k >= 0; k--) {
                worklist.addFirst(new Pending(nodes.get(k), next));
            }
        }
        return result;
    }

    private void walkChildren(ContainerNode container, BitSet disabled, int depth, CompilationContext context) {
        List<AstNode> walked = new ArrayList<>();
        for (AstNode child : List.copyOf(container.getChildren())) {
            child.setParent(container);
            walked.addAll(walk(child, 0, disabled, depth + 1, context));
        }
        container.setChildren(walked);
    }
}
