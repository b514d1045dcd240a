package org.tabular.lite.engine.fixup;

import org.jboss.logging.Logger;
import org.tabular.lite.dax.DaxNames;
import org.tabular.lite.engine.dependency.DependencyIndex;
import org.tabular.lite.engine.dependency.FormulaFlag;
import org.tabular.lite.engine.dependency.IndexedExpression;
import org.tabular.lite.engine.dependency.ReferenceSpan;
import org.tabular.lite.model.ModelNode;
import org.tabular.lite.model.NodeKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Rewrites formulas that reference a node when the node is renamed or moved to another
 * table.
 *
 * Work happens in two steps around the change itself:
 * 1. {@code plan...} runs before the change, while the dependency index still resolves
 *    the old name, and records for every dependent the spans to replace
 * 2. {@link #apply} runs after the change and writes each rewritten formula through the
 *    caller's {@link ExpressionWriter}, so the writes are recorded in the same undo batch
 *
 * Only spans the tokenizer classified as references are replaced. Matching text inside
 * string literals or comments is never touched, and all other text keeps its exact form.
 * Dependents are processed in ascending id order.
 */
public final class FormulaFixupEngine {

    private static final Logger LOG = Logger.getLogger(FormulaFixupEngine.class);

    /**
     * Applies a rewritten formula through the normal, recorded mutation path.
     */
    @FunctionalInterface
    public interface ExpressionWriter {
        void write(ModelNode node, String expression);
    }

    /**
     * Sets the flag of a formula that could not be rewritten, through a recorded path.
     */
    @FunctionalInterface
    public interface FlagWriter {
        void flag(ModelNode node, FormulaFlag flag);
    }

    private final DependencyIndex index;

    public FormulaFixupEngine(DependencyIndex index) {
        this.index = index;
    }

    /**
     * Plans the rewrites for renaming a reference target.
     *
     * @param target  The node about to be renamed
     * @param newName Its new name
     * @return The plan; empty if the node is not a reference target
     */
    public FixupPlan planRename(ModelNode target, String newName) {
        if (!target.kind().isReferenceTarget()) {
            return FixupPlan.none(target);
        }
        String description = "renaming " + target + " to '" + newName + "'";
        List<Rewrite> rewrites = plan(target, span -> span.target() != null && span.target().equals(target.id())
                ? renamedText(span, newName)
                : null);
        return new FixupPlan(target, description, rewrites, index.untokenizedMentioning(target.name()));
    }

    /**
     * Plans the rewrites for moving a measure to another table: table qualifiers in front
     * of the measure name now have to name the new table. Unqualified references stay
     * valid because measure names are unique in the model and never match a column.
     *
     * @param target   The measure about to be moved
     * @param newTable The table it moves to
     * @return The plan
     */
    public FixupPlan planMove(ModelNode target, ModelNode newTable) {
        if (target.kind() != NodeKind.MEASURE) {
            return FixupPlan.none(target);
        }
        String description = "moving " + target + " to " + newTable;
        List<Rewrite> rewrites = plan(target, span -> span.part() == ReferenceSpan.Part.TABLE
                && target.id().equals(span.qualifies())
                ? DaxNames.tableReference(span.text(), newTable.name())
                : null);
        return new FixupPlan(target, description, rewrites, index.untokenizedMentioning(target.name()));
    }

    /**
     * @param replacementFor Gives the new text of a span, or null to leave it
     */
    private List<Rewrite> plan(ModelNode target, Function<ReferenceSpan, String> replacementFor) {
        List<Rewrite> rewrites = new ArrayList<>();
        for (ModelNode dependent : index.getDependents(target)) {
            List<Replacement> replacements = new ArrayList<>();
            for (ReferenceSpan span : index.referenceSpans(dependent, target.id())) {
                String replacement = replacementFor.apply(span);
                if (replacement != null && !replacement.equals(span.text())) {
                    replacements.add(new Replacement(span.start(), span.end(), span.text(), replacement));
                }
            }
            if (!replacements.isEmpty()) {
                rewrites.add(new Rewrite(dependent, dependent.expression(), replacements));
            }
        }
        return rewrites;
    }

    private static String renamedText(ReferenceSpan span, String newName) {
        return switch (span.part()) {
            case TABLE -> DaxNames.tableReference(span.text(), newName);
            case OBJECT -> DaxNames.bracket(newName);
        };
    }

    /**
     * Applies a plan after the rename or move it was computed for.
     *
     * @param plan    The plan
     * @param writer  Records each rewritten formula
     * @param flagger Records the flag of each formula that could not be rewritten
     * @return What was rewritten and what was flagged
     */
    public FixupResult apply(FixupPlan plan, ExpressionWriter writer, FlagWriter flagger) {
        List<ModelNode> rewritten = new ArrayList<>();
        for (Rewrite rewrite : plan.rewrites()) {
            ModelNode dependent = rewrite.dependent();
            if (!dependent.expression().equals(rewrite.originalText())) {
                throw new IllegalStateException("Formula of " + dependent + " changed while " + plan.description());
            }
            writer.write(dependent, rewrite.apply());
            rewritten.add(dependent);
        }

        List<ModelNode> flagged = new ArrayList<>();
        for (ModelNode suspect : sorted(plan.suspects())) {
            String cause = index.indexed(suspect)
                    .map(IndexedExpression::error)
                    .orElse("formula cannot be tokenized");
            String message = "Formula not updated after " + plan.description() + ": " + cause;
            flagger.flag(suspect, new FormulaFlag(suspect.expression(), message));
            flagged.add(suspect);
            LOG.warnf("Formula of %s was not updated after %s: %s", suspect, plan.description(), cause);
        }

        if (!rewritten.isEmpty()) {
            LOG.debugf("Rewrote %d formulas after %s", rewritten.size(), plan.description());
        }
        return new FixupResult(rewritten, flagged);
    }

    private static List<ModelNode> sorted(Set<ModelNode> nodes) {
        return nodes.stream().sorted(Comparator.comparing(ModelNode::id)).toList();
    }
}
