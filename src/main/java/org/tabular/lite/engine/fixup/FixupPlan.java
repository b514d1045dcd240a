package org.tabular.lite.engine.fixup;

import org.tabular.lite.model.ModelNode;

import java.util.List;
import java.util.Set;

/**
 * The formula changes a rename or move implies, computed before the change is applied.
 *
 * @param target      The renamed or moved node
 * @param description What happened to the target, for logs and error markers
 * @param rewrites    Dependent formulas to rewrite, in ascending id order
 * @param suspects    Formulas that could not be tokenized but spell the target's old
 *                    name; they are left alone and flagged
 */
public record FixupPlan(ModelNode target, String description, List<Rewrite> rewrites, Set<ModelNode> suspects) {

    public FixupPlan {
        rewrites = List.copyOf(rewrites);
        suspects = Set.copyOf(suspects);
    }

    public static FixupPlan none(ModelNode target) {
        return new FixupPlan(target, "no fixup", List.of(), Set.of());
    }

    public boolean isEmpty() {
        return rewrites.isEmpty() && suspects.isEmpty();
    }
}
