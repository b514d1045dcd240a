package org.tabular.lite.engine.fixup;

import org.tabular.lite.model.ModelNode;

import java.util.List;

/**
 * Outcome of applying a {@link FixupPlan}.
 *
 * @param rewritten Formulas whose text was changed
 * @param flagged   Formulas left unchanged and marked with an error
 */
public record FixupResult(List<ModelNode> rewritten, List<ModelNode> flagged) {

    public FixupResult {
        rewritten = List.copyOf(rewritten);
        flagged = List.copyOf(flagged);
    }
}
