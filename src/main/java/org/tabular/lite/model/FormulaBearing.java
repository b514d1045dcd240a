package org.tabular.lite.model;

import java.util.Optional;

/**
 * Capability of a node that carries a formula expression.
 *
 * The dependency index and the formula fixup work against this view only, so they never
 * need to know which node kinds hold formulas.
 */
public interface FormulaBearing {

    /**
     * @return The node holding the formula
     */
    ModelNode node();

    /**
     * @return The current formula text, never null
     */
    String expression();

    /**
     * @return The table whose columns an unqualified column reference in this formula
     *         names, empty for formulas that are not evaluated in a row context
     */
    Optional<ModelNode> owningTable();

    default NodeId id() {
        return node().id();
    }
}
