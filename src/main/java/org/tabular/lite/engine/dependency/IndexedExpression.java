package org.tabular.lite.engine.dependency;

import org.tabular.lite.dax.Token;
import org.tabular.lite.model.NodeId;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The last tokenization of one formula and the references resolved from it.
 *
 * @param text       The formula text that was tokenized
 * @param tokens     The tokens, empty if tokenizing failed
 * @param references Reference spans in source order
 * @param mentions   Lower-cased names the formula spells, resolved or not
 * @param error      The tokenizer's message if tokenizing failed, otherwise null
 */
public record IndexedExpression(
        String text,
        List<Token> tokens,
        List<ReferenceSpan> references,
        Set<String> mentions,
        String error
) {

    public IndexedExpression {
        Objects.requireNonNull(text, "Text cannot be null");
        tokens = List.copyOf(tokens);
        references = List.copyOf(references);
        mentions = Set.copyOf(mentions);
    }

    static IndexedExpression failed(String text, String error) {
        return new IndexedExpression(text, List.of(), List.of(), Set.of(), error);
    }

    public boolean isTokenized() {
        return error == null;
    }

    /**
     * @return Ids of every node this formula references
     */
    public Set<NodeId> targets() {
        return references.stream()
                .filter(ReferenceSpan::isResolved)
                .map(ReferenceSpan::target)
                .collect(Collectors.toSet());
    }

    public List<ReferenceSpan> unresolved() {
        return references.stream().filter(r -> !r.isResolved()).toList();
    }
}
