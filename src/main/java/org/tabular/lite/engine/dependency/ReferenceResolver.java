package org.tabular.lite.engine.dependency;

import org.tabular.lite.dax.DaxNames;
import org.tabular.lite.dax.Token;
import org.tabular.lite.engine.dependency.ReferenceSpan.Part;
import org.tabular.lite.model.FormulaBearing;
import org.tabular.lite.model.ModelGraph;
import org.tabular.lite.model.ModelNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the tokens of a formula into reference spans, resolved against the current names
 * in the model.
 *
 * Resolution follows DAX:
 * - 'Sales' or a bare Sales that is not a function call names a table
 * - A table token directly followed by [X] is qualified: X is a column, else a measure,
 *   of that table
 * - An unqualified [X] names a column of the formula's owning table, else a measure
 *   anywhere in the model
 *
 * Names compare case-insensitively.
 */
final class ReferenceResolver {

    /**
     * @param spans    Reference spans in source order
     * @param mentions Lower-cased names spelled by the formula
     */
    record Resolution(List<ReferenceSpan> spans, Set<String> mentions) {
    }

    private final ModelGraph graph;

    ReferenceResolver(ModelGraph graph) {
        this.graph = graph;
    }

    Resolution resolve(FormulaBearing formula, List<Token> tokens) {
        List<ReferenceSpan> spans = new ArrayList<>();
        Set<String> mentions = new HashSet<>();

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;

            if (token.kind() == Token.Kind.BRACKETED_REFERENCE) {
                mentions.add(lower(token.referenceName()));
                Optional<ModelNode> target = resolveUnqualified(formula, token.referenceName());
                spans.add(span(token, Part.OBJECT, target, Optional.empty()));
                continue;
            }

            boolean tableLike = token.kind() == Token.Kind.QUOTED_QUALIFIED_REFERENCE
                    || token.kind() == Token.Kind.IDENTIFIER;
            if (!tableLike) {
                continue;
            }

            boolean qualified = next != null
                    && next.kind() == Token.Kind.BRACKETED_REFERENCE
                    && token.touches(next);
            if (token.kind() == Token.Kind.IDENTIFIER && !qualified
                    && (DaxNames.isKeyword(token.text()) || isCall(tokens, i))) {
                continue;
            }

            mentions.add(lower(token.referenceName()));
            Optional<ModelNode> table = graph.findTable(token.referenceName());

            if (qualified) {
                mentions.add(lower(next.referenceName()));
                Optional<ModelNode> object = table.flatMap(t -> graph.findColumnOrMeasure(t, next.referenceName()));
                spans.add(span(token, Part.TABLE, table, object));
                spans.add(span(next, Part.OBJECT, object, Optional.empty()));
                i++;
            } else if (table.isPresent() || token.kind() == Token.Kind.QUOTED_QUALIFIED_REFERENCE) {
                // A bare identifier that names no table is a variable, not a reference
                spans.add(span(token, Part.TABLE, table, Optional.empty()));
            }
        }

        return new Resolution(spans, mentions);
    }

    private Optional<ModelNode> resolveUnqualified(FormulaBearing formula, String name) {
        Optional<ModelNode> column = formula.owningTable().flatMap(t -> graph.findColumn(t, name));
        if (column.isPresent()) {
            return column;
        }
        return graph.findMeasure(name);
    }

    /**
     * @return true if the identifier at index is followed, ignoring comments, by "("
     */
    private static boolean isCall(List<Token> tokens, int index) {
        for (int j = index + 1; j < tokens.size(); j++) {
            Token t = tokens.get(j);
            if (t.kind() != Token.Kind.COMMENT) {
                return t.text().equals("(");
            }
        }
        return false;
    }

    private static ReferenceSpan span(Token token, Part part, Optional<ModelNode> target, Optional<ModelNode> qualifies) {
        return new ReferenceSpan(
                token.start(),
                token.end(),
                part,
                token.text(),
                target.map(ModelNode::id).orElse(null),
                qualifies.map(ModelNode::id).orElse(null));
    }

    static String lower(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
