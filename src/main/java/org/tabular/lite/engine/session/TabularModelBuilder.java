package org.tabular.lite.engine.session;

import org.tabular.lite.dax.DaxNames;
import org.tabular.lite.model.DataType;
import org.tabular.lite.model.ModelNode;

/**
 * Builds a model in a fresh session, e.g. when loading a model or setting up a test.
 *
 * Objects are added through the regular session operations, so the dependency index is
 * complete when {@link #build()} returns. The history recorded while building is cleared:
 * a freshly built model has nothing to undo.
 *
 * Columns in relationships are written in formula notation, {@code Sales[ProductKey]} or
 * {@code 'Sales Data'[ProductKey]}.
 */
public final class TabularModelBuilder {

    private final ModelingSession session;

    public TabularModelBuilder(String modelName) {
        this(modelName, SessionOptions.DEFAULTS);
    }

    public TabularModelBuilder(String modelName, SessionOptions options) {
        this.session = new ModelingSession(modelName, options);
    }

    public TabularModelBuilder addTable(String name) {
        session.addTable(name);
        return this;
    }

    public TabularModelBuilder addCalculatedTable(String name, String expression) {
        session.addCalculatedTable(name, expression);
        return this;
    }

    public TabularModelBuilder addDataColumn(String table, String name, DataType dataType) {
        session.addDataColumn(table(table), name, dataType);
        return this;
    }

    public TabularModelBuilder addCalculatedColumn(String table, String name, String expression) {
        session.addCalculatedColumn(table(table), name, expression);
        return this;
    }

    public TabularModelBuilder addMeasure(String table, String name, String expression) {
        session.addMeasure(table(table), name, expression);
        return this;
    }

    /**
     * Adds a relationship named "from -> to".
     *
     * @param from The many-side column, e.g. {@code Sales[ProductKey]}
     * @param to   The one-side column, e.g. {@code Product[ProductKey]}
     */
    public TabularModelBuilder addRelationship(String from, String to) {
        session.addRelationship(from + " -> " + to, column(from), column(to));
        return this;
    }

    /**
     * @return The session holding the built model, with empty undo history
     */
    public ModelingSession build() {
        session.clearHistory();
        return session;
    }

    private ModelNode table(String name) {
        return session.graph().findTable(name)
                .orElseThrow(() -> new IllegalStateException("Table not found: " + name));
    }

    private ModelNode column(String reference) {
        int bracket = reference.indexOf('[');
        if (bracket <= 0 || !reference.endsWith("]")) {
            throw new IllegalArgumentException("Expected Table[Column], got: " + reference);
        }
        String tableName = reference.substring(0, bracket);
        String columnName = DaxNames.unbracket(reference.substring(bracket));
        if (tableName.startsWith("'")) {
            tableName = DaxNames.unquote(tableName);
        }
        ModelNode table = table(tableName);
        return session.graph().findColumn(table, columnName)
                .orElseThrow(() -> new IllegalStateException("Column not found: " + reference));
    }
}
