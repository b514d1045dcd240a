package org.tabular.lite.engine.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.tabular.lite.engine.undo.UndoManager;
import org.tabular.lite.model.DataType;
import org.tabular.lite.model.InvalidMoveException;
import org.tabular.lite.model.InvalidValueException;
import org.tabular.lite.model.ModelChangeEvent;
import org.tabular.lite.model.ModelGraph;
import org.tabular.lite.model.ModelNode;
import org.tabular.lite.model.ModelPermission;
import org.tabular.lite.model.NameConflictException;
import org.tabular.lite.model.NodeKind;
import org.tabular.lite.model.NodeProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the session boundary: validated edits, undo/redo of whole transactions and
 * formula fixup on rename and move.
 */
public class ModelingSessionTest {

    private ModelingSession session;

    @BeforeEach
    void setUp() {
        session = new TabularModelBuilder("Model")
                .addTable("Sales")
                .addDataColumn("Sales", "Amount", DataType.DECIMAL)
                .addDataColumn("Sales", "ProductKey", DataType.INT64)
                .addMeasure("Sales", "M1", "1")
                .addMeasure("Sales", "M2", "[M1] + 1")
                .addMeasure("Sales", "Total", "SUM(Sales[Amount])")
                .addTable("Product")
                .addDataColumn("Product", "ProductKey", DataType.INT64)
                .addDataColumn("Product", "Price", DataType.DECIMAL)
                .addCalculatedColumn("Product", "Margin", "[Price] * 0.1")
                .addMeasure("Product", "Share", "Sales[Total] / CALCULATE([Total], ALL('Sales'))")
                .addRelationship("Sales[ProductKey]", "Product[ProductKey]")
                .build();
    }

    private ModelNode table(String name) {
        return session.graph().findTable(name).orElseThrow();
    }

    private ModelNode measure(String name) {
        return session.graph().findMeasure(name).orElseThrow();
    }

    private ModelNode column(String table, String name) {
        return session.graph().findColumn(table(table), name).orElseThrow();
    }

    private int undoDepth() {
        return session.undoManager().undoDepth();
    }

    /**
     * Everything observable about the model: structure, every property, the dependency
     * edges and formula errors.
     */
    private String snapshot() {
        ModelGraph graph = session.graph();
        StringBuilder sb = new StringBuilder();
        graph.subtree(graph.root()).forEach(n -> {
            sb.append(n.id()).append(' ').append(n.kind())
                    .append(" parent=").append(n.parent().map(p -> p.id().toString()).orElse("-"))
                    .append(" index=").append(n.index());
            for (NodeProperty property : NodeProperty.values()) {
                if (n.kind().supports(property)) {
                    sb.append(' ').append(property).append('=').append(n.get(property));
                }
            }
            if (n.kind().isReferenceTarget()) {
                sb.append(" dependents=").append(session.getDependents(n).stream().map(ModelNode::id).toList());
            }
            if (n.kind().isFormulaBearing()) {
                sb.append(" references=").append(session.getReferences(n).stream().map(ModelNode::id).toList());
                sb.append(" error=").append(session.errorOf(n).orElse("-"));
            }
            sb.append('\n');
        });
        return sb.toString();
    }

    @Nested
    @DisplayName("Rename")
    class Rename {

        @Test
        @DisplayName("Renaming a measure rewrites dependents; one undo restores both")
        void testRenameMeasureAndUndo() {
            // GIVEN: M2 = [M1] + 1
            ModelNode m1 = measure("M1");
            ModelNode m2 = measure("M2");

            // WHEN: M1 is renamed
            session.rename(m1, "M1Renamed");

            // THEN: M2 follows, in a single transaction
            assertEquals("[M1Renamed] + 1", m2.expression());
            assertEquals(Set.of(m2), session.getDependents(m1));
            assertEquals(1, undoDepth());
            assertEquals(List.of("Rename Measure 'M1'"), session.undoManager().undoLabels());

            // WHEN: undone once
            assertTrue(session.undo());

            // THEN: name and formula are back, and the edge still holds
            assertEquals("M1", m1.name());
            assertEquals("[M1] + 1", m2.expression());
            assertEquals(Set.of(m2), session.getDependents(m1));
        }

        @Test
        @DisplayName("Redo re-applies the rename with its fixups")
        void testRenameRedo() {
            ModelNode m1 = measure("M1");
            session.rename(m1, "M1Renamed");
            String afterRename = snapshot();

            session.undo();
            session.redo();

            assertEquals(afterRename, snapshot());
            assertEquals("[M1Renamed] + 1", measure("M2").expression());
        }

        @Test
        @DisplayName("Renaming to a taken name fails without any change")
        void testNameConflict() {
            ModelNode m1 = measure("M1");
            String before = snapshot();

            assertThrows(NameConflictException.class, () -> session.rename(m1, "M2"));
            assertThrows(NameConflictException.class, () -> session.rename(m1, "share"));

            assertEquals("M1", m1.name());
            assertEquals(0, undoDepth());
            assertEquals(before, snapshot());
        }

        @Test
        @DisplayName("A measure cannot take a column's name, so its dependents keep pointing at it")
        void testMeasureTakesColumnName() {
            ModelNode m1 = measure("M1");
            ModelNode m2 = measure("M2");
            String before = snapshot();

            NameConflictException e = assertThrows(NameConflictException.class, () -> session.rename(m1, "Amount"));
            assertEquals(column("Sales", "Amount").id(), e.getExistingId());
            assertThrows(NameConflictException.class, () -> session.rename(m1, "price"));
            assertThrows(NameConflictException.class, () -> session.addMeasure(table("Product"), "AMOUNT", "1"));

            assertEquals("[M1] + 1", m2.expression());
            assertEquals(Set.of(m2), session.getDependents(m1));
            assertEquals(0, undoDepth());
            assertEquals(before, snapshot());
        }

        @Test
        @DisplayName("A column cannot take a measure's name, so measure references are not taken over")
        void testColumnTakesMeasureName() {
            ModelNode amount = column("Sales", "Amount");
            String before = snapshot();

            NameConflictException e = assertThrows(NameConflictException.class, () -> session.rename(amount, "M1"));
            assertEquals(measure("M1").id(), e.getExistingId());
            assertThrows(NameConflictException.class, () -> session.rename(column("Product", "Price"), "total"));
            assertThrows(NameConflictException.class, () -> session.addCalculatedColumn(table("Sales"), "M2", "1"));

            assertEquals(Set.of(measure("M2")), session.getDependents(measure("M1")));
            assertEquals(0, undoDepth());
            assertEquals(before, snapshot());
        }

        @Test
        @DisplayName("Undo restores the error the flagged formula had before the rename; redo flags it again")
        void testTokenizeFailureUndo() {
            // GIVEN: a broken formula that spells M1
            ModelNode broken = session.addMeasure(table("Sales"), "Broken", "[M1] + [Unclosed");
            String tokenizerError = session.errorOf(broken).orElseThrow();
            String before = snapshot();

            // WHEN: M1 is renamed
            session.rename(measure("M1"), "First");
            String flagged = session.errorOf(broken).orElseThrow();
            String after = snapshot();
            assertTrue(flagged.startsWith("Formula not updated after renaming Measure 'M1'"));

            // THEN: undo brings back the tokenizer error, redo the flag
            session.undo();
            assertEquals(tokenizerError, session.errorOf(broken).orElseThrow());
            assertEquals(before, snapshot());

            session.redo();
            assertEquals(flagged, session.errorOf(broken).orElseThrow());
            assertEquals(after, snapshot());
        }

        @Test
        @DisplayName("A flag applies only to the text it was set on")
        void testFlagFollowsText() {
            ModelNode broken = session.addMeasure(table("Sales"), "Broken", "[M1] + [Unclosed");
            session.rename(measure("M1"), "First");
            String flagged = session.errorOf(broken).orElseThrow();

            // A fixed formula has no error; a differently broken one shows its own
            session.setExpression(broken, "[First] + 2");
            assertTrue(session.errorOf(broken).isEmpty());
            session.setExpression(broken, "[First");
            assertFalse(session.errorOf(broken).orElseThrow().contains("not updated"));

            // Undoing back to the flagged text shows the flag again
            session.undo();
            session.undo();
            assertEquals(flagged, session.errorOf(broken).orElseThrow());
        }

        @Test
        @DisplayName("Invalid names are rejected")
        void testInvalidName() {
            assertThrows(InvalidValueException.class, () -> session.rename(measure("M1"), ""));
            assertThrows(InvalidValueException.class, () -> session.rename(measure("M1"), "a\nb"));
            assertEquals(0, undoDepth());
        }

        @Test
        @DisplayName("Only the reference outside the string literal is rewritten")
        void testStringLiteral() {
            ModelNode m3 = session.addMeasure(table("Sales"), "M3", "\"[M1]\" + [M1]");

            session.rename(measure("M1"), "M1Renamed");

            assertEquals("\"[M1]\" + [M1Renamed]", m3.expression());
        }

        @Test
        @DisplayName("Renaming to the same name records nothing; a case change is a rename")
        void testSameName() {
            session.rename(measure("M1"), "M1");
            assertEquals(0, undoDepth());

            session.rename(measure("M1"), "m1");
            assertEquals("[m1] + 1", measure("M2").expression());
            assertEquals(1, undoDepth());
        }

        @Test
        @DisplayName("Table rename rewrites bare and quoted qualifiers")
        void testRenameTable() {
            session.rename(table("Sales"), "Orders");

            assertEquals("SUM(Orders[Amount])", measure("Total").expression());
            assertEquals("Orders[Total] / CALCULATE([Total], ALL('Orders'))", measure("Share").expression());

            session.rename(table("Orders"), "Sales Data");

            assertEquals("SUM('Sales Data'[Amount])", measure("Total").expression());
            assertEquals("'Sales Data'[Total] / CALCULATE([Total], ALL('Sales Data'))", measure("Share").expression());
        }

        @Test
        @DisplayName("Column rename rewrites qualified and unqualified references")
        void testRenameColumn() {
            ModelNode amount = column("Sales", "Amount");
            ModelNode avg = session.addMeasure(table("Sales"), "Avg", "AVERAGE([Amount]) + 0 * Sales[Amount]");

            session.rename(amount, "Net Amount");

            assertEquals("SUM(Sales[Net Amount])", measure("Total").expression());
            assertEquals("AVERAGE([Net Amount]) + 0 * Sales[Net Amount]", avg.expression());
            assertEquals(Set.of(measure("Total"), avg), session.getDependents(amount));
        }

        @Test
        @DisplayName("Untokenizable dependent is flagged and left alone; the rename succeeds")
        void testTokenizeFailure() {
            ModelNode broken = session.addMeasure(table("Sales"), "Broken", "[M1] + [Unclosed");
            assertTrue(session.errorOf(broken).isPresent());
            int depth = undoDepth();

            session.rename(measure("M1"), "First");

            assertEquals("First", measure("First").name());
            assertEquals("[First] + 1", measure("M2").expression());
            assertEquals("[M1] + [Unclosed", broken.expression());
            assertTrue(session.errorOf(broken).orElseThrow().contains("not updated"));
            assertEquals(depth + 1, undoDepth());
        }

        @Test
        @DisplayName("With fixup disabled a rename leaves formulas and their references dangle")
        void testFixupDisabled() {
            session = new TabularModelBuilder("Model", SessionOptions.DEFAULTS.withFormulaFixup(false))
                    .addTable("Sales")
                    .addMeasure("Sales", "M1", "1")
                    .addMeasure("Sales", "M2", "[M1] + 1")
                    .build();

            session.rename(measure("M1"), "First");

            assertEquals("[M1] + 1", measure("M2").expression());
            assertTrue(session.getReferences(measure("M2")).isEmpty());
        }

        @Test
        @DisplayName("NAME through setProperty is a rename with fixup")
        void testRenameThroughSetProperty() {
            session.setProperty(measure("M1"), NodeProperty.NAME, "Base");

            assertEquals("[Base] + 1", measure("M2").expression());
            assertEquals(1, undoDepth());
        }
    }

    @Nested
    @DisplayName("Move")
    class Move {

        @Test
        @DisplayName("Moving a measure rewrites its table qualifiers; undo moves it back")
        void testMoveMeasure() {
            ModelNode total = measure("Total");
            ModelNode share = measure("Share");
            ModelNode product = table("Product");
            String before = snapshot();

            session.move(total, product);

            assertEquals(product, total.parent().orElseThrow());
            assertEquals(product.children().size() - 1, total.index());
            assertEquals("Product[Total] / CALCULATE([Total], ALL('Sales'))", share.expression());
            assertEquals("SUM(Sales[Amount])", total.expression());
            assertEquals(Set.of(share), session.getDependents(total));
            assertEquals(1, undoDepth());

            session.undo();

            assertEquals(before, snapshot());
        }

        @Test
        @DisplayName("A measure never lands in a table beside a column of its name")
        void testMoveNextToSameNamedColumn() {
            ModelNode total = measure("Total");
            ModelNode share = measure("Share");
            ModelNode product = table("Product");
            String before = snapshot();

            // GIVEN: Product cannot get a column named after the measure it might receive
            assertThrows(NameConflictException.class, () -> session.addDataColumn(product, "Total", DataType.DECIMAL));
            assertThrows(NameConflictException.class, () -> session.rename(column("Product", "Price"), "Total"));

            // WHEN: the measure moves there
            session.move(total, product);

            // THEN: the rewritten qualifier still resolves to the measure
            assertEquals("Product[Total] / CALCULATE([Total], ALL('Sales'))", share.expression());
            assertEquals(Set.of(table("Sales"), product, total), session.getReferences(share));
            assertEquals(Set.of(share), session.getDependents(total));

            session.undo();
            assertEquals(before, snapshot());
        }

        @Test
        @DisplayName("Reordering within a table needs no fixup")
        void testReorder() {
            ModelNode sales = table("Sales");
            ModelNode m2 = measure("M2");

            session.move(m2, sales, 0);

            assertEquals(m2, sales.children().get(0));
            assertEquals("[M1] + 1", m2.expression());

            session.move(m2, sales, 0);
            assertEquals(1, undoDepth());
        }

        @Test
        @DisplayName("Illegal moves are rejected without any change")
        void testIllegalMoves() {
            String before = snapshot();
            ModelNode sales = table("Sales");
            ModelNode product = table("Product");

            assertThrows(InvalidMoveException.class, () -> session.move(column("Sales", "Amount"), product));
            assertThrows(InvalidMoveException.class, () -> session.move(measure("M1"), column("Sales", "Amount")));
            assertThrows(InvalidMoveException.class, () -> session.move(measure("M1"), session.model()));
            assertThrows(InvalidMoveException.class, () -> session.move(measure("M1"), product, 99));
            assertThrows(InvalidMoveException.class, () -> session.move(sales, sales));
            assertThrows(InvalidMoveException.class, () -> session.move(session.model(), sales));

            assertEquals(before, snapshot());
            assertEquals(0, undoDepth());
        }
    }

    @Nested
    @DisplayName("Add and remove")
    class AddRemove {

        @Test
        @DisplayName("Adding validates placement and name before creating anything")
        void testAddValidation() {
            assertThrows(InvalidMoveException.class, () -> session.addNode(session.model(), NodeKind.MEASURE, "X"));
            assertThrows(NameConflictException.class, () -> session.addMeasure(table("Product"), "m1", "2"));
            assertThrows(NameConflictException.class, () -> session.addDataColumn(table("Sales"), "AMOUNT", DataType.STRING));
            assertThrows(InvalidMoveException.class, () -> session.addNode(table("Sales"), NodeKind.HIERARCHY, "H", 42));

            assertEquals(0, undoDepth());
        }

        @Test
        @DisplayName("Convenience adders produce one transaction each")
        void testAdders() {
            ModelNode sales = table("Sales");

            ModelNode hierarchy = session.addHierarchy(sales, "Calendar");
            ModelNode perspective = session.addPerspective("Finance");
            ModelNode annotation = session.addAnnotation(sales, "Owner", "BI team");
            ModelNode calc = session.addCalculatedTable("Top", "TOPN(10, Sales)");

            assertEquals(4, undoDepth());
            assertEquals(sales, hierarchy.parent().orElseThrow());
            assertEquals(session.model(), perspective.parent().orElseThrow());
            assertEquals("BI team", annotation.get(NodeProperty.VALUE));
            assertEquals(Set.of(sales), session.getReferences(calc));
        }

        @Test
        @DisplayName("Relationship needs columns of two different tables")
        void testRelationshipValidation() {
            ModelNode amount = column("Sales", "Amount");
            ModelNode key = column("Sales", "ProductKey");

            assertThrows(InvalidValueException.class, () -> session.addRelationship("Self", amount, key));
            assertThrows(InvalidValueException.class, () -> session.addRelationship("Bad", measure("M1"), key));
            assertEquals(0, undoDepth());
        }

        @Test
        @DisplayName("Removing a column removes its relationships; undo restores both")
        void testRemoveCascade() {
            ModelNode key = column("Sales", "ProductKey");
            ModelNode relationship = session.model().children(NodeKind.RELATIONSHIP).get(0);
            String before = snapshot();

            session.removeNode(key);

            assertFalse(key.isAttached());
            assertFalse(relationship.isAttached());
            assertEquals(1, undoDepth());

            session.undo();

            assertTrue(relationship.isAttached());
            assertEquals(key.id(), relationship.get(NodeProperty.FROM_COLUMN));
            assertEquals(before, snapshot());
        }

        @Test
        @DisplayName("Removing a table leaves dependents dangling until undo")
        void testRemoveTable() {
            ModelNode sales = table("Sales");
            ModelNode share = measure("Share");

            session.removeNode(sales);

            assertEquals("Sales[Total] / CALCULATE([Total], ALL('Sales'))", share.expression());
            assertTrue(session.getReferences(share).isEmpty());
            assertTrue(session.model().children(NodeKind.RELATIONSHIP).isEmpty());

            session.undo();

            assertEquals(Set.of(sales, measure("Total")), session.getReferences(share));
        }

        @Test
        @DisplayName("The model itself cannot be removed")
        void testRemoveRoot() {
            assertThrows(InvalidMoveException.class, () -> session.removeNode(session.model()));
        }

        @Test
        @DisplayName("Detached nodes are not accepted")
        void testDetachedNode() {
            ModelNode m1 = measure("M1");
            session.removeNode(m1);

            assertThrows(IllegalArgumentException.class, () -> session.rename(m1, "Gone"));
        }
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        @Test
        @DisplayName("Illegal values are rejected before anything is recorded")
        void testInvalidValues() {
            ModelNode amount = column("Sales", "Amount");
            ModelNode relationship = session.model().children(NodeKind.RELATIONSHIP).get(0);

            assertThrows(InvalidValueException.class, () -> session.setProperty(amount, NodeProperty.IS_HIDDEN, "yes"));
            assertThrows(InvalidValueException.class, () -> session.setProperty(amount, NodeProperty.MODEL_PERMISSION, null));
            assertThrows(InvalidValueException.class, () -> session.setExpression(amount, "1"));
            assertThrows(InvalidValueException.class, () -> session.setExpression(measure("M1"), null));
            assertThrows(InvalidValueException.class,
                    () -> session.setProperty(relationship, NodeProperty.FROM_COLUMN, measure("M1").id()));

            assertEquals(0, undoDepth());
        }

        @Test
        @DisplayName("Writing the current value is not an edit")
        void testUnchangedValue() {
            ModelNode m1 = measure("M1");

            session.setProperty(m1, NodeProperty.FORMAT_STRING, "0.00");
            session.setProperty(m1, NodeProperty.FORMAT_STRING, "0.00");
            session.setExpression(m1, "1");

            assertEquals(1, undoDepth());
        }

        @Test
        @DisplayName("Listeners see each applied change")
        void testListener() {
            List<ModelChangeEvent> events = new ArrayList<>();
            session.addListener(events::add);

            session.rename(measure("M1"), "First");

            assertEquals(2, events.size());
            assertTrue(events.get(0).isPropertyChange(NodeProperty.NAME));
            assertTrue(events.get(1).isPropertyChange(NodeProperty.EXPRESSION));
        }
    }

    @Nested
    @DisplayName("History")
    class History {

        @Test
        @DisplayName("Each edit followed by undo restores the full model state")
        void testEditThenUndo() {
            Map<String, Runnable> edits = new LinkedHashMap<>();
            edits.put("rename measure", () -> session.rename(measure("M1"), "M1Renamed"));
            edits.put("rename table", () -> session.rename(table("Sales"), "Sales Data"));
            edits.put("rename column", () -> session.rename(column("Sales", "Amount"), "Value"));
            edits.put("move measure", () -> session.move(measure("Total"), table("Product")));
            edits.put("reorder", () -> session.move(measure("M2"), table("Sales"), 0));
            edits.put("set expression", () -> session.setExpression(measure("M2"), "[M1] * [Total]"));
            edits.put("set property", () -> session.setProperty(column("Product", "Price"), NodeProperty.IS_HIDDEN, true));
            edits.put("add measure", () -> session.addMeasure(table("Product"), "Late", "[Share] + [M1]"));
            edits.put("add column", () -> session.addCalculatedColumn(table("Sales"), "Double", "[Amount] * 2"));
            edits.put("remove column", () -> session.removeNode(column("Sales", "ProductKey")));
            edits.put("remove measure", () -> session.removeNode(measure("M1")));
            edits.put("remove table", () -> session.removeNode(table("Product")));
            edits.put("add role", () -> session.addRole("Readers", ModelPermission.READ));

            for (Map.Entry<String, Runnable> edit : edits.entrySet()) {
                String before = snapshot();
                int depth = undoDepth();

                edit.getValue().run();
                assertEquals(depth + 1, undoDepth(), edit.getKey());
                String after = snapshot();
                assertNotEquals(before, after, edit.getKey());

                assertTrue(session.undo(), edit.getKey());
                assertEquals(before, snapshot(), edit.getKey());

                assertTrue(session.redo(), edit.getKey());
                assertEquals(after, snapshot(), edit.getKey());

                assertTrue(session.undo(), edit.getKey());
                assertEquals(before, snapshot(), edit.getKey());
            }
        }

        @Test
        @DisplayName("A batch of edits is one entry, undone by one undo")
        void testBatch() {
            String before = snapshot();

            session.beginBatch("Refactor");
            session.rename(measure("M1"), "Base");
            session.setExpression(measure("M2"), "[Base] * 2");
            session.addMeasure(table("Sales"), "Triple", "[Base] * 3");
            session.endBatch();

            assertEquals(List.of("Refactor"), session.undoManager().undoLabels());
            session.undo();
            assertEquals(before, snapshot());
            assertFalse(session.canUndo());
            assertTrue(session.canRedo());
        }

        @Test
        @DisplayName("A fresh edit after undo discards redo")
        void testRedoDiscarded() {
            session.rename(measure("M1"), "Base");
            session.undo();

            session.setProperty(measure("M1"), NodeProperty.DESCRIPTION, "base value");

            assertFalse(session.canRedo());
            assertFalse(session.redo());
        }

        @Test
        @DisplayName("A failing edit inside a batch keeps the earlier edits for the caller to undo")
        void testNoRollback() {
            ModelNode m1 = measure("M1");

            assertThrows(NameConflictException.class, () -> {
                try (UndoManager.Batch batch = session.batch("Edits")) {
                    session.setProperty(m1, NodeProperty.DESCRIPTION, "first");
                    session.rename(m1, "M2");
                }
            });

            assertEquals("first", m1.get(NodeProperty.DESCRIPTION));
            assertFalse(session.undoManager().isBatchOpen());
            assertEquals(1, undoDepth());

            session.undo();
            assertEquals("", m1.get(NodeProperty.DESCRIPTION));
        }

        @Test
        @DisplayName("History limit from options bounds the undo stack")
        void testHistoryLimit() {
            session = new ModelingSession("Model", SessionOptions.DEFAULTS.withMaxUndoHistory(2));
            ModelNode sales = session.addTable("Sales");

            session.addMeasure(sales, "A", "1");
            session.addMeasure(sales, "B", "2");

            assertEquals(2, undoDepth());
            session.undo();
            session.undo();
            assertFalse(session.undo());
            assertTrue(sales.isAttached());
        }

        @Test
        @DisplayName("Empty history makes undo and redo no-ops")
        void testEmptyHistory() {
            String before = snapshot();

            assertFalse(session.undo());
            assertFalse(session.redo());
            assertEquals(before, snapshot());
        }
    }
}
