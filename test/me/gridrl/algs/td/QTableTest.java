package me.gridrl.algs.td;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import me.gridrl.algs.ValueFunction;
import me.gridrl.grids.Cell;

public class QTableTest {

    @Test
    public void testRowsAreCreatedLazilyAndZeroFilled() {
        QTable<Cell> lTable = new QTable<>(4);
        Cell lCell = new Cell(1, 2);
        assertFalse(lTable.contains(lCell));
        assertTrue(lTable.getStates().isEmpty());

        assertEquals(0.0, lTable.get(lCell, 3), 0);
        assertTrue(lTable.contains(lCell));
        assertArrayEquals(new double[4], lTable.getRow(lCell), 0);
        assertSame(lTable.getRow(lCell), lTable.getRow(new Cell(1, 2)));
        assertEquals(1, lTable.getStates().size());
    }

    @Test
    public void testBestActionAndValue() {
        QTable<Cell> lTable = new QTable<>(4);
        Cell lCell = new Cell(0, 0);
        lTable.set(lCell, 0, -3);
        lTable.set(lCell, 1, -1);
        lTable.set(lCell, 2, -1);
        lTable.set(lCell, 3, -2);
        assertEquals(-1, lTable.getBestValue(lCell), 0);
        // Deterministic: the first of the tied actions.
        assertEquals(1, lTable.getBestAction(lCell));
    }

    @Test
    public void testBestActionWithNoFiniteValues() {
        QTable<Cell> lTable = new QTable<>(3);
        Cell lCell = new Cell(0, 0);
        for (int lAction = 0; lAction < 3; lAction++) {
            lTable.set(lCell, lAction, Double.NEGATIVE_INFINITY);
        }
        assertEquals(0, lTable.getBestAction(lCell));

        lTable.set(lCell, 1, Double.NaN);
        lTable.set(lCell, 2, Double.NaN);
        lTable.set(lCell, 0, Double.NaN);
        assertEquals(0, lTable.getBestAction(lCell));
    }

    @Test
    public void testConversionToValueFunction() {
        QTable<Cell> lTable = new QTable<>(2);
        lTable.set(new Cell(0, 0), 1, 5);
        lTable.set(new Cell(0, 1), 0, -2);
        lTable.set(new Cell(0, 1), 1, -4);
        ValueFunction<Cell> lValues = lTable.toValueFunction();
        assertEquals(5, lValues.get(new Cell(0, 0)), 0);
        assertEquals(-2, lValues.get(new Cell(0, 1)), 0);
        assertEquals(2, lValues.getStates().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoActionsRejected() {
        new QTable<Cell>(0);
    }
}
