package me.gridrl.algs.td;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import me.gridrl.algs.ValueFunction;

/**
 * Action values, stored sparsely. A state's row is created, zero-filled, the first time it is looked at, so lookups
 * never fail.
 */
public final class QTable<S> {
    private final int mNumActions;
    private final Map<S, double[]> mRows = new LinkedHashMap<>();

    public QTable(int xiNumActions) {
        if (xiNumActions < 1) {
            throw new IllegalArgumentException("Need at least one action, got " + xiNumActions);
        }
        mNumActions = xiNumActions;
    }

    public int getNumActions() {
        return mNumActions;
    }

    /**
     * @return the live row of action values for the state, creating it if necessary.
     */
    public double[] getRow(S xiState) {
        double[] lRow = mRows.get(xiState);
        if (lRow == null) {
            lRow = new double[mNumActions];
            mRows.put(xiState, lRow);
        }
        return lRow;
    }

    public double get(S xiState, int xiAction) {
        return getRow(xiState)[xiAction];
    }

    public void set(S xiState, int xiAction, double xiValue) {
        getRow(xiState)[xiAction] = xiValue;
    }

    /**
     * @return whether the state has a row yet.
     */
    public boolean contains(S xiState) {
        return mRows.containsKey(xiState);
    }

    /**
     * @return the states with rows, in the order they were first seen.
     */
    public Set<S> getStates() {
        return Collections.unmodifiableSet(mRows.keySet());
    }

    public double getBestValue(S xiState) {
        double lBestValue = Double.NEGATIVE_INFINITY;
        for (double lActionValue : getRow(xiState)) {
            lBestValue = Math.max(lBestValue, lActionValue);
        }
        return lBestValue;
    }

    /**
     * @return the action with the highest value. Ties go to the earliest action.
     */
    public int getBestAction(S xiState) {
        return bestAction(getRow(xiState));
    }

    static int bestAction(double[] xiRow) {
        double lBestValue = xiRow[0];
        int lBestAction = 0;
        for (int lAction = 1; lAction < xiRow.length; lAction++) {
            if (xiRow[lAction] > lBestValue) {
                lBestValue = xiRow[lAction];
                lBestAction = lAction;
            }
        }
        return lBestAction;
    }

    /**
     * @return state values V(s) = max_a Q(s,a) for every state with a row.
     */
    public ValueFunction<S> toValueFunction() {
        ValueFunction<S> lValues = new ValueFunction<>(new ArrayList<>(mRows.keySet()));
        for (S lState : mRows.keySet()) {
            lValues.set(lState, getBestValue(lState));
        }
        return lValues;
    }
}
