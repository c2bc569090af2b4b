package me.gridrl.algs;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State values over a fixed, enumerable state set. All values start at zero.
 */
public final class ValueFunction<S> {
    private final List<S> mStates;
    private final Map<S, Integer> mIndex;
    private final double[] mValues;

    public ValueFunction(List<S> xiStates) {
        mStates = Collections.unmodifiableList(xiStates);
        mIndex = new HashMap<>();
        for (int lii = 0; lii < xiStates.size(); lii++) {
            mIndex.put(xiStates.get(lii), lii);
        }
        mValues = new double[xiStates.size()];
    }

    private ValueFunction(ValueFunction<S> xiOther) {
        mStates = xiOther.mStates;
        mIndex = xiOther.mIndex;
        mValues = xiOther.mValues.clone();
    }

    private int indexOf(S xiState) {
        Integer lIndex = mIndex.get(xiState);
        if (lIndex == null) {
            throw new IllegalArgumentException("Unknown state: " + xiState);
        }
        return lIndex;
    }

    public double get(S xiState) {
        return mValues[indexOf(xiState)];
    }

    public void set(S xiState, double xiValue) {
        mValues[indexOf(xiState)] = xiValue;
    }

    public List<S> getStates() {
        return mStates;
    }

    /**
     * @return an independent snapshot of this value function.
     */
    public ValueFunction<S> copy() {
        return new ValueFunction<>(this);
    }

    /**
     * @return the largest absolute difference between this and another value function over the same states.
     */
    public double maxDifference(ValueFunction<S> xiOther) {
        double lMax = 0;
        for (S lState : mStates) {
            lMax = Math.max(lMax, Math.abs(get(lState) - xiOther.get(lState)));
        }
        return lMax;
    }

    /**
     * @return the values as a map, in state order.
     */
    public Map<S, Double> asMap() {
        Map<S, Double> lMap = new LinkedHashMap<>();
        for (int lii = 0; lii < mValues.length; lii++) {
            lMap.put(mStates.get(lii), mValues[lii]);
        }
        return lMap;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
