package me.gridrl.algs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A deterministic policy: one action per non-terminal state.
 */
public final class Policy<S, A> {
    private final Map<S, A> mActions = new LinkedHashMap<>();

    /**
     * @return the action for the state, or null if the policy has none (e.g. the goal).
     */
    public A getAction(S xiState) {
        return mActions.get(xiState);
    }

    /**
     * Set the action for a state.
     *
     * @return the previous action (possibly null).
     */
    public A setAction(S xiState, A xiAction) {
        return mActions.put(xiState, xiAction);
    }

    public boolean hasAction(S xiState) {
        return mActions.containsKey(xiState);
    }

    public Set<S> getStates() {
        return Collections.unmodifiableSet(mActions.keySet());
    }

    public int size() {
        return mActions.size();
    }

    public Map<S, A> asMap() {
        return Collections.unmodifiableMap(mActions);
    }

    @Override
    public String toString() {
        return mActions.toString();
    }
}
