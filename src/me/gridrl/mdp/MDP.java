package me.gridrl.mdp;

import java.util.List;

/**
 * A finite Markov Decision Process with a single absorbing goal state.
 *
 * Dynamic-programming solvers query {@link #step} for arbitrary states (full-model access). Temporal-difference
 * learners only ever call it for the state they currently occupy.
 *
 * @param <S> the state type. Must implement equals() and hashCode().
 * @param <A> the action type.
 */
public interface MDP<S, A> {
    /**
     * @return all states, including the goal. Never empty.
     */
    public List<S> getStates();

    /**
     * @return the actions available in every non-goal state, in a fixed order. Algorithms refer to actions by their
     * index in this list.
     */
    public List<A> getActions();

    /**
     * @return the state in which every episode starts.
     */
    public S getStartState();

    /**
     * @return the goal state. It has value 0 and no outgoing decisions.
     */
    public S getGoalState();

    /**
     * @return whether the state is terminal.
     */
    public default boolean isTerminal(S xiState) {
        return getGoalState().equals(xiState);
    }

    /**
     * Perform the specified action.
     *
     * Performing any action in the goal state returns the goal state again with zero reward.
     *
     * @param xiState - the state in which to act.
     * @param xiAction - the action to be performed in the given state.
     *
     * @return the successor state, the reward and whether the episode has terminated.
     *
     * @throws InvalidActionException if the action isn't one of {@link #getActions()}.
     */
    public StepResult<S> step(S xiState, A xiAction);
}
