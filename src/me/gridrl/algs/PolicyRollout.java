package me.gridrl.algs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import me.gridrl.mdp.MDP;
import me.gridrl.mdp.StepResult;

/**
 * Greedy evaluation of a deterministic policy: follow it from the start state without exploration.
 */
public final class PolicyRollout<S> {
    private final List<S> mPath;
    private final double mTotalReward;
    private final boolean mReachedGoal;

    private PolicyRollout(List<S> xiPath, double xiTotalReward, boolean xiReachedGoal) {
        mPath = Collections.unmodifiableList(xiPath);
        mTotalReward = xiTotalReward;
        mReachedGoal = xiReachedGoal;
    }

    /**
     * Follow the policy from the start state until the goal is reached, the step limit is hit or the policy has no
     * action for the current state.
     */
    public static <S, A> PolicyRollout<S> run(MDP<S, A> xiMDP, Policy<S, A> xiPolicy, int xiMaxSteps) {
        List<S> lPath = new ArrayList<>();
        S lState = xiMDP.getStartState();
        lPath.add(lState);
        double lTotalReward = 0;
        int lSteps = 0;
        while (!xiMDP.isTerminal(lState) && (lSteps < xiMaxSteps)) {
            A lAction = xiPolicy.getAction(lState);
            if (lAction == null) {
                break;
            }
            StepResult<S> lResult = xiMDP.step(lState, lAction);
            lTotalReward += lResult.mReward;
            lState = lResult.mState;
            lPath.add(lState);
            lSteps++;
            if (lResult.mTerminal) {
                break;
            }
        }
        return new PolicyRollout<>(lPath, lTotalReward, xiMDP.isTerminal(lState));
    }

    /**
     * @return the visited states, starting with the start state.
     */
    public List<S> getPath() {
        return mPath;
    }

    public int getSteps() {
        return mPath.size() - 1;
    }

    public double getTotalReward() {
        return mTotalReward;
    }

    public boolean reachedGoal() {
        return mReachedGoal;
    }
}
