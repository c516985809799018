package com.prozchain.consensus.round;

import com.prozchain.consensus.state.Step;

public interface StageState {

    Step getStep();

    /**
     * Sets the stage deadline and performs the entry actions of the stage.
     *
     * @param machine The state machine of the current height.
     */
    void start(RoundStateMachine machine);

    /**
     * Checks the quorum conditions of the stage and transitions when one holds.
     * Invoked after every accepted message.
     *
     * @param machine The state machine of the current height.
     */
    void evaluate(RoundStateMachine machine);

    /**
     * Executes the timeout path of the stage once its deadline has passed.
     *
     * @param machine The state machine of the current height.
     */
    void end(RoundStateMachine machine);
}
