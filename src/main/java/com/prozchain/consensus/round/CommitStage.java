package com.prozchain.consensus.round;

import com.prozchain.consensus.state.Step;
import lombok.extern.java.Log;

/**
 * A precommit quorum was seen. The height commits as soon as the block body is available.
 */
@Log
public class CommitStage implements StageState {

    @Override
    public Step getStep() {
        return Step.COMMIT;
    }

    @Override
    public void start(RoundStateMachine machine) {
        log.fine(String.format("Height %d: decided %s in round %d", machine.getHeight(),
                machine.getState().getDecision(), machine.getState().getDecisionRound()));
    }

    @Override
    public void evaluate(RoundStateMachine machine) {
        machine.commitDecision();
    }

    @Override
    public void end(RoundStateMachine machine) {
        // No deadline: a decided height waits for its block.
    }
}
