package com.prozchain.consensus.round;

import com.prozchain.consensus.pool.Quorum;
import com.prozchain.consensus.state.RoundState;
import com.prozchain.consensus.state.Step;
import com.prozchain.consensus.vote.VoteType;
import lombok.extern.java.Log;

import java.util.Optional;

@Log
public class PrecommitStage implements StageState {

    @Override
    public Step getStep() {
        return Step.PRECOMMIT;
    }

    @Override
    public void start(RoundStateMachine machine) {
        machine.scheduleDeadline(Step.PRECOMMIT);
    }

    @Override
    public void evaluate(RoundStateMachine machine) {
        RoundState state = machine.getState();
        int round = state.getRound();

        Optional<Quorum> polka = machine.quorum(round, VoteType.PREVOTE);
        if (polka.isPresent() && !polka.get().isNil() && state.getValidRound() < round
                && machine.findBlock(polka.get().getBlockHash()).isPresent()) {
            log.fine(String.format("Height %d round %d: late prevote quorum, valid value is now %s",
                    state.getHeight(), round, polka.get().getBlockHash()));
            state.updateValid(polka.get().getBlockHash(), round);
        }

        Optional<Quorum> precommits = machine.quorum(round, VoteType.PRECOMMIT);
        if (precommits.isPresent() && precommits.get().isNil()) {
            log.info(String.format("Height %d round %d: nil precommit quorum", state.getHeight(), round));
            machine.startRound(round + 1);
        }
    }

    @Override
    public void end(RoundStateMachine machine) {
        RoundState state = machine.getState();
        log.info(String.format("Height %d round %d: no decision in time", state.getHeight(), state.getRound()));
        machine.startRound(state.getRound() + 1);
    }
}
