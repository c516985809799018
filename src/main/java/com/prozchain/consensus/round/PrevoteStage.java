package com.prozchain.consensus.round;

import com.prozchain.block.Block;
import com.prozchain.consensus.pool.Quorum;
import com.prozchain.consensus.state.RoundState;
import com.prozchain.consensus.state.Step;
import com.prozchain.consensus.vote.VoteType;
import com.prozchain.types.BlockHash;
import lombok.extern.java.Log;

import java.util.Optional;

@Log
public class PrevoteStage implements StageState {

    @Override
    public Step getStep() {
        return Step.PREVOTE;
    }

    @Override
    public void start(RoundStateMachine machine) {
        machine.scheduleDeadline(Step.PREVOTE);
    }

    @Override
    public void evaluate(RoundStateMachine machine) {
        RoundState state = machine.getState();
        Optional<Quorum> polka = machine.quorum(state.getRound(), VoteType.PREVOTE);
        if (polka.isEmpty()) {
            return;
        }

        if (polka.get().isNil()) {
            log.fine(String.format("Height %d round %d: nil prevote quorum", state.getHeight(), state.getRound()));
            machine.precommit(null);
            return;
        }

        BlockHash value = polka.get().getBlockHash();
        Optional<Block> block = machine.findBlock(value);
        if (block.isEmpty() || !machine.isValid(block.get())) {
            log.info(String.format("Height %d round %d: prevote quorum for unknown or invalid block %s",
                    state.getHeight(), state.getRound(), value));
            machine.precommit(null);
            return;
        }

        if (!machine.canPrecommit(value, state.getRound())) {
            log.warning(String.format("Height %d round %d: locked on %s, refusing to precommit %s",
                    state.getHeight(), state.getRound(), state.getLockedValue(), value));
            machine.precommit(null);
            return;
        }

        state.lock(value, state.getRound());
        state.updateValid(value, state.getRound());
        log.fine(String.format("Height %d round %d: locked on %s", state.getHeight(), state.getRound(), value));
        machine.precommit(value);
    }

    @Override
    public void end(RoundStateMachine machine) {
        RoundState state = machine.getState();
        log.info(String.format("Height %d round %d: no prevote quorum in time", state.getHeight(), state.getRound()));
        machine.precommit(null);
    }
}
