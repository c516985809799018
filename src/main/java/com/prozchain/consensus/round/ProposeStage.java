package com.prozchain.consensus.round;

import com.prozchain.consensus.pool.Quorum;
import com.prozchain.consensus.state.RoundState;
import com.prozchain.consensus.state.Step;
import com.prozchain.consensus.vote.Proposal;
import com.prozchain.consensus.vote.VoteType;
import lombok.extern.java.Log;

import java.util.Optional;

@Log
public class ProposeStage implements StageState {

    @Override
    public Step getStep() {
        return Step.PROPOSE;
    }

    @Override
    public void start(RoundStateMachine machine) {
        RoundState state = machine.getState();
        machine.scheduleDeadline(Step.PROPOSE);

        if (machine.isLocalProposer()) {
            log.fine(String.format("Height %d round %d: we are the proposer", state.getHeight(), state.getRound()));
            machine.getActions().propose(state.getHeight(), state.getRound(),
                    state.getValidValue(), state.getValidRound());
        }
    }

    @Override
    public void evaluate(RoundStateMachine machine) {
        RoundState state = machine.getState();
        Optional<Proposal> received = machine.getVotePool()
                .getProposal(state.getHeight(), state.getRound(), machine.expectedProposer());
        if (received.isEmpty()) {
            return;
        }

        Proposal proposal = received.get();
        if (proposal.hasPolRound() && !hasPolka(machine, proposal)) {
            log.fine(String.format("Height %d round %d: waiting for the prevote quorum of round %d",
                    state.getHeight(), state.getRound(), proposal.getPolRound()));
            return;
        }

        state.setProposal(proposal);
        if (machine.canPrevote(proposal)) {
            machine.prevote(proposal.getBlockHash());
        } else {
            log.info(String.format("Height %d round %d: prevoting nil on proposal %s",
                    state.getHeight(), state.getRound(), proposal.getBlockHash()));
            machine.prevote(null);
        }
    }

    @Override
    public void end(RoundStateMachine machine) {
        RoundState state = machine.getState();
        log.info(String.format("Height %d round %d: no valid proposal in time", state.getHeight(), state.getRound()));
        machine.prevote(null);
    }

    private boolean hasPolka(RoundStateMachine machine, Proposal proposal) {
        Optional<Quorum> polka = machine.quorum(proposal.getPolRound(), VoteType.PREVOTE);
        return polka.isPresent() && proposal.getBlockHash().equals(polka.get().getBlockHash());
    }
}
