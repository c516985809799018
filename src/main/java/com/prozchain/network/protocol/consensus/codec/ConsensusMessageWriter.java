package com.prozchain.network.protocol.consensus.codec;

import com.prozchain.consensus.vote.ConsensusMessage;
import com.prozchain.consensus.vote.Proposal;
import com.prozchain.consensus.vote.Vote;
import io.netty.buffer.ByteBuf;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Writes the tagged union of consensus messages.
 * <pre>
 * Proposal: tag(0) height:u64 round:u32 polRound:i32 blockHash[32] proposer[20] blockLen:u32 block signature[64]
 * Vote:     tag(1) height:u64 round:u32 type:u8 option:u8 [blockHash[32]] validator[20] signature[64]
 * </pre>
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class ConsensusMessageWriter implements ByteBufWriter<ConsensusMessage> {

    private static final ConsensusMessageWriter INSTANCE = new ConsensusMessageWriter();

    public static ConsensusMessageWriter getInstance() {
        return INSTANCE;
    }

    @Override
    public void write(ByteBuf buf, ConsensusMessage message) {
        buf.writeByte(message.getType().getTag());
        switch (message.getType()) {
            case PROPOSAL -> writeProposal(buf, (Proposal) message);
            case VOTE -> writeVote(buf, (Vote) message);
        }
    }

    private void writeProposal(ByteBuf buf, Proposal proposal) {
        buf.writeLongLE(proposal.getHeight());
        buf.writeIntLE(proposal.getRound());
        buf.writeIntLE(proposal.getPolRound());
        CodecUtils.writeBlockHash(buf, proposal.getBlockHash());
        CodecUtils.writeAddress(buf, proposal.getProposer());

        byte[] block = CodecUtils.Encode.encode(BlockWriter.getInstance(), proposal.getBlock());
        buf.writeIntLE(block.length);
        buf.writeBytes(block);

        CodecUtils.writeSignature(buf, proposal.getSignature());
    }

    private void writeVote(ByteBuf buf, Vote vote) {
        buf.writeLongLE(vote.getHeight());
        buf.writeIntLE(vote.getRound());
        buf.writeByte(vote.getVoteType().getCode());
        CodecUtils.writeOptionalBlockHash(buf, vote.getBlockHash());
        CodecUtils.writeAddress(buf, vote.getValidator());
        CodecUtils.writeSignature(buf, vote.getSignature());
    }
}
