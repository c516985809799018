package com.prozchain.network.protocol.consensus.codec;

import com.prozchain.consensus.vote.ConsensusMessage;
import com.prozchain.consensus.vote.Proposal;
import com.prozchain.consensus.vote.Vote;
import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

/**
 * Writes the bytes a consensus message signature covers. The chain id and the message tag are part of the
 * payload, so a signature cannot be replayed on another chain or as another kind of message.
 */
public class SigningPayloadWriter implements ByteBufWriter<ConsensusMessage> {

    static final byte[] DOMAIN_TAG = "prozchain/consensus/v1".getBytes(StandardCharsets.UTF_8);
    private static final int PROPOSAL_VOTE_TYPE = 0;

    private final byte[] chainId;

    public SigningPayloadWriter(String chainId) {
        this.chainId = chainId.getBytes(StandardCharsets.UTF_8);
    }

    public byte[] payload(ConsensusMessage message) {
        return CodecUtils.Encode.encode(this, message);
    }

    @Override
    public void write(ByteBuf buf, ConsensusMessage message) {
        buf.writeBytes(DOMAIN_TAG);
        buf.writeIntLE(chainId.length);
        buf.writeBytes(chainId);
        buf.writeByte(message.getType().getTag());
        buf.writeLongLE(message.getHeight());
        buf.writeIntLE(message.getRound());

        if (message instanceof Vote vote) {
            buf.writeByte(vote.getVoteType().getCode());
            CodecUtils.writeOptionalBlockHash(buf, vote.getBlockHash());
        } else if (message instanceof Proposal proposal) {
            buf.writeByte(PROPOSAL_VOTE_TYPE);
            CodecUtils.writeOptionalBlockHash(buf, proposal.getBlockHash());
            buf.writeIntLE(proposal.getPolRound());
        }
    }
}
