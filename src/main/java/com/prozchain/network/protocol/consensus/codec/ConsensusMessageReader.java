package com.prozchain.network.protocol.consensus.codec;

import com.prozchain.block.Block;
import com.prozchain.consensus.vote.ConsensusMessage;
import com.prozchain.consensus.vote.MessageType;
import com.prozchain.consensus.vote.Proposal;
import com.prozchain.consensus.vote.Vote;
import com.prozchain.consensus.vote.VoteType;
import com.prozchain.exception.MessageDecodingException;
import io.netty.buffer.ByteBuf;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class ConsensusMessageReader implements ByteBufReader<ConsensusMessage> {

    private static final ConsensusMessageReader INSTANCE = new ConsensusMessageReader();

    public static ConsensusMessageReader getInstance() {
        return INSTANCE;
    }

    @Override
    public ConsensusMessage read(ByteBuf buf) {
        int tag = buf.readUnsignedByte();
        MessageType type = MessageType.getByTag(tag);
        if (type == null) {
            throw new MessageDecodingException("Unknown consensus message tag " + tag);
        }

        return switch (type) {
            case PROPOSAL -> readProposal(buf);
            case VOTE -> readVote(buf);
        };
    }

    private Proposal readProposal(ByteBuf buf) {
        Proposal.ProposalBuilder builder = Proposal.builder()
                .height(buf.readLongLE())
                .round(buf.readIntLE())
                .polRound(buf.readIntLE())
                .blockHash(CodecUtils.readBlockHash(buf))
                .proposer(CodecUtils.readAddress(buf));

        int blockLength = buf.readIntLE();
        if (blockLength < 0 || blockLength > buf.readableBytes()) {
            throw new MessageDecodingException("Invalid block length " + blockLength);
        }
        ByteBuf blockBuf = buf.readSlice(blockLength);
        Block block = BlockReader.getInstance().read(blockBuf);
        if (blockBuf.isReadable()) {
            throw new MessageDecodingException(String.format("%d trailing bytes after block", blockBuf.readableBytes()));
        }

        return builder
                .block(block)
                .signature(CodecUtils.readSignature(buf))
                .build();
    }

    private Vote readVote(ByteBuf buf) {
        long height = buf.readLongLE();
        int round = buf.readIntLE();

        int typeCode = buf.readUnsignedByte();
        VoteType voteType = VoteType.getByCode(typeCode);
        if (voteType == VoteType.UNKNOWN) {
            throw new MessageDecodingException("Unknown vote type " + typeCode);
        }

        return Vote.builder()
                .height(height)
                .round(round)
                .voteType(voteType)
                .blockHash(CodecUtils.readOptionalBlockHash(buf))
                .validator(CodecUtils.readAddress(buf))
                .signature(CodecUtils.readSignature(buf))
                .build();
    }
}
