package com.prozchain.network.protocol.consensus.codec;

import com.prozchain.block.Block;
import com.prozchain.consensus.vote.ConsensusMessage;
import com.prozchain.consensus.vote.Proposal;
import com.prozchain.consensus.vote.Vote;
import com.prozchain.crypto.Ed25519Signer;
import com.prozchain.exception.MessageDecodingException;
import com.prozchain.types.Signature;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.prozchain.ConsensusTestKit.block;
import static com.prozchain.ConsensusTestKit.precommit;
import static com.prozchain.ConsensusTestKit.prevote;
import static com.prozchain.ConsensusTestKit.proposal;
import static com.prozchain.ConsensusTestKit.signers;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConsensusMessageReaderTest {

    private static final int VOTE_TYPE_OFFSET = 13;
    private static final int VOTE_OPTION_OFFSET = 14;

    private final Ed25519Signer signer = signers(1).get(0);

    @Test
    void decodesProposalWithItsBlock() {
        Block block = block(7, "payload");
        Proposal proposal = proposal(signer, block, 3, 1);

        ConsensusMessage decoded = decode(encode(proposal));

        Proposal result = assertInstanceOf(Proposal.class, decoded);
        assertEquals(proposal, result);
        assertEquals(block.getHash(), result.getBlock().getHash());
        assertArrayEquals(block.getPayload(), result.getBlock().getPayload());
    }

    @Test
    void decodesNilVote() {
        Vote vote = precommit(signer, 5, 2, null);

        Vote result = assertInstanceOf(Vote.class, decode(encode(vote)));

        assertNull(result.getBlockHash());
        assertEquals(vote, result);
    }

    @Test
    void voteEncodingHasFixedLayout() {
        byte[] nil = encode(prevote(signer, 1, 0, null));
        byte[] withHash = encode(prevote(signer, 1, 0, block(1, "A").getHash()));

        // tag + height + round + type + option + address + signature
        assertEquals(1 + 8 + 4 + 1 + 1 + 20 + 64, nil.length);
        assertEquals(nil.length + 32, withHash.length);
        assertEquals(1, nil[VOTE_TYPE_OFFSET]);
        assertEquals(0, nil[VOTE_OPTION_OFFSET]);
    }

    @Test
    void rejectsUnknownMessageTag() {
        byte[] encoded = encode(prevote(signer, 1, 0, null));
        encoded[0] = 9;

        assertThrows(MessageDecodingException.class, () -> decode(encoded));
    }

    @Test
    void rejectsUnknownVoteType() {
        byte[] encoded = encode(prevote(signer, 1, 0, null));
        encoded[VOTE_TYPE_OFFSET] = 7;

        assertThrows(MessageDecodingException.class, () -> decode(encoded));
    }

    @Test
    void rejectsInvalidOptionByte() {
        byte[] encoded = encode(prevote(signer, 1, 0, null));
        encoded[VOTE_OPTION_OFFSET] = 2;

        assertThrows(MessageDecodingException.class, () -> decode(encoded));
    }

    @Test
    void rejectsTruncatedMessage() {
        byte[] encoded = encode(proposal(signer, block(1, "A"), 0, -1));

        assertThrows(MessageDecodingException.class, () -> decode(Arrays.copyOf(encoded, encoded.length - 1)));
    }

    @Test
    void rejectsTrailingBytes() {
        byte[] encoded = encode(prevote(signer, 1, 0, null));

        assertThrows(MessageDecodingException.class, () -> decode(Arrays.copyOf(encoded, encoded.length + 1)));
    }

    @Test
    void rejectsOversizedBlockPayload() {
        ByteBuf buf = Unpooled.buffer();
        buf.writeLongLE(1);
        buf.writeBytes(new byte[32]);
        buf.writeLongLE(0);
        buf.writeIntLE(BlockReader.MAX_PAYLOAD_BYTES + 1);
        byte[] encoded = new byte[buf.readableBytes()];
        buf.readBytes(encoded);
        buf.release();

        assertThrows(MessageDecodingException.class,
                () -> CodecUtils.Decode.decode(encoded, BlockReader.getInstance()));
    }

    @Test
    void signingPayloadDependsOnChainId() {
        Vote vote = prevote(signer, 1, 0, null);

        byte[] first = new SigningPayloadWriter("chain-a").payload(vote);
        byte[] second = new SigningPayloadWriter("chain-b").payload(vote);

        assertNotEquals(Arrays.toString(first), Arrays.toString(second));
        assertArrayEquals(first, new SigningPayloadWriter("chain-a").payload(vote.toBuilder()
                .signature(Signature.empty())
                .build()));
    }

    private static byte[] encode(ConsensusMessage message) {
        return CodecUtils.Encode.encode(ConsensusMessageWriter.getInstance(), message);
    }

    private static ConsensusMessage decode(byte[] encoded) {
        return CodecUtils.Decode.decode(encoded, ConsensusMessageReader.getInstance());
    }
}
