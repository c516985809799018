package com.prozchain.network.protocol.consensus.codec;

import com.prozchain.exception.MessageDecodingException;
import com.prozchain.types.Address;
import com.prozchain.types.BlockHash;
import com.prozchain.types.Signature;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.experimental.UtilityClass;

/**
 * Helpers for the consensus wire format. All integers are little-endian and fixed width.
 */
@UtilityClass
public class CodecUtils {

    private static final byte NONE = 0;
    private static final byte SOME = 1;

    public static class Encode {

        private Encode() {
        }

        public static <T> byte[] encode(ByteBufWriter<T> writer, T value) {
            ByteBuf buf = Unpooled.buffer();
            try {
                writer.write(buf, value);
                byte[] result = new byte[buf.readableBytes()];
                buf.readBytes(result);
                return result;
            } finally {
                buf.release();
            }
        }
    }

    public static class Decode {

        private Decode() {
        }

        /**
         * Decodes the whole input. Trailing bytes are treated as malformed input.
         */
        public static <T> T decode(byte[] data, ByteBufReader<T> reader) {
            ByteBuf buf = Unpooled.wrappedBuffer(data);
            try {
                T value = reader.read(buf);
                if (buf.isReadable()) {
                    throw new MessageDecodingException(
                            String.format("%d trailing bytes after message", buf.readableBytes()));
                }
                return value;
            } catch (IndexOutOfBoundsException e) {
                throw new MessageDecodingException("Message is truncated", e);
            } catch (IllegalArgumentException e) {
                throw new MessageDecodingException("Message contains an invalid value", e);
            } finally {
                buf.release();
            }
        }
    }

    public void writeBlockHash(ByteBuf buf, BlockHash hash) {
        buf.writeBytes(hash.getBytes());
    }

    public void writeOptionalBlockHash(ByteBuf buf, BlockHash hash) {
        if (hash == null) {
            buf.writeByte(NONE);
        } else {
            buf.writeByte(SOME);
            writeBlockHash(buf, hash);
        }
    }

    public BlockHash readBlockHash(ByteBuf buf) {
        return new BlockHash(readBytes(buf, BlockHash.SIZE_BYTES));
    }

    public BlockHash readOptionalBlockHash(ByteBuf buf) {
        byte option = buf.readByte();
        return switch (option) {
            case NONE -> null;
            case SOME -> readBlockHash(buf);
            default -> throw new MessageDecodingException("Invalid option byte " + option);
        };
    }

    public void writeAddress(ByteBuf buf, Address address) {
        buf.writeBytes(address.getBytes());
    }

    public Address readAddress(ByteBuf buf) {
        return new Address(readBytes(buf, Address.SIZE_BYTES));
    }

    public void writeSignature(ByteBuf buf, Signature signature) {
        buf.writeBytes(signature.getBytes());
    }

    public Signature readSignature(ByteBuf buf) {
        return new Signature(readBytes(buf, Signature.SIZE_BYTES));
    }

    public byte[] readBytes(ByteBuf buf, int length) {
        byte[] bytes = new byte[length];
        buf.readBytes(bytes);
        return bytes;
    }
}
