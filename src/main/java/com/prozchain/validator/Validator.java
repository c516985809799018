package com.prozchain.validator;

import com.prozchain.types.Address;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;

@Getter
@EqualsAndHashCode
public final class Validator {

    private final Address address;
    private final long votingPower;
    private final byte[] publicKey;

    public Validator(Address address, long votingPower, byte[] publicKey) {
        if (votingPower <= 0) {
            throw new IllegalArgumentException("Voting power must be positive, got " + votingPower);
        }
        this.address = address;
        this.votingPower = votingPower;
        this.publicKey = Arrays.copyOf(publicKey, publicKey.length);
    }

    public static Validator fromPublicKey(byte[] publicKey, long votingPower) {
        return new Validator(Address.fromPublicKey(publicKey), votingPower, publicKey);
    }

    public byte[] getPublicKey() {
        return Arrays.copyOf(publicKey, publicKey.length);
    }

    @Override
    public String toString() {
        return address + ":" + votingPower;
    }
}
