package com.sparrowwallet.ballast.protocol;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;

import java.util.Arrays;

public final class TxId implements Comparable<TxId> {
    public static final int LENGTH = 32;
    public static final TxId ZERO = new TxId(new byte[LENGTH]);

    private final byte[] bytes;

    private TxId(byte[] bytes) {
        this.bytes = bytes;
    }

    public static TxId wrap(byte[] bytes) {
        Preconditions.checkArgument(bytes.length == LENGTH, "Transaction id must be " + LENGTH + " bytes, was " + bytes.length);
        return new TxId(Arrays.copyOf(bytes, LENGTH));
    }

    public static TxId fromHex(String hex) {
        return wrap(BaseEncoding.base16().lowerCase().decode(hex.toLowerCase()));
    }

    public static TxId twiceOf(byte[] contents) {
        byte[] first = Hashing.sha256().hashBytes(contents).asBytes();
        return new TxId(Hashing.sha256().hashBytes(first).asBytes());
    }

    public byte[] getBytes() {
        return Arrays.copyOf(bytes, LENGTH);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof TxId txId)) {
            return false;
        }

        return Arrays.equals(bytes, txId.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public int compareTo(TxId o) {
        return Arrays.compareUnsigned(bytes, o.bytes);
    }

    @Override
    public String toString() {
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }
}
