package com.sparrowwallet.ballast.protocol;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * The parts of a transaction body that admission and eviction depend on: the outpoints it spends, how many
 * outputs it creates and its serialized size. Script and amount data are validated elsewhere and are not held.
 */
public class Transaction {
    private final List<OutPoint> inputs;
    private final int outputCount;
    private final int size;
    private final long lockTime;
    private final TxId txId;

    public Transaction(List<OutPoint> inputs, int outputCount, int size) {
        this(inputs, outputCount, size, 0);
    }

    public Transaction(List<OutPoint> inputs, int outputCount, int size, long lockTime) {
        Preconditions.checkArgument(outputCount > 0, "Transaction must have at least one output");
        Preconditions.checkArgument(size > 0, "Transaction size must be positive");
        this.inputs = ImmutableList.copyOf(inputs);
        this.outputCount = outputCount;
        this.size = size;
        this.lockTime = lockTime;
        this.txId = TxId.twiceOf(serialize());
    }

    private byte[] serialize() {
        ByteBuffer buffer = ByteBuffer.allocate(4 + inputs.size() * (TxId.LENGTH + 4) + 4 + 4 + 8);
        buffer.putInt(inputs.size());
        for(OutPoint input : inputs) {
            buffer.put(input.txId().getBytes());
            buffer.putInt(input.index());
        }
        buffer.putInt(outputCount);
        buffer.putInt(size);
        buffer.putLong(lockTime);
        return buffer.array();
    }

    public TxId getTxId() {
        return txId;
    }

    public List<OutPoint> getInputs() {
        return inputs;
    }

    public int getOutputCount() {
        return outputCount;
    }

    public OutPoint getOutput(int index) {
        Preconditions.checkElementIndex(index, outputCount, "output");
        return new OutPoint(txId, index);
    }

    public int getSize() {
        return size;
    }

    public long getLockTime() {
        return lockTime;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Transaction transaction)) {
            return false;
        }

        return txId.equals(transaction.txId);
    }

    @Override
    public int hashCode() {
        return txId.hashCode();
    }

    @Override
    public String toString() {
        return "Transaction{" +
                "txId=" + txId +
                ", inputs=" + inputs.size() +
                ", outputs=" + outputCount +
                ", size=" + size +
                '}';
    }
}
