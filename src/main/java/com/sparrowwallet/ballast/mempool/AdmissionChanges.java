package com.sparrowwallet.ballast.mempool;

import com.sparrowwallet.ballast.protocol.TxId;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Entries whose admission state changed during one logical mempool operation. An entry that left the primary
 * mempool and was accepted again, for example into a different group, is reported as both removed and accepted.
 */
public class AdmissionChanges {
    private final Set<TxId> accepted = new LinkedHashSet<>();
    private final Set<TxId> removed = new LinkedHashSet<>();
    private final Set<TxId> modified = new LinkedHashSet<>();

    void accepted(TxId txId) {
        accepted.add(txId);
        modified.add(txId);
    }

    void removed(TxId txId) {
        removed.add(txId);
        modified.add(txId);
    }

    void modified(TxId txId) {
        modified.add(txId);
    }

    void addAll(AdmissionChanges changes) {
        accepted.addAll(changes.accepted);
        removed.addAll(changes.removed);
        modified.addAll(changes.modified);
    }

    public Set<TxId> getAccepted() {
        return Collections.unmodifiableSet(accepted);
    }

    public Set<TxId> getRemoved() {
        return Collections.unmodifiableSet(removed);
    }

    public Set<TxId> getModified() {
        return Collections.unmodifiableSet(modified);
    }

    public boolean isEmpty() {
        return modified.isEmpty();
    }
}
