package com.sparrowwallet.ballast.mempool;

import com.sparrowwallet.ballast.protocol.FeeRate;
import com.sparrowwallet.ballast.protocol.OutPoint;
import com.sparrowwallet.ballast.protocol.Transaction;
import com.sparrowwallet.ballast.protocol.TxId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Evicts the most worthless candidates until memory usage fits the limit. Runs under the mempool write lock.
 */
class SizeLimiter {
    private static final Logger log = LoggerFactory.getLogger(SizeLimiter.class);

    private final TxMemPool mempool;

    SizeLimiter(TxMemPool mempool) {
        this.mempool = mempool;
    }

    List<TxId> trimToSize(long sizeLimit, List<OutPoint> noSpendsRemaining, List<Object> events) {
        int removedCount = 0;
        FeeRate maxFeeRateRemoved = FeeRate.ZERO;
        List<TxId> removedTxIds = new ArrayList<>();
        while(mempool.sizeNL() > 0 && mempool.dynamicMemoryUsageNL() > sizeLimit) {
            MempoolEntry victim = mempool.getTracker().getMostWorthless();
            List<TxId> roots = victim.getCpfpGroup().map(CpfpGroup::getMembers).orElse(List.of(victim.getTxId()));
            Set<TxId> stage = mempool.getGraph().calculateDescendants(roots);

            long packageFee = 0;
            long packageSize = 0;
            List<Transaction> transactions = new ArrayList<>(stage.size());
            for(TxId txId : stage) {
                MempoolEntry entry = mempool.getEntryNL(txId);
                packageFee += entry.getModifiedFee();
                packageSize += entry.getSize();
                transactions.add(entry.getTransaction());
            }

            //Transactions must pay more than the removed package to get back in before the next block
            FeeRate removed = FeeRate.of(packageFee, packageSize).add(mempool.getSettings().incrementalRelayFee());
            mempool.trackPackageRemovedNL(removed);
            if(removed.compareTo(maxFeeRateRemoved) > 0) {
                maxFeeRateRemoved = removed;
            }

            removedTxIds.addAll(mempool.removeStagedNL(stage, RemovalReason.SIZELIMIT, events));
            removedCount += stage.size();

            if(noSpendsRemaining != null) {
                for(Transaction transaction : transactions) {
                    for(OutPoint input : transaction.getInputs()) {
                        if(!mempool.existsNL(input.txId()) && !mempool.isSpentNL(input)) {
                            noSpendsRemaining.add(input);
                        }
                    }
                }
            }
        }

        if(maxFeeRateRemoved.satoshisPerK() > 0) {
            log.info("Removed " + removedCount + " transactions, rolling minimum fee bumped to " + maxFeeRateRemoved);
        }

        return removedTxIds;
    }
}
