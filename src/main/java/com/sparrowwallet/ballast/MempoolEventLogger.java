package com.sparrowwallet.ballast;

import com.google.common.eventbus.Subscribe;
import com.sparrowwallet.ballast.mempool.MempoolTransactionsRemoved;
import com.sparrowwallet.ballast.mempool.PrimaryMempoolChanged;
import com.sparrowwallet.ballast.mempool.RemovalReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

public class MempoolEventLogger {
    private static final Logger log = LoggerFactory.getLogger(MempoolEventLogger.class);

    private final Map<RemovalReason, Long> removedCounts = new EnumMap<>(RemovalReason.class);

    @Subscribe
    public void transactionsRemoved(MempoolTransactionsRemoved event) {
        synchronized(removedCounts) {
            removedCounts.merge(event.getReason(), (long)event.getTxIds().size(), Long::sum);
        }

        if(event.getReason() == RemovalReason.SIZELIMIT || event.getReason() == RemovalReason.CONFLICT) {
            log.info("Removed " + event.getTxIds().size() + " transactions from the mempool, reason " + event.getReason());
        } else {
            log.debug("Removed " + event.getTxIds().size() + " transactions from the mempool, reason " + event.getReason());
        }
    }

    @Subscribe
    public void primaryMempoolChanged(PrimaryMempoolChanged event) {
        log.debug("Primary mempool changed, " + event.getAccepted().size() + " accepted and " + event.getRemoved().size() + " removed");
    }

    public long getRemovedCount(RemovalReason reason) {
        synchronized(removedCounts) {
            return removedCounts.getOrDefault(reason, 0L);
        }
    }
}
