package com.sparrowwallet.ballast;

import com.google.common.eventbus.EventBus;
import com.sparrowwallet.ballast.io.Config;
import com.sparrowwallet.ballast.mempool.MempoolSettings;
import com.sparrowwallet.ballast.mempool.TxMemPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Ballast {
    private static final Logger log = LoggerFactory.getLogger(Ballast.class);

    public static final String SERVER_NAME = "Ballast";
    public static final String SERVER_VERSION = "1.0.0";
    public static final String APP_HOME_PROPERTY = "ballast.home";

    private static final EventBus EVENT_BUS = new EventBus();

    private TxMemPool mempool;
    private MempoolEventLogger eventLogger;

    private boolean running;

    public void start() {
        MempoolSettings settings = loadSettings(Config.get());
        mempool = new TxMemPool(settings, EVENT_BUS);
        eventLogger = new MempoolEventLogger();
        EVENT_BUS.register(eventLogger);

        log.info("Started " + SERVER_NAME + " " + SERVER_VERSION + " with block minimum fee " + settings.blockMinTxFee() + " and maximum mempool size " + settings.maxMempool());
        running = true;
    }

    public boolean isRunning() {
        return running;
    }

    public void stop() {
        if(eventLogger != null) {
            EVENT_BUS.unregister(eventLogger);
            eventLogger = null;
        }
        if(mempool != null) {
            mempool.clear();
        }

        running = false;
    }

    public TxMemPool getMempool() {
        return mempool;
    }

    public MempoolEventLogger getEventLogger() {
        return eventLogger;
    }

    public static EventBus getEventBus() {
        return EVENT_BUS;
    }

    /**
     * Reads the mempool settings, writing defaults back to the configuration for anything not yet set.
     */
    static MempoolSettings loadSettings(Config config) {
        if(config.getBlockMinTxFee() == null) {
            config.setBlockMinTxFee(MempoolSettings.DEFAULT_BLOCK_MIN_TX_FEE);
        }
        if(config.getIncrementalRelayFee() == null) {
            config.setIncrementalRelayFee(MempoolSettings.DEFAULT_INCREMENTAL_RELAY_FEE);
        }
        if(config.getMaxMempool() == null) {
            config.setMaxMempool(MempoolSettings.DEFAULT_MAX_MEMPOOL);
        }
        if(config.getLimitAncestorCount() == null) {
            config.setLimitAncestorCount(MempoolSettings.DEFAULT_ANCESTOR_LIMIT);
        }
        if(config.getLimitSecondaryMempoolAncestorCount() == null) {
            config.setLimitSecondaryMempoolAncestorCount(MempoolSettings.DEFAULT_SECONDARY_MEMPOOL_ANCESTOR_LIMIT);
        }
        if(config.getMempoolExpiry() == null) {
            config.setMempoolExpiry(MempoolSettings.DEFAULT_MEMPOOL_EXPIRY);
        }
        if(config.getRollingFeeHalflife() == null) {
            config.setRollingFeeHalflife(MempoolSettings.DEFAULT_ROLLING_FEE_HALFLIFE);
        }
        if(config.getEvictionCompactionRatio() == null) {
            config.setEvictionCompactionRatio(MempoolSettings.DEFAULT.evictionCompactionRatio());
        }

        try {
            return new MempoolSettings(config.getBlockMinTxFee(), config.getIncrementalRelayFee(), config.getMaxMempool(), config.getLimitAncestorCount(),
                    config.getLimitSecondaryMempoolAncestorCount(), config.getMempoolExpiry(), config.getRollingFeeHalflife(), config.getEvictionCompactionRatio());
        } catch(IllegalArgumentException e) {
            throw new ConfigurationException("Invalid mempool configuration: " + e.getMessage(), e);
        }
    }
}
