package com.sparrowwallet.ballast.io;

import com.google.gson.*;
import com.sparrowwallet.ballast.protocol.FeeRate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeParseException;

public class Config {
    private static final Logger log = LoggerFactory.getLogger(Config.class);

    public static final String CONFIG_FILENAME = "config";

    private FeeRate blockMinTxFee;
    private FeeRate incrementalRelayFee;
    private Long maxMempool;
    private Integer limitAncestorCount;
    private Integer limitSecondaryMempoolAncestorCount;
    private Duration mempoolExpiry;
    private Duration rollingFeeHalflife;
    private Double evictionCompactionRatio;

    private transient File file;

    private static Config INSTANCE;

    private static Gson getGson() {
        GsonBuilder gsonBuilder = new GsonBuilder();
        gsonBuilder.registerTypeAdapter(FeeRate.class, new FeeRateSerializer());
        gsonBuilder.registerTypeAdapter(FeeRate.class, new FeeRateDeserializer());
        gsonBuilder.registerTypeAdapter(Duration.class, new DurationSerializer());
        gsonBuilder.registerTypeAdapter(Duration.class, new DurationDeserializer());
        return gsonBuilder.setPrettyPrinting().disableHtmlEscaping().create();
    }

    private static File getConfigFile() {
        File ballastDir = Storage.getBallastDir();
        return new File(ballastDir, CONFIG_FILENAME);
    }

    static Config load(File configFile) {
        Config config = null;
        if(configFile.exists()) {
            try(Reader reader = new InputStreamReader(new FileInputStream(configFile), StandardCharsets.UTF_8)) {
                config = getGson().fromJson(reader, Config.class);
            } catch(Exception e) {
                log.error("Error opening " + configFile.getAbsolutePath() + ", using default configuration", e);
            }
        }

        if(config == null) {
            config = new Config();
        }

        config.file = configFile;
        return config;
    }

    public static synchronized Config get() {
        if(INSTANCE == null) {
            INSTANCE = load(getConfigFile());
        }

        return INSTANCE;
    }

    public FeeRate getBlockMinTxFee() {
        return blockMinTxFee;
    }

    public void setBlockMinTxFee(FeeRate blockMinTxFee) {
        this.blockMinTxFee = blockMinTxFee;
        flush();
    }

    public FeeRate getIncrementalRelayFee() {
        return incrementalRelayFee;
    }

    public void setIncrementalRelayFee(FeeRate incrementalRelayFee) {
        this.incrementalRelayFee = incrementalRelayFee;
        flush();
    }

    public Long getMaxMempool() {
        return maxMempool;
    }

    public void setMaxMempool(Long maxMempool) {
        this.maxMempool = maxMempool;
        flush();
    }

    public Integer getLimitAncestorCount() {
        return limitAncestorCount;
    }

    public void setLimitAncestorCount(Integer limitAncestorCount) {
        this.limitAncestorCount = limitAncestorCount;
        flush();
    }

    public Integer getLimitSecondaryMempoolAncestorCount() {
        return limitSecondaryMempoolAncestorCount;
    }

    public void setLimitSecondaryMempoolAncestorCount(Integer limitSecondaryMempoolAncestorCount) {
        this.limitSecondaryMempoolAncestorCount = limitSecondaryMempoolAncestorCount;
        flush();
    }

    public Duration getMempoolExpiry() {
        return mempoolExpiry;
    }

    public void setMempoolExpiry(Duration mempoolExpiry) {
        this.mempoolExpiry = mempoolExpiry;
        flush();
    }

    public Duration getRollingFeeHalflife() {
        return rollingFeeHalflife;
    }

    public void setRollingFeeHalflife(Duration rollingFeeHalflife) {
        this.rollingFeeHalflife = rollingFeeHalflife;
        flush();
    }

    public Double getEvictionCompactionRatio() {
        return evictionCompactionRatio;
    }

    public void setEvictionCompactionRatio(Double evictionCompactionRatio) {
        this.evictionCompactionRatio = evictionCompactionRatio;
        flush();
    }

    private synchronized void flush() {
        Gson gson = getGson();
        File configFile = file != null ? file : getConfigFile();
        if(!configFile.exists()) {
            Storage.createOwnerOnlyFile(configFile);
        }

        try(Writer writer = new OutputStreamWriter(new FileOutputStream(configFile), StandardCharsets.UTF_8)) {
            gson.toJson(this, writer);
            writer.flush();
        } catch(IOException e) {
            log.error("Error writing configuration to " + configFile.getAbsolutePath(), e);
        }
    }

    private static class FeeRateSerializer implements JsonSerializer<FeeRate> {
        @Override
        public JsonElement serialize(FeeRate src, Type typeOfSrc, JsonSerializationContext context) {
            return new JsonPrimitive(src.satoshisPerK());
        }
    }

    private static class FeeRateDeserializer implements JsonDeserializer<FeeRate> {
        @Override
        public FeeRate deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) throws JsonParseException {
            return new FeeRate(json.getAsLong());
        }
    }

    private static class DurationSerializer implements JsonSerializer<Duration> {
        @Override
        public JsonElement serialize(Duration src, Type typeOfSrc, JsonSerializationContext context) {
            return new JsonPrimitive(src.toString());
        }
    }

    private static class DurationDeserializer implements JsonDeserializer<Duration> {
        @Override
        public Duration deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) throws JsonParseException {
            try {
                return Duration.parse(json.getAsString());
            } catch(DateTimeParseException e) {
                throw new JsonParseException("Invalid duration " + json.getAsString(), e);
            }
        }
    }
}
