package com.sparkify.etl;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pipeline settings read from the "sparkify" block of a Typesafe config.
 * Defaults live in reference.conf; -Dconfig.file or an explicit file overrides them.
 */
public class EtlConfig {

    private static final String ROOT = "sparkify";

    private final String appName;
    private final String master;
    private final String timeZone;
    private final Map<String, String> sparkConf;
    private final String songDataPath;
    private final String logDataPath;
    private final String outputPath;
    private final JoinMode joinMode;
    private final SurrogateKeyStrategy surrogateKeys;
    private final StorageCredentials credentials;

    private EtlConfig(Config config) {
        Config root = config.getConfig(ROOT);
        this.appName = root.getString("app-name");
        this.master = root.getString("master");
        this.timeZone = root.getString("time-zone");
        this.sparkConf = readSparkConf(root);
        this.songDataPath = root.getString("paths.song-data");
        this.logDataPath = root.getString("paths.log-data");
        this.outputPath = root.getString("paths.output");
        this.joinMode = root.getEnum(JoinMode.class, "join-mode");
        this.surrogateKeys = root.getEnum(SurrogateKeyStrategy.class, "surrogate-keys");
        this.credentials = new StorageCredentials(root.getString("aws.key"), root.getString("aws.secret"));
    }

    public static EtlConfig load() {
        return new EtlConfig(ConfigFactory.load());
    }

    public static EtlConfig load(Path file) {
        return new EtlConfig(ConfigFactory.load(ConfigFactory.parseFile(file.toFile())));
    }

    /**
     * Overrides layered on top of reference.conf.
     */
    public static EtlConfig from(Config overrides) {
        return new EtlConfig(overrides.withFallback(ConfigFactory.defaultReference()).resolve());
    }

    private static Map<String, String> readSparkConf(Config root) {
        if (!root.hasPath("spark-conf")) {
            return Collections.emptyMap();
        }
        Map<String, String> conf = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : root.getObject("spark-conf").entrySet()) {
            conf.put(entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
        }
        return Collections.unmodifiableMap(conf);
    }

    public String getAppName() {
        return appName;
    }

    /**
     * Empty when the master is supplied by spark-submit.
     */
    public String getMaster() {
        return master;
    }

    /**
     * Session time zone used to decompose timestamps; empty means the JVM default.
     */
    public String getTimeZone() {
        return timeZone;
    }

    public Map<String, String> getSparkConf() {
        return sparkConf;
    }

    public String getSongDataPath() {
        return songDataPath;
    }

    public String getLogDataPath() {
        return logDataPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public JoinMode getJoinMode() {
        return joinMode;
    }

    public SurrogateKeyStrategy getSurrogateKeys() {
        return surrogateKeys;
    }

    public StorageCredentials getCredentials() {
        return credentials;
    }
}
