package com.sparkify.etl;

import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the Spark session from an {@link EtlConfig}. Credentials go into the session's
 * Hadoop configuration, never into the process environment.
 */
public final class SparkSessionFactory {

    private static final Logger logger = LoggerFactory.getLogger(SparkSessionFactory.class);

    static final String S3A_ACCESS_KEY = "spark.hadoop.fs.s3a.access.key";
    static final String S3A_SECRET_KEY = "spark.hadoop.fs.s3a.secret.key";

    private SparkSessionFactory() {
    }

    public static SparkSession create(EtlConfig config) {
        SparkSession.Builder builder = SparkSession.builder().appName(config.getAppName());
        if (!config.getMaster().isEmpty()) {
            builder.master(config.getMaster());
        }
        for (Map.Entry<String, String> property : sessionProperties(config).entrySet()) {
            builder.config(property.getKey(), property.getValue());
        }

        logger.info("Starting Spark session '{}' (master={}, credentials={})",
            config.getAppName(), config.getMaster().isEmpty() ? "<submit>" : config.getMaster(),
            config.getCredentials());
        return builder.getOrCreate();
    }

    /**
     * All properties applied to the session builder besides app name and master.
     */
    static Map<String, String> sessionProperties(EtlConfig config) {
        Map<String, String> properties = new LinkedHashMap<>(config.getSparkConf());
        if (!config.getTimeZone().isEmpty()) {
            properties.put("spark.sql.session.timeZone", config.getTimeZone());
        }
        StorageCredentials credentials = config.getCredentials();
        if (credentials.isPresent()) {
            properties.put(S3A_ACCESS_KEY, credentials.getAccessKeyId());
            properties.put(S3A_SECRET_KEY, credentials.getSecretKey());
        }
        return properties;
    }
}
