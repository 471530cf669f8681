package com.sparkify.etl;

import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Sparkify ETL.
 *
 * Usage:
 *   java -cp target/classes com.sparkify.etl.Main [song_data_path log_data_path output_path]
 *
 * Example:
 *   java -Dconfig.file=etl.conf -cp target/classes com.sparkify.etl.Main \
 *     data/song_data.json data/log_data.json output/
 *
 * Glob patterns are accepted for both input paths; quote them in the shell.
 * Paths not given on the command line come from the configuration.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length != 0 && args.length != 3) {
            logger.error("Usage: Main [song_data_path log_data_path output_path]");
            System.exit(2);
        }

        EtlConfig config = EtlConfig.load();
        String songPath = args.length > 0 ? args[0] : config.getSongDataPath();
        String logPath = args.length > 1 ? args[1] : config.getLogDataPath();
        String outputPath = args.length > 2 ? args[2] : config.getOutputPath();

        int status = 0;
        SparkSession spark = SparkSessionFactory.create(config);
        try {
            PipelineSummary summary = SparkifyPipeline.fromConfig(spark, config)
                .execute(songPath, logPath, outputPath);
            logger.info("Pipeline completed successfully: {}", summary);
        } catch (Exception e) {
            logger.error("Error executing pipeline: {}", e.getMessage(), e);
            status = 1;
        } finally {
            spark.stop();
        }

        if (status != 0) {
            System.exit(status);
        }
    }
}
