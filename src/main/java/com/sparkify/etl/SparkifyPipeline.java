package com.sparkify.etl;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main pipeline class: reads the raw song and log data, builds the star schema and
 * writes each table under the output root. Any failure aborts the run; tables already
 * written stay in place.
 */
public class SparkifyPipeline {

    private static final Logger logger = LoggerFactory.getLogger(SparkifyPipeline.class);

    private final IngestionReader reader;
    private final DimensionBuilder dimensionBuilder;
    private final FactBuilder factBuilder;
    private final SinkWriter sinkWriter;

    public SparkifyPipeline(SparkSession spark) {
        this(spark, new FactBuilder());
    }

    public SparkifyPipeline(SparkSession spark, FactBuilder factBuilder) {
        this.reader = new IngestionReader(spark);
        this.dimensionBuilder = new DimensionBuilder();
        this.factBuilder = factBuilder;
        this.sinkWriter = new SinkWriter();
    }

    public static SparkifyPipeline fromConfig(SparkSession spark, EtlConfig config) {
        return new SparkifyPipeline(spark, new FactBuilder(config.getJoinMode(), config.getSurrogateKeys()));
    }

    /**
     * Main pipeline execution method
     */
    public PipelineSummary execute(String songPath, String logPath, String outputPath) {
        logger.info("Starting Sparkify pipeline (join={}, keys={})",
            factBuilder.getJoinMode(), factBuilder.getKeyStrategy());
        PipelineSummary summary = new PipelineSummary();

        Dataset<Row> songData = null;
        Dataset<Row> logData = null;
        try {
            // Step 1: Ingestion
            songData = reader.readSongs(songPath);
            logData = reader.readLogs(logPath);

            // Step 2: songs and artists
            processSongData(songData, outputPath, summary);

            // Step 3: users, time and songplays
            processLogData(songData, logData, outputPath, summary);
        } finally {
            if (songData != null) {
                songData.unpersist();
            }
            if (logData != null) {
                logData.unpersist();
            }
        }

        logger.info("Pipeline execution completed: {}", summary);
        return summary;
    }

    public void processSongData(Dataset<Row> songData, String outputPath, PipelineSummary summary) {
        logger.info("Processing song data...");
        writeTable(OutputTable.SONGS, dimensionBuilder.buildSongs(songData), outputPath, summary);
        writeTable(OutputTable.ARTISTS, dimensionBuilder.buildArtists(songData), outputPath, summary);
    }

    public void processLogData(Dataset<Row> songData, Dataset<Row> logData, String outputPath,
                               PipelineSummary summary) {
        logger.info("Processing log data...");
        writeTable(OutputTable.USERS, dimensionBuilder.buildUsers(logData), outputPath, summary);
        writeTable(OutputTable.TIME, dimensionBuilder.buildTime(logData), outputPath, summary);
        writeTable(OutputTable.SONGPLAYS, factBuilder.buildSongplays(logData, songData), outputPath, summary);
    }

    /**
     * Counts and writes the same cached rows, so generated ids in the log and on disk agree.
     */
    private void writeTable(OutputTable table, Dataset<Row> data, String outputPath, PipelineSummary summary) {
        data.cache();
        try {
            long rows = data.count();
            sinkWriter.write(table, data, outputPath);
            summary.record(table, rows);
            logger.info("Generated {} ({} rows)", table.directory(), rows);
        } finally {
            data.unpersist();
        }
    }
}
