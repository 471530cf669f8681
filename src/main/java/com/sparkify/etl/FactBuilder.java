package com.sparkify.etl;

import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructField;
import org.apache.spark.sql.types.StructType;
import scala.Tuple2;

import static org.apache.spark.sql.functions.*;

/**
 * Builds the songplays fact table by matching NextSong events to songs on
 * exact (title, artist name) equality.
 */
public class FactBuilder {

    public static final String[] SONGPLAY_COLUMNS = {
        "songplay_id", "start_time", "userId", "level", "song_id", "artist_id",
        "sessionId", "location", "userAgent", "year", "month"
    };

    private final JoinMode joinMode;
    private final SurrogateKeyStrategy keyStrategy;

    public FactBuilder() {
        this(JoinMode.INNER, SurrogateKeyStrategy.SEQUENTIAL);
    }

    public FactBuilder(JoinMode joinMode, SurrogateKeyStrategy keyStrategy) {
        this.joinMode = joinMode;
        this.keyStrategy = keyStrategy;
    }

    public JoinMode getJoinMode() {
        return joinMode;
    }

    public SurrogateKeyStrategy getKeyStrategy() {
        return keyStrategy;
    }

    /**
     * Matching is case-sensitive with no normalisation, so plays whose artist is
     * spelled differently (e.g. "feat." credits) do not match. In INNER mode they are dropped.
     */
    public Dataset<Row> buildSongplays(Dataset<Row> logs, Dataset<Row> songs) {
        Dataset<Row> plays = DimensionBuilder.withStartTime(DimensionBuilder.nextSongEvents(logs));

        Column matchesSong = plays.col("song").equalTo(songs.col("title"))
            .and(plays.col("artist").equalTo(songs.col("artist_name")));

        Dataset<Row> joined = plays
            .join(songs, matchesSong, joinMode.sparkJoinType())
            .select(
                plays.col("start_time"),
                plays.col("userId"),
                plays.col("level"),
                songs.col("song_id"),
                songs.col("artist_id"),
                plays.col("sessionId"),
                plays.col("location"),
                plays.col("userAgent"),
                year(plays.col("start_time")).alias("year"),
                month(plays.col("start_time")).alias("month")
            );

        return assignSongplayIds(joined);
    }

    private Dataset<Row> assignSongplayIds(Dataset<Row> plays) {
        switch (keyStrategy) {
            case MONOTONIC:
                return plays
                    .withColumn("songplay_id", monotonically_increasing_id())
                    .selectExpr(SONGPLAY_COLUMNS);
            case SEQUENTIAL:
                return withSequentialIds(plays);
            default:
                throw new IllegalStateException("Unsupported key strategy: " + keyStrategy);
        }
    }

    /**
     * zipWithIndex keeps the sort order, so ids follow start_time and are dense from 0.
     */
    private static Dataset<Row> withSequentialIds(Dataset<Row> plays) {
        Dataset<Row> ordered = plays.orderBy(col("start_time"), col("userId"));

        StructType schema = new StructType()
            .add("songplay_id", DataTypes.LongType, false);
        for (StructField field : ordered.schema().fields()) {
            schema = schema.add(field);
        }

        JavaRDD<Row> numbered = ordered.javaRDD()
            .zipWithIndex()
            .map(FactBuilder::prependId);

        return plays.sparkSession().createDataFrame(numbered, schema);
    }

    private static Row prependId(Tuple2<Row, Long> indexed) {
        Row row = indexed._1();
        Object[] values = new Object[row.size() + 1];
        values[0] = indexed._2();
        for (int i = 0; i < row.size(); i++) {
            values[i + 1] = row.get(i);
        }
        return RowFactory.create(values);
    }
}
