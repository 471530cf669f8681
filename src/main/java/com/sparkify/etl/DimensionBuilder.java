package com.sparkify.etl;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.expressions.Window;
import org.apache.spark.sql.expressions.WindowSpec;

import static org.apache.spark.sql.functions.*;

/**
 * Builds the songs, artists, users and time dimensions from the raw tables.
 * Every dimension holds one row per natural key.
 */
public class DimensionBuilder {

    public static final String NEXT_SONG_PAGE = "NextSong";

    /**
     * Keep only song plays; other pages (Home, Login, Logout...) never reach a dimension.
     */
    public static Dataset<Row> nextSongEvents(Dataset<Row> logs) {
        return logs.filter(col("page").equalTo(NEXT_SONG_PAGE));
    }

    /**
     * Adds start_time, the epoch-millisecond ts as a timestamp in the session time zone.
     */
    public static Dataset<Row> withStartTime(Dataset<Row> logs) {
        return logs.withColumn("start_time", expr("timestamp_millis(ts)"));
    }

    /**
     * songs: (song_id, title, artist_id, year, duration), one row per song_id
     */
    public Dataset<Row> buildSongs(Dataset<Row> songs) {
        return songs
            .select("song_id", "title", "artist_id", "year", "duration")
            .dropDuplicates("song_id");
    }

    /**
     * artists: (artist_id, artist, location, latitude, longitude), one row per artist_id
     */
    public Dataset<Row> buildArtists(Dataset<Row> songs) {
        return songs
            .select("artist_id", "artist_name", "artist_location", "artist_latitude", "artist_longitude")
            .withColumnRenamed("artist_name", "artist")
            .withColumnRenamed("artist_location", "location")
            .withColumnRenamed("artist_latitude", "latitude")
            .withColumnRenamed("artist_longitude", "longitude")
            .dropDuplicates("artist_id");
    }

    /**
     * users: (userId, firstName, lastName, gender, level), one row per userId.
     * When a user appears several times the most recent event (highest ts) wins,
     * so level reflects the user's latest subscription.
     */
    public Dataset<Row> buildUsers(Dataset<Row> logs) {
        WindowSpec latestFirst = Window.partitionBy("userId").orderBy(col("ts").desc());
        return nextSongEvents(logs)
            .withColumn("_rank", row_number().over(latestFirst))
            .filter(col("_rank").equalTo(1))
            .select("userId", "firstName", "lastName", "gender", "level");
    }

    /**
     * time: (start_time, hour, day, week, month, year), one row per start_time.
     * week is the ISO-8601 week number.
     */
    public Dataset<Row> buildTime(Dataset<Row> logs) {
        Dataset<Row> plays = withStartTime(nextSongEvents(logs));
        return plays
            .select(
                col("start_time"),
                hour(col("start_time")).alias("hour"),
                dayofmonth(col("start_time")).alias("day"),
                weekofyear(col("start_time")).alias("week"),
                month(col("start_time")).alias("month"),
                year(col("start_time")).alias("year")
            )
            .dropDuplicates("start_time");
    }
}
