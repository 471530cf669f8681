package com.sparkify.etl;

import org.apache.spark.SparkException;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IngestionReader
 */
public class IngestionReaderTest {

    private static SparkSession spark;
    private IngestionReader reader;

    @TempDir
    Path tempDir;

    @BeforeAll
    public static void setUpSpark() {
        spark = TestData.localSpark("IngestionReaderTest");
    }

    @AfterAll
    public static void tearDownSpark() {
        if (spark != null) {
            spark.stop();
        }
    }

    @BeforeEach
    public void setUp() {
        reader = new IngestionReader(spark);
    }

    @Test
    public void testReadSongs_AppliesRegisteredSchema() throws Exception {
        TestData.writeLines(tempDir.resolve("song_data/A/B/C/TRABC01.json"), TestData.scenarioSongJson());

        Dataset<Row> songs = reader.readSongs(tempDir.resolve("song_data/*/*/*/*.json").toString());

        assertEquals(SchemaRegistry.structType(RecordType.SONG).fieldNames().length, songs.columns().length);
        List<Row> rows = songs.collectAsList();
        assertEquals(1, rows.size());
        Row row = rows.get(0);
        assertEquals("S1", row.getAs("song_id"));
        assertEquals("Artist", row.getAs("artist_name"));
        assertEquals(2000, (int) row.getAs("year"));
        assertEquals(200.0, (double) row.getAs("duration"), 0.0001);
        assertNull(row.getAs("artist_latitude"));
    }

    @Test
    public void testReadSongs_NumericCoordinatesReadAsStrings() throws Exception {
        TestData.writeLines(tempDir.resolve("songs.json"),
            "{\"artist_id\": \"A1\", \"artist_latitude\": 35.14968, \"artist_longitude\": -90.04892, "
                + "\"artist_name\": \"Artist\", \"song_id\": \"S1\", \"title\": \"Test\"}");

        Row row = reader.readSongs(tempDir.resolve("songs.json").toString()).first();

        assertEquals("35.14968", row.getAs("artist_latitude"));
        assertEquals("-90.04892", row.getAs("artist_longitude"));
        assertNull(row.getAs("year"));
        assertNull(row.getAs("duration"));
    }

    @Test
    public void testReadLogs_GlobSpansMultipleFiles() throws Exception {
        TestData.writeLines(tempDir.resolve("log_data/2018/11/2018-11-01-events.json"),
            TestData.logJson("NextSong", "1", "Song A", "Artist A", 1541030400000L, "free"),
            TestData.logJson("Home", "1", "", "", 1541030401000L, "free"));
        TestData.writeLines(tempDir.resolve("log_data/2018/11/2018-11-02-events.json"),
            TestData.logJson("NextSong", "2", "Song B", "Artist B", 1541116800000L, "paid"));

        Dataset<Row> logs = reader.readLogs(tempDir.resolve("log_data/*/*/*.json").toString());

        assertEquals(3, logs.count());
        assertEquals(2, logs.filter("page = 'NextSong'").count());
        Row first = TestData.sortedBy(logs, "ts").get(0);
        assertEquals(1541030400000L, (long) first.getAs("ts"));
        assertEquals(1L, (long) first.getAs("sessionId"));
    }

    @Test
    public void testReadLogs_EmptyUserIdIsNotMissing() throws Exception {
        TestData.writeLines(tempDir.resolve("logs.json"),
            TestData.logJson("Home", "", "", "", 1541030400000L, "free"));

        assertEquals(1, reader.readLogs(tempDir.resolve("logs.json").toString()).count());
    }

    @Test
    public void testReadSongs_MissingRequiredColumnFails() throws Exception {
        TestData.writeLines(tempDir.resolve("songs.json"),
            TestData.scenarioSongJson(),
            "{\"artist_id\": \"A2\", \"artist_name\": \"Other\", \"song_id\": \"S2\", \"year\": 1999}");

        SchemaViolationException e = assertThrows(SchemaViolationException.class,
            () -> reader.readSongs(tempDir.resolve("songs.json").toString()));

        assertEquals(RecordType.SONG, e.getRecordType());
        assertEquals("title", e.getColumn());
    }

    @Test
    public void testReadLogs_NullRequiredColumnFails() throws Exception {
        TestData.writeLines(tempDir.resolve("logs.json"),
            TestData.scenarioLogJson().replace("\"userId\": \"U1\"", "\"userId\": null"));

        SchemaViolationException e = assertThrows(SchemaViolationException.class,
            () -> reader.readLogs(tempDir.resolve("logs.json").toString()));

        assertEquals(RecordType.LOG, e.getRecordType());
        assertEquals("userId", e.getColumn());
    }

    @Test
    public void testReadLogs_TypeMismatchFailsFast() throws Exception {
        TestData.writeLines(tempDir.resolve("logs.json"),
            TestData.scenarioLogJson(),
            TestData.scenarioLogJson().replace("\"ts\": " + TestData.SCENARIO_TS, "\"ts\": \"yesterday\""));

        SchemaViolationException e = assertThrows(SchemaViolationException.class,
            () -> reader.readLogs(tempDir.resolve("logs.json").toString()));

        assertEquals(RecordType.LOG, e.getRecordType());
        assertNull(e.getColumn());
    }

    @Test
    public void testReadSongs_OptionalColumnTypeMismatchFailsFast() throws Exception {
        TestData.writeLines(tempDir.resolve("songs.json"),
            TestData.scenarioSongJson().replace("\"year\": 2000", "\"year\": \"two thousand\""));

        assertThrows(SchemaViolationException.class,
            () -> reader.readSongs(tempDir.resolve("songs.json").toString()));
    }

    @Test
    public void testReadSongs_ObjectInStringColumnFails() throws Exception {
        TestData.writeLines(tempDir.resolve("songs.json"),
            TestData.scenarioSongJson().replace("\"title\": \"Test\"", "\"title\": {\"nested\": [1, 2]}"));

        SchemaViolationException e = assertThrows(SchemaViolationException.class,
            () -> reader.readSongs(tempDir.resolve("songs.json").toString()));

        assertEquals(RecordType.SONG, e.getRecordType());
        assertEquals("title", e.getColumn());
    }

    @Test
    public void testReadSongs_ArrayInStringColumnFails() throws Exception {
        TestData.writeLines(tempDir.resolve("songs.json"),
            TestData.scenarioSongJson(),
            TestData.scenarioSongJson()
                .replace("\"song_id\": \"S1\"", "\"song_id\": \"S2\"")
                .replace("\"artist_name\": \"Artist\"", "\"artist_name\": [\"Artist\", \"Guest\"]"));

        SchemaViolationException e = assertThrows(SchemaViolationException.class,
            () -> reader.readSongs(tempDir.resolve("songs.json").toString()));

        assertEquals("artist_name", e.getColumn());
    }

    @Test
    public void testReadLogs_BooleanInStringColumnFails() throws Exception {
        TestData.writeLines(tempDir.resolve("logs.json"),
            TestData.scenarioLogJson().replace("\"userId\": \"U1\"", "\"userId\": true"));

        SchemaViolationException e = assertThrows(SchemaViolationException.class,
            () -> reader.readLogs(tempDir.resolve("logs.json").toString()));

        assertEquals(RecordType.LOG, e.getRecordType());
        assertEquals("userId", e.getColumn());
    }

    @Test
    public void testReadLogs_BooleanInOptionalStringColumnFails() throws Exception {
        TestData.writeLines(tempDir.resolve("logs.json"),
            TestData.scenarioLogJson().replace("\"level\": \"free\"", "\"level\": false"));

        SchemaViolationException e = assertThrows(SchemaViolationException.class,
            () -> reader.readLogs(tempDir.resolve("logs.json").toString()));

        assertEquals("level", e.getColumn());
    }

    @Test
    public void testReadLogs_StringsThatLookLikeJsonAreAccepted() throws Exception {
        TestData.writeLines(tempDir.resolve("logs.json"),
            TestData.logJson("NextSong", "U1", "{curly}", "true", TestData.SCENARIO_TS, "[paid]"));

        Row row = reader.readLogs(tempDir.resolve("logs.json").toString()).first();

        assertEquals("{curly}", row.getAs("song"));
        assertEquals("true", row.getAs("artist"));
        assertEquals("[paid]", row.getAs("level"));
    }

    @Test
    public void testFirstNonTextField() {
        String[] columns = {"title", "artist_name"};

        assertNull(IngestionReader.firstNonTextField("{\"title\": \"T\", \"artist_name\": 12.5}", columns));
        assertNull(IngestionReader.firstNonTextField("{\"title\": null}", columns));
        assertNull(IngestionReader.firstNonTextField("   ", columns));
        assertNull(IngestionReader.firstNonTextField("{not json", columns));
        assertEquals("title", IngestionReader.firstNonTextField("{\"title\": {}}", columns));
        assertEquals("artist_name",
            IngestionReader.firstNonTextField("[{\"title\": \"T\"}, {\"artist_name\": false}]", columns));
    }

    @Test
    public void testMalformedRecordClassification() {
        assertTrue(IngestionReader.isMalformedRecord(new SparkException(
            "Job aborted due to stage failure: [MALFORMED_RECORD_IN_PARSING.WITHOUT_SUGGESTION] "
                + "Malformed records are detected in record parsing")));
        assertTrue(IngestionReader.isMalformedRecord(
            new RuntimeException("wrapper", new SparkException("Malformed records are detected in record parsing"))));
        assertFalse(IngestionReader.isMalformedRecord(
            new SparkException("Job aborted", new IOException("Access Denied (Service: Amazon S3; Status Code: 403)"))));
        assertFalse(IngestionReader.isMalformedRecord(new SparkException("Executor lost")));
    }

    @Test
    public void testRead_MissingLocationFails() {
        EtlException e = assertThrows(EtlException.class,
            () -> reader.readLogs(tempDir.resolve("does_not_exist/*.json").toString()));

        assertFalse(e instanceof SchemaViolationException);
    }
}
