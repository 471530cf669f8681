package com.sparkify.etl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates sample song and log data in the layout the pipeline reads by default:
 * song_data/X/Y/Z/TRXYZ....json (one song per file) and log_data/2018/11/2018-11-DD-events.json.
 * Some plays reference songs that are not in the catalogue, and some events are not
 * NextSong, so every filter and join path gets exercised.
 */
public class SampleDataGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SampleDataGenerator.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String[] OTHER_PAGES = {"Home", "Login", "Logout", "Settings", "About", "Help"};
    private static final String[] FIRST_NAMES = {"Lily", "Jacob", "Kate", "Chloe", "Aleena", "Tegan", "Ryan"};
    private static final String[] LAST_NAMES = {"Koch", "Klein", "Harrell", "Cuevas", "Kirby", "Levine", "Smith"};
    private static final String[] LOCATIONS = {
        "San Francisco-Oakland-Hayward, CA", "Chicago-Naperville-Elgin, IL-IN-WI",
        "Lansing-East Lansing, MI", "Portland-South Portland, ME", "Atlanta-Sandy Springs-Roswell, GA"
    };
    private static final String USER_AGENT =
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_9_4) AppleWebKit/537.36 (KHTML, like Gecko)";

    private final Random random;

    public SampleDataGenerator(long seed) {
        this.random = new Random(seed);
    }

    public static void main(String[] args) {
        int numSongs = args.length > 0 ? Integer.parseInt(args[0]) : 500;
        int numEvents = args.length > 1 ? Integer.parseInt(args[1]) : 10_000;
        Path root = Paths.get(args.length > 2 ? args[2] : "data");

        logger.info("Generating {} songs and {} log events under {}", numSongs, numEvents, root);
        new SampleDataGenerator(42).generate(numSongs, numEvents, root);
        logger.info("Sample data generated at: {}", root.toAbsolutePath());
    }

    public void generate(int numSongs, int numEvents, Path root) {
        try {
            List<ObjectNode> songs = writeSongs(numSongs, root.resolve("song_data"));
            writeLogs(numEvents, songs, root.resolve("log_data"));
        } catch (IOException e) {
            throw new UncheckedIOException("Error generating sample data under " + root, e);
        }
    }

    private List<ObjectNode> writeSongs(int numSongs, Path songRoot) throws IOException {
        List<ObjectNode> songs = new ArrayList<>(numSongs);
        int numArtists = Math.max(1, numSongs / 3);
        for (int i = 0; i < numSongs; i++) {
            int artist = random.nextInt(numArtists);
            ObjectNode song = MAPPER.createObjectNode();
            song.put("num_songs", 1);
            song.put("artist_id", String.format("AR%06d", artist));
            if (random.nextDouble() < 0.6) {
                song.put("artist_latitude", 20 + artist % 40 + 0.5);
                song.put("artist_longitude", -120 + artist % 50 + 0.25);
            } else {
                song.putNull("artist_latitude");
                song.putNull("artist_longitude");
            }
            song.put("artist_location", LOCATIONS[artist % LOCATIONS.length]);
            song.put("artist_name", "Artist " + artist);
            song.put("song_id", String.format("SO%06d", i));
            song.put("title", "Song " + i);
            song.put("duration", 120 + random.nextInt(240) + random.nextDouble());
            song.put("year", random.nextDouble() < 0.3 ? 0 : 1960 + random.nextInt(60));
            songs.add(song);

            String trackId = String.format("TR%c%c%c%06d", letter(i), letter(i / 26), letter(i / 676), i);
            Path dir = songRoot.resolve(trackId.substring(2, 3))
                .resolve(trackId.substring(3, 4))
                .resolve(trackId.substring(4, 5));
            Files.createDirectories(dir);
            Files.write(dir.resolve(trackId + ".json"), MAPPER.writeValueAsBytes(song));
        }
        return songs;
    }

    private void writeLogs(int numEvents, List<ObjectNode> songs, Path logRoot) throws IOException {
        Path dir = logRoot.resolve("2018").resolve("11");
        Files.createDirectories(dir);

        int numUsers = Math.max(1, numEvents / 100);
        long dayStart = LocalDate.of(2018, 11, 1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        int eventsPerDay = Math.max(1, numEvents / 30);

        BufferedWriter writer = null;
        int currentDay = -1;
        try {
            for (int i = 0; i < numEvents; i++) {
                int day = Math.min(29, i / eventsPerDay);
                if (day != currentDay) {
                    if (writer != null) {
                        writer.close();
                    }
                    String fileName = String.format("2018-11-%02d-events.json", day + 1);
                    writer = Files.newBufferedWriter(dir.resolve(fileName), StandardCharsets.UTF_8);
                    currentDay = day;
                }
                long ts = dayStart + day * 86_400_000L + random.nextInt(86_400_000);
                writer.write(MAPPER.writeValueAsString(event(ts, i, numUsers, songs)));
                writer.newLine();
            }
        } finally {
            if (writer != null) {
                writer.close();
            }
        }
    }

    private ObjectNode event(long ts, int index, int numUsers, List<ObjectNode> songs) {
        int user = 1 + random.nextInt(numUsers);
        boolean play = random.nextDouble() < 0.8;
        ObjectNode event = MAPPER.createObjectNode();

        if (play) {
            if (!songs.isEmpty() && random.nextDouble() < 0.7) {
                ObjectNode song = songs.get(random.nextInt(songs.size()));
                event.put("artist", song.get("artist_name").asText());
                event.put("song", song.get("title").asText());
                event.put("length", song.get("duration").asDouble());
            } else {
                // not in the catalogue, dropped by the inner join
                event.put("artist", "Unknown Artist feat. Guest " + random.nextInt(50));
                event.put("song", "Unlisted Track " + random.nextInt(1000));
                event.put("length", 200.0);
            }
        } else {
            event.put("artist", "");
            event.put("song", "");
            event.putNull("length");
        }

        event.put("auth", "Logged In");
        event.put("firstName", FIRST_NAMES[user % FIRST_NAMES.length]);
        event.put("gender", user % 2 == 0 ? "F" : "M");
        event.put("itemInSession", index % 50);
        event.put("lastName", LAST_NAMES[user % LAST_NAMES.length]);
        event.put("level", random.nextDouble() < 0.3 ? "paid" : "free");
        event.put("location", LOCATIONS[user % LOCATIONS.length]);
        event.put("method", play ? "PUT" : "GET");
        event.put("page", play ? DimensionBuilder.NEXT_SONG_PAGE : OTHER_PAGES[random.nextInt(OTHER_PAGES.length)]);
        event.put("registration", (double) Instant.parse("2018-09-01T00:00:00Z").toEpochMilli() + user * 1000.0);
        event.put("sessionId", (long) (user * 1000 + ts / 3_600_000L % 24));
        event.put("status", 200L);
        event.put("ts", ts);
        event.put("userAgent", USER_AGENT);
        event.put("userId", String.valueOf(user));
        return event;
    }

    private static char letter(int n) {
        return (char) ('A' + Math.floorMod(n, 26));
    }
}
