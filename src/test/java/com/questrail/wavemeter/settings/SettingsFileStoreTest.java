package com.questrail.wavemeter.settings;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SettingsFileStoreTest {

    private static final Instant SAVED_AT = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path dir;

    private SettingsRecord sampleRecord() {
        ChannelSettings ch1 = new ChannelSettings(Map.of(
                Quantity.SETPOINT, 348.66641,
                Quantity.PID_P, 0.25,
                Quantity.DEVIATION_CHANNEL, 1.0,
                Quantity.BOUNDS_REF_MID, 1.0));
        ChannelSettings ch3 = new ChannelSettings(Map.of(Quantity.DEVIATION_POLARITY, -1.0));
        return new SettingsRecord(SAVED_AT, Map.of(ChannelId.of(1), ch1, ChannelId.of(3), ch3));
    }

    @Test
    void savedFileHasPortsKeyedByChannelNumber() throws IOException {
        Path file = dir.resolve("pid_config.json");
        new SettingsFileStore(file).save(sampleRecord());

        JsonObject root = JsonParser.parseString(Files.readString(file, StandardCharsets.UTF_8)).getAsJsonObject();
        assertEquals("2026-03-01T12:00:00Z", root.get("saved_at").getAsString());

        JsonObject port1 = root.getAsJsonObject("ports").getAsJsonObject("1");
        assertEquals(348.66641, port1.get("Setpoint").getAsDouble());
        assertEquals(0.25, port1.get("P").getAsDouble());
        assertEquals("1", port1.get("DeviationChannel").getAsString());
        assertEquals("1", port1.get("RefMid").getAsString());
        assertEquals(-1, root.getAsJsonObject("ports").getAsJsonObject("3").get("Polarity").getAsInt());
    }

    @Test
    void loadReturnsWhatWasSaved() throws IOException {
        SettingsFileStore store = new SettingsFileStore(dir.resolve("nested/pid_config.json"));
        store.save(sampleRecord());

        assertEquals(sampleRecord(), store.load().orElseThrow());
    }

    @Test
    void saveLeavesNoTemporaryFileBehind() throws IOException {
        Path file = dir.resolve("pid_config.json");
        SettingsFileStore store = new SettingsFileStore(file);
        store.save(sampleRecord());
        store.save(sampleRecord());

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void missingFileLoadsAsEmpty() throws IOException {
        assertTrue(new SettingsFileStore(dir.resolve("absent.json")).load().isEmpty());
    }

    @Test
    void localTimestampsAndUnknownKeysAreAccepted() throws IOException {
        Path file = dir.resolve("pid_config.json");
        Files.writeString(file, """
                {
                  "saved_at": "2026-03-01T13:00:00.123456",
                  "ports": {
                    "2": {"P": 0.5, "Gain": 7, "Setpoint": null, "UseTa": 1}
                  }
                }
                """);

        SettingsRecord loaded = new SettingsFileStore(file).load().orElseThrow();

        ChannelSettings ch2 = loaded.channels().get(ChannelId.of(2));
        assertEquals(Map.of(Quantity.PID_P, 0.5, Quantity.PID_USE_TA, 1.0), ch2.values());
    }

    @Test
    void malformedFilesAreReported() throws IOException {
        Path file = dir.resolve("pid_config.json");
        SettingsFileStore store = new SettingsFileStore(file);

        Files.writeString(file, "{ not json");
        assertThrows(IOException.class, store::load);

        Files.writeString(file, "[]");
        assertThrows(IOException.class, store::load);

        Files.writeString(file, "{\"saved_at\":\"2026-03-01T12:00:00Z\"}");
        assertThrows(IOException.class, store::load);

        Files.writeString(file, "{\"saved_at\":\"2026-03-01T12:00:00Z\",\"ports\":{\"9\":{}}}");
        assertThrows(IOException.class, store::load);

        Files.writeString(file, "{\"saved_at\":\"2026-03-01T12:00:00Z\",\"ports\":{\"1\":{\"P\":\"high\"}}}");
        assertThrows(IOException.class, store::load);

        Files.writeString(file, "{\"saved_at\":\"yesterday\",\"ports\":{}}");
        assertThrows(IOException.class, store::load);
    }
}
