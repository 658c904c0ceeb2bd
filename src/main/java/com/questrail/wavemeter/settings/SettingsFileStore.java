package com.questrail.wavemeter.settings;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * SettingsFileStore
 * =============================================================================
 * JSON persistence of a {@link SettingsRecord}.
 *
 * <h2>Format</h2>
 * <pre>
 * {
 *   "saved_at": "2025-03-14T10:15:30Z",
 *   "ports": {
 *     "1": { "P": 0.5, "Polarity": 1, "Setpoint": 348.66641, ... },
 *     ...
 *   }
 * }
 * </pre>
 * Keys are quantity wire names. Integer and boolean settings are written as
 * integers. Unknown keys are ignored on load; a {@code null} value means the
 * setting was not available at save time.
 *
 * <h2>Durability</h2>
 * {@link #save(SettingsRecord)} writes a sibling temp file and moves it over
 * the target atomically, so a crash leaves either the old or the new file.
 */
public final class SettingsFileStore
{
    private static final Logger log = LoggerFactory.getLogger(SettingsFileStore.class);

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    private final Path file;

    public SettingsFileStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    public void save(SettingsRecord record) throws IOException {
        Objects.requireNonNull(record, "record");

        JsonObject root = new JsonObject();
        root.addProperty("saved_at", record.savedAt().toString());
        JsonObject ports = new JsonObject();
        record.channels().forEach((channel, settings) -> {
            JsonObject port = new JsonObject();
            settings.values().forEach((q, v) -> {
                if (q.kind() == Quantity.Kind.DOUBLE) {
                    port.addProperty(q.wireName(), v);
                } else {
                    port.addProperty(q.wireName(), Math.round(v));
                }
            });
            ports.add(Integer.toString(channel.value()), port);
        });
        root.add("ports", ports);

        Path absolute = file.toAbsolutePath();
        Path dir = absolute.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        try {
            try (Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                gson.toJson(root, out);
            }
            try {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported for {}; replacing non-atomically", absolute);
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        log.info("Settings saved to {} ({} channels)", absolute, record.channels().size());
    }

    /**
     * @return the saved record, or empty when the file does not exist
     * @throws IOException if the file cannot be read or is not a settings record
     */
    public Optional<SettingsRecord> load() throws IOException {
        if (!Files.exists(file)) {
            log.info("No saved settings at {}", file);
            return Optional.empty();
        }

        JsonObject root;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement parsed = JsonParser.parseReader(in);
            if (!parsed.isJsonObject()) {
                throw new IOException("Settings file " + file + " is not a JSON object");
            }
            root = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Settings file " + file + " is not valid JSON", e);
        }

        Instant savedAt = parseSavedAt(root.get("saved_at"));
        JsonElement portsElement = root.get("ports");
        if (portsElement == null || !portsElement.isJsonObject()) {
            throw new IOException("Settings file " + file + " has no \"ports\" object");
        }

        Map<ChannelId, ChannelSettings> channels = new TreeMap<>();
        for (Map.Entry<String, JsonElement> port : portsElement.getAsJsonObject().entrySet()) {
            ChannelId channel;
            try {
                channel = ChannelId.of(Integer.parseInt(port.getKey().trim()));
            } catch (IllegalArgumentException e) {
                throw new IOException("Settings file " + file + " has an invalid port: " + port.getKey(), e);
            }
            if (!port.getValue().isJsonObject()) {
                throw new IOException("Settings of port " + port.getKey() + " must be an object");
            }
            channels.put(channel, parseChannel(port.getKey(), port.getValue().getAsJsonObject()));
        }

        SettingsRecord record = new SettingsRecord(savedAt, channels);
        log.info("Settings loaded from {} (saved at {})", file, savedAt);
        return Optional.of(record);
    }

    private ChannelSettings parseChannel(String port, JsonObject obj) throws IOException {
        Map<Quantity, Double> values = new EnumMap<>(Quantity.class);
        for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
            Optional<Quantity> quantity = Quantity.fromName(e.getKey()).filter(Quantity::persisted);
            if (quantity.isEmpty()) {
                log.debug("Ignoring unknown setting {} of port {}", e.getKey(), port);
                continue;
            }
            JsonElement v = e.getValue();
            if (v == null || v.isJsonNull()) {
                continue;
            }
            try {
                values.put(quantity.get(), v.getAsDouble());
            } catch (RuntimeException ex) {
                throw new IOException("Setting " + e.getKey() + " of port " + port + " is not a number", ex);
            }
        }
        return new ChannelSettings(values);
    }

    private Instant parseSavedAt(JsonElement element) throws IOException {
        if (element == null || element.isJsonNull()) {
            throw new IOException("Settings file " + file + " has no saved_at");
        }
        String text = element.getAsString();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException notAnInstant) {
            try {
                // Older files carry a local timestamp without offset.
                return LocalDateTime.parse(text).atZone(ZoneId.systemDefault()).toInstant();
            } catch (DateTimeParseException e) {
                throw new IOException("Settings file " + file + " has an invalid saved_at: " + text, e);
            }
        }
    }
}
