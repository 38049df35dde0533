package com.perpclear.clearing.journal;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Append-only JSONL daily clearing log, one file per UTC day of venue time.
 * Files: {journalDir}/2026-02-08.jsonl. Without a directory, events only reach listeners.
 */
public class ClearingJournal implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClearingJournal.class);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Path journalDir;
    private final ObjectMapper mapper;
    private final List<Consumer<ClearingEvent>> listeners = new CopyOnWriteArrayList<>();

    private volatile LocalDate currentDate;
    private volatile BufferedWriter currentWriter;

    public ClearingJournal(Path journalDir) {
        this.journalDir = journalDir;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        if (journalDir != null) {
            try {
                Files.createDirectories(journalDir);
            } catch (IOException e) {
                log.error("Failed to create journal directory: {}", journalDir, e);
            }
        }
    }

    public static ClearingJournal inMemory() {
        return new ClearingJournal(null);
    }

    /**
     * Log a clearing event.
     */
    public synchronized void log(ClearingEvent event) {
        if (journalDir != null) {
            try {
                ensureWriter(dateOf(event.getVenueTime()));
                currentWriter.write(mapper.writeValueAsString(event));
                currentWriter.newLine();
                currentWriter.flush();
            } catch (IOException e) {
                log.error("Failed to write journal event: {}", e.getMessage());
            }
        }

        listeners.forEach(l -> {
            try { l.accept(event); } catch (Exception e) { log.warn("Journal listener error", e); }
        });
    }

    public void subscribe(Consumer<ClearingEvent> listener) {
        listeners.add(listener);
    }

    /** UTC calendar day of a venue timestamp in epoch seconds. */
    public static LocalDate dateOf(long venueTime) {
        return Instant.ofEpochSecond(venueTime).atZone(ZoneOffset.UTC).toLocalDate();
    }

    public List<ClearingEvent> readDate(LocalDate date) {
        List<ClearingEvent> events = new ArrayList<>();
        if (journalDir == null) return events;
        Path file = journalDir.resolve(date.format(DATE_FORMAT) + ".jsonl");
        if (!Files.exists(file)) return events;

        try {
            for (String line : Files.readAllLines(file)) {
                if (!line.isBlank()) {
                    events.add(mapper.readValue(line, ClearingEvent.class));
                }
            }
        } catch (IOException e) {
            log.error("Failed to read journal file: {}", file, e);
        }
        return events;
    }

    @Override
    public synchronized void close() {
        if (currentWriter != null) {
            try {
                currentWriter.close();
            } catch (IOException e) {
                log.error("Failed to close journal writer", e);
            }
            currentWriter = null;
            currentDate = null;
        }
    }

    private void ensureWriter(LocalDate date) throws IOException {
        if (!date.equals(currentDate)) {
            if (currentWriter != null) {
                currentWriter.close();
            }
            Path file = journalDir.resolve(date.format(DATE_FORMAT) + ".jsonl");
            currentWriter = Files.newBufferedWriter(file,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            currentDate = date;
        }
    }
}
