package com.ryuqq.roompeek.adapter.file;

import com.ryuqq.roompeek.core.context.PeekContext;
import com.ryuqq.roompeek.core.event.OutputEvent;
import com.ryuqq.roompeek.core.spi.OutputEventStream;
import com.ryuqq.roompeek.core.spi.OutputEventStreamException;
import com.ryuqq.roompeek.json.jackson.JacksonOutputEventCodec;
import com.ryuqq.roompeek.json.jackson.OutputEventCodecException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Durable append-only {@link OutputEventStream} backed by a JSON-lines file.
 *
 * <p>Each event is one line: {@code <roomId>\t<event JSON>}. All lines of one append call
 * are written with a single channel write, followed by an fsync when configured, so a
 * successful return means the batch is on disk. A failed append truncates the file back
 * to its previous size.</p>
 *
 * <p><strong>Thread-safety:</strong> appends are serialized on the instance. Multiple
 * processes must not share one file.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (FileOutputEventStream stream = FileOutputEventStream.open(
 *         new FileOutputEventStreamConfig(Path.of("data/output-events.jsonl")))) {
 *     stream.append(context, roomId, List.of(OutputEvent.newPeek(roomId, userId, deviceId)));
 * }
 * </pre>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public final class FileOutputEventStream implements OutputEventStream, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FileOutputEventStream.class);
    private static final char SEPARATOR = '\t';

    private final FileOutputEventStreamConfig config;
    private final JacksonOutputEventCodec codec;
    private final FileChannel channel;
    private boolean closed;

    FileOutputEventStream(FileOutputEventStreamConfig config, JacksonOutputEventCodec codec, FileChannel channel) {
        this.config = config;
        this.codec = codec;
        this.channel = channel;
    }

    /**
     * Opens (or creates) the log file for appending.
     *
     * @param config stream settings
     * @return an open stream
     * @throws OutputEventStreamException if the file cannot be opened
     */
    public static FileOutputEventStream open(FileOutputEventStreamConfig config) {
        return open(config, new JacksonOutputEventCodec());
    }

    /**
     * Opens (or creates) the log file with a custom codec.
     *
     * @param config stream settings
     * @param codec event codec
     * @return an open stream
     * @throws OutputEventStreamException if the file cannot be opened
     */
    public static FileOutputEventStream open(FileOutputEventStreamConfig config, JacksonOutputEventCodec codec) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(codec, "codec");
        Path file = config.file().toAbsolutePath();
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            log.info("Opened output event stream at {} (fsync={})", file, config.fsync());
            return new FileOutputEventStream(config, codec, channel);
        } catch (IOException e) {
            throw new OutputEventStreamException("Failed to open output event stream at " + file, e);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void append(PeekContext context, String roomId, List<OutputEvent> events) {
        Objects.requireNonNull(context, "context");
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("roomId cannot be null or blank");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }

        StringBuilder lines = new StringBuilder();
        for (OutputEvent event : events) {
            lines.append(roomId).append(SEPARATOR).append(encode(event)).append('\n');
        }
        ByteBuffer buffer = ByteBuffer.wrap(lines.toString().getBytes(StandardCharsets.UTF_8));

        synchronized (this) {
            if (closed) {
                throw new OutputEventStreamException("Output event stream is closed");
            }
            context.throwIfDone();
            long start = -1;
            try {
                start = channel.size();
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                if (config.fsync()) {
                    channel.force(false);
                }
            } catch (IOException e) {
                OutputEventStreamException failure = new OutputEventStreamException(
                    "Failed to append " + events.size() + " event(s) for " + roomId + " to " + config.file(), e);
                if (start >= 0) {
                    rollBack(start, failure);
                }
                throw failure;
            }
        }
    }

    /**
     * Cuts the file back to its size before a failed append, so no torn line is left
     * in front of the next record.
     */
    private void rollBack(long size, OutputEventStreamException failure) {
        try {
            channel.truncate(size);
        } catch (IOException e) {
            failure.addSuppressed(e);
            log.error("Failed to roll back {} to {} bytes after a failed append", config.file(), size, e);
        }
    }

    /**
     * Reads every record currently in the log file, in append order.
     *
     * @return stored records
     * @throws OutputEventStreamException if the file cannot be read or a line is corrupt
     */
    public List<StoredEvent> readAll() {
        return readAll(config.file(), codec);
    }

    /**
     * Reads every record in a log file, in append order.
     *
     * @param file log file path
     * @param codec event codec
     * @return stored records (empty if the file does not exist)
     * @throws OutputEventStreamException if the file cannot be read or a line is corrupt
     */
    public static List<StoredEvent> readAll(Path file, JacksonOutputEventCodec codec) {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<StoredEvent> stored = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty()) {
                    continue;
                }
                int separator = line.indexOf(SEPARATOR);
                if (separator <= 0) {
                    throw new OutputEventStreamException("Corrupt record at " + file + ":" + lineNumber);
                }
                try {
                    stored.add(new StoredEvent(line.substring(0, separator), codec.decode(line.substring(separator + 1))));
                } catch (OutputEventCodecException e) {
                    throw new OutputEventStreamException("Corrupt record at " + file + ":" + lineNumber, e);
                }
            }
        } catch (IOException e) {
            throw new OutputEventStreamException("Failed to read output event stream at " + file, e);
        }
        return stored;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            channel.close();
        } catch (IOException e) {
            throw new OutputEventStreamException("Failed to close output event stream at " + config.file(), e);
        }
    }

    private String encode(OutputEvent event) {
        try {
            return codec.encode(Objects.requireNonNull(event, "event"));
        } catch (OutputEventCodecException e) {
            throw new OutputEventStreamException("Failed to encode " + event.type() + " event", e);
        }
    }

    /**
     * A record read back from the log.
     *
     * @param roomId partition key
     * @param event the event
     */
    public record StoredEvent(String roomId, OutputEvent event) {
    }
}
