package com.ryuqq.roompeek.adapter.file;

import java.nio.file.Path;

/**
 * File output stream settings (immutable record).
 *
 * <ul>
 *   <li>file: the JSON-lines log file; parent directories are created on open</li>
 *   <li>fsync: force every append to the storage device before returning (default true)</li>
 * </ul>
 *
 * @param file log file path
 * @param fsync whether to fsync after each append
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public record FileOutputEventStreamConfig(Path file, boolean fsync) {

    /**
     * Creates a config with fsync enabled.
     *
     * @param file log file path
     */
    public FileOutputEventStreamConfig(Path file) {
        this(file, true);
    }

    public FileOutputEventStreamConfig {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
    }

    public FileOutputEventStreamConfig withFsync(boolean fsync) {
        return new FileOutputEventStreamConfig(this.file, fsync);
    }
}
