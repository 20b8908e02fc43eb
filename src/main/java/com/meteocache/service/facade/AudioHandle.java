package com.meteocache.service.facade;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Backend-neutral reference to a forecast's audio payload: an in-memory blob or a file on disk.
 */
public interface AudioHandle {

    InputStream open() throws IOException;

    byte[] readAllBytes() throws IOException;

    long size() throws IOException;

    /**
     * File location, present only for file-backed audio.
     */
    Optional<Path> path();

    static AudioHandle ofBytes(byte[] bytes) {
        return new ByteArrayAudioHandle(bytes);
    }

    static AudioHandle ofFile(Path file) {
        return new FileAudioHandle(file);
    }
}
