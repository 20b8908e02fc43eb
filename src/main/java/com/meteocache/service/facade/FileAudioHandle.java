package com.meteocache.service.facade;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

class FileAudioHandle implements AudioHandle {

    private final Path file;

    FileAudioHandle(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public InputStream open() throws IOException {
        return Files.newInputStream(file);
    }

    @Override
    public byte[] readAllBytes() throws IOException {
        return Files.readAllBytes(file);
    }

    @Override
    public long size() throws IOException {
        return Files.size(file);
    }

    @Override
    public Optional<Path> path() {
        return Optional.of(file);
    }

    @Override
    public String toString() {
        return "AudioHandle[" + file + "]";
    }
}
