package com.file.dedup.move;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link FileMover} backed by {@link Files}. Moves fall back to copy-and-delete
 * across file stores.
 */
public class NioFileMover implements FileMover {

    @Override
    public long size(Path file) throws IOException {
        return Files.size(file);
    }

    @Override
    public void createDirectories(Path directory) throws IOException {
        Files.createDirectories(directory);
    }

    @Override
    public void move(Path source, Path destination) throws IOException {
        Files.move(source, destination);
    }

    @Override
    public void delete(Path file) throws IOException {
        Files.delete(file);
    }
}
