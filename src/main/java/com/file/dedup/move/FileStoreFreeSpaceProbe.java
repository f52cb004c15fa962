package com.file.dedup.move;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link FreeSpaceProbe} reading the usable space of the directory's file store.
 */
public class FileStoreFreeSpaceProbe implements FreeSpaceProbe {

    @Override
    public long usableSpace(Path directory) throws IOException {
        return Files.getFileStore(directory).getUsableSpace();
    }
}
