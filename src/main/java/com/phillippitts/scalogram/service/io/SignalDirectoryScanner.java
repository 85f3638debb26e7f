package com.phillippitts.scalogram.service.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds input files in one directory (not recursive).
 */
public class SignalDirectoryScanner {

    private static final Logger LOG = LogManager.getLogger(SignalDirectoryScanner.class);

    /**
     * Lists regular files whose name ends with {@code extension}, sorted by file name so that
     * batch order is reproducible.
     *
     * @param directory directory to scan; must exist
     * @param extension file name suffix, e.g. {@code .aaa}
     * @return one source per matching file
     * @throws UncheckedIOException if the directory cannot be listed
     */
    public List<SignalSource> scan(Path directory, String extension) {
        try (Stream<Path> entries = Files.list(directory)) {
            List<SignalSource> sources = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(extension))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .<SignalSource>map(AaaFileSignalSource::new)
                    .toList();
            LOG.debug("Found {} {} file(s) in {}", sources.size(), extension, directory);
            return sources;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list directory " + directory, e);
        }
    }
}
