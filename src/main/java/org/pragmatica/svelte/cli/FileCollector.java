package org.pragmatica.svelte.cli;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Utility for collecting component files from paths.
 */
public final class FileCollector {

    static final String EXTENSION = ".svelte";

    private FileCollector() {}

    /**
     * Collect component files from a list of paths (files or directories).
     * Directories are scanned recursively; files named explicitly are taken
     * whatever their extension.
     *
     * @param paths        List of paths to collect from
     * @param errorHandler Handler for errors during collection
     * @return List of file paths, directory contents in sorted order
     */
    public static List<Path> collectSvelteFiles(List<Path> paths, Consumer<String> errorHandler) {
        var files = new ArrayList<Path>();

        for (var path : paths) {
            if (Files.isDirectory(path)) {
                try {
                    files.addAll(findSvelteFiles(path));
                } catch (IOException | UncheckedIOException e) {
                    errorHandler.accept("Error scanning " + path + ": " + e.getMessage());
                }
            } else if (Files.isRegularFile(path)) {
                files.add(path);
            } else {
                errorHandler.accept("No such file or directory: " + path);
            }
        }

        return files;
    }

    private static List<Path> findSvelteFiles(Path directory) throws IOException {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                       .filter(file -> file.getFileName().toString().endsWith(EXTENSION))
                       .sorted()
                       .collect(Collectors.toList());
        }
    }
}
