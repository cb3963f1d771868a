package org.pragmatica.sentinel.shared;

import io.vavr.control.Either;
import io.vavr.control.Try;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Utility for collecting Java source files from paths.
 */
public final class FileCollector {

    private FileCollector() {}

    /**
     * Collect Java files from a list of paths (files or directories).
     * Directories are scanned recursively; results are sorted within each directory.
     * Paths that do not exist, are not Java sources, or cannot be scanned are reported to
     * {@code errorHandler} and skipped.
     *
     * @param paths        List of paths to collect from
     * @param errorHandler Handler for errors during collection
     * @return List of Java file paths
     */
    public static List<Path> collectJavaFiles(List<Path> paths, Consumer<String> errorHandler) {
        var files = new ArrayList<Path>();

        for (var path : paths) {
            if (Files.isDirectory(path)) {
                findJavaFiles(path)
                        .peek(files::addAll)
                        .peekLeft(error -> errorHandler.accept("Error scanning " + path + ": " + error.message()));
            } else if (path.toString().endsWith(".java")) {
                files.add(path);
            } else if (Files.notExists(path)) {
                errorHandler.accept("Cannot read " + path + ": no such file or directory");
            } else {
                errorHandler.accept("Skipping " + path + ": not a Java source file or directory");
            }
        }

        return files;
    }

    private static Either<SentinelError, List<Path>> findJavaFiles(Path directory) {
        return Try.of(() -> {
                      try (var stream = Files.walk(directory)) {
                          return stream.filter(Files::isRegularFile)
                                       .filter(file -> file.toString().endsWith(".java"))
                                       .sorted()
                                       .collect(Collectors.toList());
                      }
                  })
                  .toEither()
                  .mapLeft(SentinelError::unexpected);
    }
}
