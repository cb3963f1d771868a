package org.pragmatica.sentinel.shared;

import io.vavr.control.Either;
import io.vavr.control.Try;
import org.pragmatica.sentinel.frontend.FrontEndError;

import java.nio.file.Files;
import java.nio.file.Path;

/// Java source file with its content.
public record SourceFile(Path path, String content) {

    public static SourceFile sourceFile(Path path, String content) {
        return new SourceFile(path, content);
    }

    /// Read a file from disk as UTF-8.
    public static Either<SentinelError, SourceFile> read(Path path) {
        return Try.of(() -> new SourceFile(path, Files.readString(path)))
                  .toEither()
                  .mapLeft(cause -> new FrontEndError.ReadFailed(path.toString(), String.valueOf(cause.getMessage())));
    }

    public String fileName() {
        return path.toString();
    }

    public SourceFile withContent(String newContent) {
        return new SourceFile(path, newContent);
    }
}
