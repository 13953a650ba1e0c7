package io.vaultflow.engine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The filesystem calls the relocator is built from. Production code uses {@link #nio()};
 * tests substitute a decorator that fails on a chosen call.
 */
public interface FileOperations {

    /**
     * Writes a new file. Fails if {@code path} already exists.
     */
    void create(Path path, String content) throws IOException;

    String read(Path path) throws IOException;

    /**
     * Single atomic rename onto a fresh, uniquely named path such as an in-flight marker.
     * Fails with {@link java.nio.file.NoSuchFileException} if {@code source} is gone.
     */
    void rename(Path source, Path target) throws IOException;

    /**
     * Gives {@code source} the name {@code target} without ever replacing an existing file.
     * Fails with {@link java.nio.file.FileAlreadyExistsException} if {@code target} exists;
     * on any failure {@code source} is left in place and {@code target} is not created.
     */
    void publish(Path source, Path target) throws IOException;

    void delete(Path path) throws IOException;

    static FileOperations nio() {
        return NioFileOperations.INSTANCE;
    }
}
