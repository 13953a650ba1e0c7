package io.vaultflow.engine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

final class NioFileOperations implements FileOperations {
    static final NioFileOperations INSTANCE = new NioFileOperations();

    private NioFileOperations() {
    }

    @Override
    public void create(Path path, String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE, StandardOpenOption.SYNC);
    }

    @Override
    public String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @Override
    public void rename(Path source, Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    public void publish(Path source, Path target) throws IOException {
        // A hard link is created atomically or not at all; ATOMIC_MOVE would replace target on POSIX.
        Files.createLink(target, source);
        try {
            Files.delete(source);
        } catch (IOException e) {
            try {
                Files.delete(target);
            } catch (IOException undo) {
                e.addSuppressed(undo);
            }
            throw e;
        }
    }

    @Override
    public void delete(Path path) throws IOException {
        Files.delete(path);
    }
}
