package io.vaultflow.error;

import java.nio.file.Path;

public final class FileOperationException extends VaultException {
    private final Path path;

    public FileOperationException(String message, Path path, Throwable cause) {
        super(ErrorKind.FILE_OPERATION, message, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
