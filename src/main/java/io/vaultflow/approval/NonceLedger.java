package io.vaultflow.approval;

import io.vaultflow.error.FileOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Append-only record of nonces consumed by a decision. One nonce per line, each appended
 * with a single write so concurrent deciders never interleave partial lines.
 */
public final class NonceLedger {
    private static final Logger log = LoggerFactory.getLogger(NonceLedger.class);
    private static final Pattern UUID_SHAPE = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

    private final Path ledgerFile;

    public NonceLedger(Path ledgerFile) {
        this.ledgerFile = ledgerFile;
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }

    public static boolean isWellFormed(String nonce) {
        return nonce != null && UUID_SHAPE.matcher(nonce).matches();
    }

    public boolean isConsumed(String nonce) {
        if (nonce == null) {
            return false;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(ledgerFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            throw new FileOperationException("Failed to read nonce ledger: " + ledgerFile, ledgerFile, e);
        }
        for (String line : lines) {
            if (nonce.equals(line.trim())) {
                return true;
            }
        }
        return false;
    }

    public void consume(String nonce) {
        try {
            Files.createDirectories(ledgerFile.getParent());
            Files.write(ledgerFile, (nonce + "\n").getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new FileOperationException("Failed to record consumed nonce in " + ledgerFile, ledgerFile, e);
        }
        log.debug("Consumed approval nonce into {}", ledgerFile);
    }
}
