package com.invoicebot.common.auth;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;

/**
 * Keeps the latest refresh token issued by the identity endpoint in a file
 * under the data directory, so a restart resumes with the rotated token
 * instead of the one configured at install time.
 */
@Slf4j
public class RefreshTokenStore {

    public static final String FILENAME = "graph_refresh_token";

    private final Path file;

    public RefreshTokenStore(Path file) {
        this.file = file;
    }

    public Optional<String> load() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String token = Files.readString(file, StandardCharsets.UTF_8).trim();
            return token.isEmpty() ? Optional.empty() : Optional.of(token);
        } catch (IOException e) {
            log.warn("Could not read stored refresh token {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Replace the stored token. Written to a sibling temp file first so a crash
     * never leaves a truncated token behind.
     */
    public void save(String token) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = dir.resolve(file.getFileName() + ".tmp");
        Files.writeString(tmp, token, StandardCharsets.UTF_8);
        restrictToOwner(tmp);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        log.info("Refresh token saved to {}", file);
    }

    public Path getFile() {
        return file;
    }

    private static void restrictToOwner(Path path) throws IOException {
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.debug("File system of {} has no POSIX permissions, left as created", path);
        }
    }
}
