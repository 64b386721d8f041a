package com.phillippitts.voicenotes.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * File writes that never leave a half-written target behind: content goes to a sibling temp
 * file which is then moved over the target.
 */
public final class AtomicFiles {

    private static final Logger LOG = LogManager.getLogger(AtomicFiles.class);

    private AtomicFiles() {}

    /**
     * Atomically replaces {@code path} with {@code content}, creating parent directories.
     *
     * @param ownerOnly restrict the file to owner read/write where POSIX permissions are supported
     */
    public static void writeString(Path path, String content, boolean ownerOnly) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        if (ownerOnly) {
            restrictToOwner(tmp);
        }
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void restrictToOwner(Path path) throws IOException {
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            LOG.debug("POSIX permissions not supported for {}", path.getFileName());
        }
    }
}
