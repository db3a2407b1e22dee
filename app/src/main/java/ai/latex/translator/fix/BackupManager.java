package ai.latex.translator.fix;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains the single-level {@code <file>.backup} copy used as the rollback point for in-place fixes.
 */
public class BackupManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackupManager.class);

    static final String BACKUP_SUFFIX = ".backup";

    public Path backupPathFor(Path file) {
        Objects.requireNonNull(file, "file");
        return file.resolveSibling(file.getFileName().toString() + BACKUP_SUFFIX);
    }

    public Path createBackup(Path file) {
        Path backup = backupPathFor(file);
        try {
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new FixException("Failed to create backup for " + file, ex);
        }
        LOGGER.debug("Created backup {}", backup);
        return backup;
    }

    public boolean hasBackup(Path file) {
        return Files.isRegularFile(backupPathFor(file));
    }

    public void restore(Path file) {
        Path backup = backupPathFor(file);
        if (!Files.isRegularFile(backup)) {
            throw new FixException("Backup file not found: " + backup);
        }
        try {
            Files.copy(backup, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new FixException("Failed to restore " + file + " from backup", ex);
        }
        LOGGER.info("Restored {} from backup", file);
    }

    public void cleanup(Path file) {
        Path backup = backupPathFor(file);
        try {
            if (Files.deleteIfExists(backup)) {
                LOGGER.debug("Removed backup {}", backup);
            }
        } catch (IOException ex) {
            throw new FixException("Failed to remove backup " + backup, ex);
        }
    }
}
