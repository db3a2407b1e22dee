package ai.latex.translator.fix;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes LaTeX documents as UTF-8. Writes go to a sibling temporary file that is then
 * renamed over the target, so a failed write never leaves a truncated document.
 */
public class DocumentWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentWriter.class);

    public String read(Path file) {
        Objects.requireNonNull(file, "file");
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new FixException("Failed to read document: " + file, ex);
        }
    }

    public void write(Path target, String content) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(content, "content");
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temporary = null;
        try {
            Files.createDirectories(directory);
            temporary = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
            Files.writeString(temporary, content, StandardCharsets.UTF_8);
            moveIntoPlace(temporary, absolute);
            temporary = null;
        } catch (IOException ex) {
            throw new FixException("Failed to write document: " + target, ex);
        } finally {
            if (temporary != null) {
                deleteQuietly(temporary);
            }
        }
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temporary) {
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException cleanupFailure) {
            LOGGER.warn("Failed to delete temporary file {}", temporary, cleanupFailure);
        }
    }
}
