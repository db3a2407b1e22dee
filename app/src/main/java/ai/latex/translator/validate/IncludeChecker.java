package ai.latex.translator.validate;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolves {@code \input} and {@code \include} targets relative to the document directory.
 */
public class IncludeChecker {

    public boolean exists(Path documentDirectory, String target) {
        try {
            Path resolved = documentDirectory.resolve(target);
            if (Files.isRegularFile(resolved)) {
                return true;
            }
            return !target.endsWith(".tex") && Files.isRegularFile(documentDirectory.resolve(target + ".tex"));
        } catch (InvalidPathException ex) {
            return false;
        }
    }
}
