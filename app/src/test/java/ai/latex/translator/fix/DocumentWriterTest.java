package ai.latex.translator.fix;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesContentAndCreatesDirectories() throws Exception {
        DocumentWriter writer = new DocumentWriter();
        Path target = tempDir.resolve("chapters/intro.tex");

        writer.write(target, "\\section{引言}\n");

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("\\section{引言}\n");
        assertThat(writer.read(target)).isEqualTo("\\section{引言}\n");
    }

    @Test
    void replacesExistingContentWithoutLeavingTemporaryFiles() throws Exception {
        DocumentWriter writer = new DocumentWriter();
        Path target = tempDir.resolve("paper.tex");
        Files.writeString(target, "old", StandardCharsets.UTF_8);

        writer.write(target, "new");

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("new");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void readingMissingFileFails() {
        Throwable thrown = catchThrowable(() -> new DocumentWriter().read(tempDir.resolve("missing.tex")));

        assertThat(thrown).isInstanceOf(FixException.class).hasMessageContaining("missing.tex");
    }
}
