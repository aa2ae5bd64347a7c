package im.arun.outline.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OutlineCLITest {

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new OutlineCLI());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void printsOutlineForSnapshotFile() throws IOException {
        Path snapshot = write("page.txt", listing(10));

        int exitCode = commandLine.execute(snapshot.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .startsWith("Page Outline (")
            .contains("- listitem [ref=li0]")
            .contains("(... and 9 more similar)");
    }

    @Test
    void writesJsonWithStatistics() throws IOException {
        Path snapshot = write("page.txt", listing(10));

        int exitCode = commandLine.execute("--format", "json", snapshot.toString());

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.get("source").asText()).isEqualTo(snapshot.toString());
        assertThat(json.get("original_lines").asInt()).isEqualTo(22);
        assertThat(json.get("rendered_lines").asInt()).isLessThan(22);
        assertThat(json.get("pattern_count").asInt()).isEqualTo(1);
        assertThat(json.get("reference_count").asInt()).isEqualTo(21);
    }

    @Test
    void labelsEachFileWhenGivenSeveral() throws IOException {
        Path first = write("first.txt", listing(4));
        Path second = write("second.txt", "- button \"Go\" [ref=g1]");

        int exitCode = commandLine.execute(first.toString(), second.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("==> " + first + " <==")
            .contains("==> " + second + " <==")
            .contains("- button \"Go\" [ref=g1]");
    }

    @Test
    void rawModeEchoesSnapshot() throws IOException {
        String text = "- main [ref=m0]\n  - button \"Go\" [ref=g1]";
        Path snapshot = write("page.txt", text);

        int exitCode = commandLine.execute("--mode", "raw", snapshot.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().trim()).isEqualTo(text);
    }

    @Test
    void writesOutputFile() throws IOException {
        Path snapshot = write("page.txt", listing(5));
        Path target = dir.resolve("outline.txt");

        int exitCode = commandLine.execute("--output", target.toString(), snapshot.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(target)).startsWith("Page Outline (");
        assertThat(err.toString()).contains("Output written to: " + target);
    }

    @Test
    void reportsMissingFile() {
        int exitCode = commandLine.execute(dir.resolve("missing.txt").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error: Snapshot file not found");
    }

    @Test
    void rejectsZeroLineBudget() throws IOException {
        Path snapshot = write("page.txt", listing(3));

        int exitCode = commandLine.execute("--max-lines", "0", snapshot.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("maxLines must be positive");
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private static String listing(int items) {
        List<String> lines = new ArrayList<>();
        lines.add("- list [ref=l0]");
        for (int i = 0; i < items; i++) {
            lines.add("  - listitem [ref=li" + i + "]");
            lines.add("    - link \"Item " + i + "\" [ref=a" + i + "]");
        }
        lines.add("- contentinfo");
        return String.join("\n", lines);
    }
}
