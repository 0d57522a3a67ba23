package ai.rewrite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void writesReportForDirectory() throws Exception {
        final Path src = tempDir.resolve("src");
        Files.createDirectories(src);
        final String original = "class A {\n    int f(){return   1;}\n}\n";
        Files.writeString(src.resolve("A.java"), original);
        Files.writeString(src.resolve("Broken.java"), "class Broken {\n");
        final Path out = tempDir.resolve("report.json");

        final int code = Main.run(new String[]{src.toString(), "--rules=return-spacing", "--out=" + out});

        assertEquals(0, code);
        assertEquals(original, Files.readString(src.resolve("A.java")));
        final JsonNode root = new ObjectMapper().readTree(out.toFile());
        assertEquals(2, root.get("summary").get("files").asInt());
        assertEquals(1, root.get("summary").get("changes").asInt());
        assertEquals(1, root.get("summary").get("errors").asInt());
        assertEquals("return-spacing", root.get("rules").get(0).get("name").asText());
    }

    @Test
    void excludedFilesProduceNoEntries() throws Exception {
        Files.writeString(tempDir.resolve("A.java"), "class A {\n    int f(){return   1;}\n}\n");
        final Path out = tempDir.resolve("report.json");

        final int code = Main.run(new String[]{tempDir.toString(), "--exclude=*.java", "--out=" + out});

        assertEquals(0, code);
        final JsonNode root = new ObjectMapper().readTree(out.toFile());
        assertEquals(0, root.get("summary").get("changes").asInt());
        assertEquals(3, root.get("rules").size());
    }

    @Test
    void unknownOptionOrRuleIsUsageError() {
        assertEquals(2, Main.run(new String[]{"--bogus"}));
        assertEquals(2, Main.run(new String[]{tempDir.toString(), "--rules=nope", "--out=" + tempDir.resolve("r.json")}));
    }

    @Test
    void excludeFileSkipsCommentsAndBlankLines() throws Exception {
        final Path file = tempDir.resolve("exclude.txt");
        Files.writeString(file, "# generated code\n\ngenerated  # inline note\n**/legacy/**\n");
        final Set<String> excludes = new LinkedHashSet<>();

        Main.loadExcludesFromFile(file, excludes);

        assertEquals(List.of("generated", "**/legacy/**"), List.copyOf(excludes));
        assertTrue(excludes.contains("generated"));
    }
}
