package mutant.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GenerationSessionTest {

    private static final Logger LOGGER = Logger.getLogger(GenerationSessionTest.class.getName());

    private static final String SAMPLE = String.join("\n",
            "class Sample {",
            "    int max(int a, int b) {",
            "        if (a > b) {",
            "            return a;",
            "        }",
            "        return b;",
            "    }",
            "    boolean isEmpty(String s) {",
            "        return s.isEmpty();",
            "    }",
            "}");

    @TempDir
    Path inputDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @BeforeEach
    void writeSample() throws IOException {
        Files.writeString(inputDir.resolve("Sample.java"), SAMPLE);
        Files.writeString(inputDir.resolve("notes.txt"), "not java");
    }

    private GeneratorConfig.Builder config() {
        return GeneratorConfig.builder("t", LOGGER).inputDir(inputDir).rngSeed(42L);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void reportsEveryMethod() {
        SessionSummary summary = new GenerationSession(config().build(), out).run();

        assertEquals(1, summary.files());
        assertEquals(2, summary.methods());
        assertEquals(0, summary.failures());
        assertTrue(summary.mutants() > 0);
        assertTrue(output().contains("== Sample#max ("));
        assertTrue(output().contains("== Sample#isEmpty ("));
        assertTrue(output().contains("-- mutant 1 @ "));
        assertTrue(output().contains("== " + summary));
    }

    @Test
    void methodFilterRestrictsSubjects() {
        SessionSummary summary = new GenerationSession(config().methodFilter("max").build(), out).run();

        assertEquals(1, summary.methods());
        assertTrue(output().contains("== Sample#max ("));
        assertFalse(output().contains("Sample#isEmpty"));
    }

    @Test
    void printsTreeWhenAsked() {
        new GenerationSession(config().printAst(true).methodFilter("max").build(), out).run();

        assertTrue(output().contains("METHOD @ "));
        assertTrue(output().contains("----IF @ "));
    }

    @Test
    void mutateFileReturnsMutantsPerMethod() {
        GenerationSession session = new GenerationSession(config().build(), out);

        List<MethodMutants> results = session.mutateFile(inputDir.resolve("Sample.java"));

        assertEquals(2, results.size());
        MethodMutants max = results.stream()
                .filter(result -> result.subject().equals("Sample#max"))
                .findFirst()
                .orElseThrow();
        assertEquals("max", max.method().string("name"));
        assertFalse(max.mutants().isEmpty());
    }

    @Test
    void emptyDirectoryYieldsEmptySummary() throws IOException {
        Path empty = Files.createDirectory(inputDir.resolve("empty"));

        SessionSummary summary = new GenerationSession(
                GeneratorConfig.builder("t", LOGGER).inputDir(empty).rngSeed(1L).build(), out).run();

        assertEquals(new SessionSummary(0, 0, 0, 0), summary);
    }
}
