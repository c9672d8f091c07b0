package org.nd;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MainTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testProvenStatementExitsWithZero() {
        assertEquals(Main.EXIT_PROVEN, Main.run(new String[] {"-s", "A -> B, A / B"}));
    }

    @Test
    public void testExhaustedSearchExitsWithTwo() {
        assertEquals(Main.EXIT_EXHAUSTED, Main.run(new String[] {"-s", "A / B"}));
    }

    @Test
    public void testSyntaxErrorExitsWithOne() {
        assertEquals(Main.EXIT_ERROR, Main.run(new String[] {"-s", "A & / B"}));
    }

    @Test
    public void testInvalidConfigurationExitsWithOne() {
        assertEquals(Main.EXIT_ERROR, Main.run(new String[] {"-n", "0", "-s", "A / A"}));
        assertEquals(Main.EXIT_ERROR, Main.run(new String[] {"-rules=XYZ", "-s", "A / A"}));
        assertEquals(Main.EXIT_ERROR, Main.run(new String[] {"-s", "A / A", "-s", "B / B"}));
    }

    @Test
    public void testProofLengthOption() {
        assertEquals(Main.EXIT_EXHAUSTED, Main.run(new String[] {"-l", "4", "-s", "(A -> B), (B -> C), A / C"}));
        assertEquals(Main.EXIT_PROVEN, Main.run(new String[] {"-l", "5", "-s", "(A -> B), (B -> C), A / C"}));
        assertEquals(Main.EXIT_ERROR, Main.run(new String[] {"-l", "0", "-s", "A / A"}));
    }

    @Test
    public void testUnknownParameterExitsWithOne() {
        assertEquals(Main.EXIT_ERROR, Main.run(new String[] {"-x"}));
    }

    @Test
    public void testHelp() {
        assertEquals(Main.EXIT_PROVEN, Main.run(new String[] {"-h"}));
    }

    @Test
    public void testExitCodePrecedence() {
        assertEquals(Main.EXIT_PROVEN, Main.computeExitCode(List.of()));
        assertEquals(Main.EXIT_PROVEN, Main.computeExitCode(List.of(Main.Outcome.PROVEN)));
        assertEquals(Main.EXIT_EXHAUSTED, Main.computeExitCode(List.of(Main.Outcome.PROVEN, Main.Outcome.EXHAUSTED)));
        assertEquals(Main.EXIT_ERROR,
                Main.computeExitCode(List.of(Main.Outcome.EXHAUSTED, Main.Outcome.ERROR, Main.Outcome.PROVEN)));
    }

    @Test
    public void testReadStatementsSkipsCommentsAndBlankLines() throws IOException {
        File file = folder.newFile("enunciati.txt");
        Files.writeString(file.toPath(), "# esempi\n(A -> B), A / B\n\n  A / A  \n", StandardCharsets.UTF_8);

        assertEquals(List.of("(A -> B), A / B", "A / A"), Main.readStatements(file.toPath()));
    }

    @Test
    public void testFileModeWritesResult() throws IOException {
        File file = folder.newFile("esempi.txt");
        Files.writeString(file.toPath(), "(A -> B), (B -> C), A / C\n(A & B) / (B & A)\n", StandardCharsets.UTF_8);
        File output = folder.newFolder("out");

        int exitCode = Main.run(new String[] {"-f", file.getPath(), "-o", output.getPath(), "-verify"});

        assertEquals(Main.EXIT_PROVEN, exitCode);
        Path result = output.toPath().resolve("RESULT").resolve("esempi.result.txt");
        assertTrue(Files.exists(result));
        String content = Files.readString(result, StandardCharsets.UTF_8);
        assertTrue(content.contains("MPP 1, 3"));
        assertTrue(content.contains("Prova verificata"));
    }

    @Test
    public void testDirectoryModeCombinesOutcomes() throws IOException {
        File dir = folder.newFolder("batch");
        Files.writeString(dir.toPath().resolve("a.txt"), "A / A\n", StandardCharsets.UTF_8);
        Files.writeString(dir.toPath().resolve("b.txt"), "A / B\n", StandardCharsets.UTF_8);

        assertEquals(Main.EXIT_EXHAUSTED, Main.run(new String[] {"-d", dir.getPath()}));
    }
}
