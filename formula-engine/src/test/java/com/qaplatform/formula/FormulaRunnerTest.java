package com.qaplatform.formula;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    public void testAllFormulasValid() throws Exception {
        Path input = Paths.get(getClass().getClassLoader().getResource("runner-input.json").toURI());
        assertEquals(FormulaRunner.EXIT_OK, FormulaRunner.run(new String[]{input.toString()}));
    }

    @Test
    public void testFormulaErrorsGiveExitCodeOne() throws Exception {
        File input = tempDir.resolve("broken.json").toFile();
        Files.writeString(input.toPath(),
                "{\"context\": {\"maxScore\": 100}, \"formulas\": {\"ok\": \"maxScore()\", \"bad\": \"round(1, 2)\"}}");
        assertEquals(FormulaRunner.EXIT_FORMULA_ERRORS, FormulaRunner.run(new String[]{input.getPath()}));
    }

    @Test
    public void testMissingFile() {
        String missing = tempDir.resolve("missing.json").toString();
        assertEquals(FormulaRunner.EXIT_BAD_INPUT, FormulaRunner.run(new String[]{missing}));
    }

    @Test
    public void testUnreadableJson() throws Exception {
        Path input = tempDir.resolve("garbage.json");
        Files.writeString(input, "{ not json");
        assertEquals(FormulaRunner.EXIT_BAD_INPUT, FormulaRunner.run(new String[]{input.toString()}));
    }

    @Test
    public void testMissingFormulasObject() throws Exception {
        Path input = tempDir.resolve("empty.json");
        Files.writeString(input, "{\"context\": {}}");
        assertEquals(FormulaRunner.EXIT_BAD_INPUT, FormulaRunner.run(new String[]{input.toString()}));
    }

    @Test
    public void testUsage() {
        assertEquals(FormulaRunner.EXIT_BAD_INPUT, FormulaRunner.run(new String[0]));
    }
}
