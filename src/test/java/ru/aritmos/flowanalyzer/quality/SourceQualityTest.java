package ru.aritmos.flowanalyzer.quality;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Quality-gate (эвристика): запрещённые практики в основных исходниках и оформление контроллеров.
 */
class SourceQualityTest {

    private static List<Path> mainSources() throws Exception {
        Path root = Path.of("src/main/java");
        assertTrue(Files.exists(root), "TEST_EXPECTED: отсутствует src/main/java");
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(p -> p.toString().endsWith(".java")).toList();
        }
    }

    @Test
    void shouldNotContainForbiddenPatternsInMainSources() throws Exception {
        List<Path> files = mainSources();
        assertFalse(files.isEmpty(), "TEST_EXPECTED: не найдено java-файлов в src/main/java");

        for (Path p : files) {
            String text = Files.readString(p);

            assertFalse(text.contains("System.out"), "TEST_EXPECTED: запрещён System.out: " + p);
            assertFalse(text.contains("System.err"), "TEST_EXPECTED: запрещён System.err: " + p);
            assertFalse(text.contains("printStackTrace"), "TEST_EXPECTED: запрещён printStackTrace: " + p);
            assertFalse(text.contains("@SuppressWarnings"), "TEST_EXPECTED: запрещён @SuppressWarnings: " + p);
        }
    }

    @Test
    void controllersShouldCarrySwaggerAnnotations() throws Exception {
        int controllers = 0;
        for (Path p : mainSources()) {
            String text = Files.readString(p);
            if (!text.contains("@Controller")) {
                continue;
            }
            controllers++;
            assertTrue(text.contains("@Tag"), "TEST_EXPECTED: контроллер должен иметь @Tag: " + p);
            assertTrue(text.contains("@Operation"), "TEST_EXPECTED: контроллер должен иметь @Operation: " + p);
            assertTrue(text.contains("@Secured"), "TEST_EXPECTED: контроллер должен иметь @Secured: " + p);
        }
        assertTrue(controllers > 0, "TEST_EXPECTED: не найдено ни одного @Controller в проекте");
    }
}
