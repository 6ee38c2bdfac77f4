package ai.mergepilot.rebase;

import static org.junit.jupiter.api.Assertions.*;

import ai.mergepilot.git.GitOperationException;
import ai.mergepilot.testutil.FakeRebaseRepo;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConflictDetectorTest {

    @TempDir
    Path tempDir;

    @Test
    void testNoConflictsReportsSuccessfulRebase() throws Exception {
        var repo = new FakeRebaseRepo(tempDir);
        var detection = new ConflictDetector(repo).detect("main", "feature");

        assertTrue(detection.rebase().ok());
        assertTrue(detection.files().isEmpty());
        assertTrue(detection.skipped().isEmpty());
        assertEquals(1, repo.rebaseCalls);
    }

    @Test
    void testConflictedFilesInDetectionOrder() throws Exception {
        var repo = new FakeRebaseRepo(tempDir).conflictRound("src/b.txt", "a.txt");
        var detection = new ConflictDetector(repo).detect("main", "feature");

        assertFalse(detection.rebase().ok());
        assertEquals(List.of("src/b.txt", "a.txt"), detection.files());
    }

    @Test
    void testIneligibleFilesAreSkipped() throws Exception {
        var repo = new FakeRebaseRepo(tempDir)
                .binary("logo.png")
                .conflictRound("keep.txt", "logo.png", "package-lock.json.lock", "with space.txt");
        var detection = new ConflictDetector(repo).detect("main", "feature");

        assertEquals(List.of("keep.txt"), detection.files());
        assertEquals(List.of("logo.png", "package-lock.json.lock", "with space.txt"), detection.skipped());
    }

    @Test
    void testBinaryProbeFailurePropagates() {
        var repo = new FakeRebaseRepo(tempDir).conflictRound("broken.bin");
        assertThrows(GitOperationException.class, () -> new ConflictDetector(repo).detect("main", "feature"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a.txt", "src/main/App.java", "dir-with_dash/file.v2.txt", ".github/workflows/ci.yml"})
    void testSafePaths(String path) {
        assertTrue(ConflictDetector.isSafePath(path));
    }

    @ParameterizedTest
    @ValueSource(strings = {"/etc/passwd", "../outside.txt", "src/../../x", "name with space", "semi;colon", "tab\tname", ""})
    void testUnsafePaths(String path) {
        assertFalse(ConflictDetector.isSafePath(path));
    }
}
