package ai.mergepilot.rebase;

import ai.mergepilot.git.RepoSnapshot;
import ai.mergepilot.testutil.FakeRebaseRepo;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Builds a {@link RunContext} outside a workflow, with a same-thread mailbox and a recording log sink. */
final class RunContextFixture {
    static final RepoSnapshot SNAPSHOT = new RepoSnapshot(
            FakeRebaseRepo.HEAD_COMMIT,
            "feature",
            Map.of("feature", FakeRebaseRepo.HEAD_COMMIT, "main", FakeRebaseRepo.MAIN_COMMIT));

    final List<LogEntry> published = new ArrayList<>();
    final List<RuntimeException> mailboxFailures = new ArrayList<>();
    final RunContext ctx;

    RunContextFixture(int maxAttempts) {
        var mailbox = new RunMailbox(mailboxFailures::add);
        var tracker = new AsyncOperationTracker((success, error) -> {});
        ctx = new RunContext("feature", "main", maxAttempts, SNAPSHOT, new ProgressLog(published::add), tracker, mailbox);
    }

    boolean logged(String fragment) {
        return published.stream().anyMatch(e -> e.details().contains(fragment));
    }
}
