package ai.mergepilot.cli;

import ai.mergepilot.agents.LlmResolutionAgent;
import ai.mergepilot.agents.LlmVerificationAgent;
import ai.mergepilot.git.GitRebaseRepo;
import ai.mergepilot.git.RepoSnapshot;
import ai.mergepilot.rebase.LogEntry;
import ai.mergepilot.rebase.RebaseRequest;
import ai.mergepilot.rebase.RebaseWorkflow;
import ai.mergepilot.rebase.RunHandle;
import ai.mergepilot.rebase.RunListener;
import ai.mergepilot.rebase.RunResult;
import ai.mergepilot.rebase.ValidationError;
import ai.mergepilot.rebase.ValidationException;
import ai.mergepilot.util.Json;
import ai.mergepilot.util.RebaseSettings;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "mergepilot",
        mixinStandardHelpOptions = true,
        description = "Rebase a branch onto another, resolving conflicts with an LLM and rolling back on failure.")
public final class MergePilotCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(MergePilotCli.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;

    @CommandLine.Option(names = "--project", description = "Path to the repository root. Defaults to the current directory.")
    private Path projectPath = Path.of(".");

    @CommandLine.Option(names = "--source", required = true, description = "Branch whose commits are replayed.")
    private String source = "";

    @CommandLine.Option(names = "--target", required = true, description = "Branch to rebase onto.")
    private String target = "";

    @CommandLine.Option(names = "--max-attempts", description = "Resolution attempt ceiling, 1-10.")
    @Nullable
    private Integer maxAttempts;

    @CommandLine.Option(names = "--timeout", description = "Per-call agent timeout in seconds.")
    @Nullable
    private Integer timeoutSeconds;

    @CommandLine.Option(
            names = "--continue",
            description = "Continue a rebase that is already in progress instead of starting one.")
    private boolean continueRebase = false;

    @CommandLine.Option(
            names = "--snapshot",
            description = "Commit to roll back to when --continue fails. Defaults to the source branch tip.")
    @Nullable
    private String snapshotCommit;

    @CommandLine.Option(names = "--log-file", description = "Write the event log to this file as JSON Lines.")
    @Nullable
    private Path logFile;

    private final Function<RebaseSettings, StreamingChatModel> modelFactory;
    private final PrintStream out;
    private final PrintStream err;

    public MergePilotCli() {
        this(MergePilotCli::openAiModel, System.out, System.err);
    }

    MergePilotCli(Function<RebaseSettings, StreamingChatModel> modelFactory, PrintStream out, PrintStream err) {
        this.modelFactory = modelFactory;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        logger.info("Starting MergePilot CLI...");
        int exitCode = new CommandLine(new MergePilotCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var root = projectPath.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            err.println("Project path is not a directory: " + root);
            return EXIT_USAGE;
        }

        var settings = RebaseSettings.load(root);
        if (maxAttempts != null) {
            settings = settings.withMaxAttempts(maxAttempts);
        }
        if (timeoutSeconds != null) {
            if (timeoutSeconds <= 0) {
                err.println("--timeout must be positive");
                return EXIT_USAGE;
            }
            settings = settings.withAgentTimeout(Duration.ofSeconds(timeoutSeconds));
        }

        try (var repo = new GitRebaseRepo(root)) {
            StreamingChatModel model;
            try {
                model = modelFactory.apply(settings);
            } catch (IllegalStateException e) {
                err.println("Error: " + e.getMessage());
                return EXIT_USAGE;
            }
            var workflow = new RebaseWorkflow(
                    repo,
                    new LlmResolutionAgent(model, settings.resolutionContentLimit()),
                    new LlmVerificationAgent(model, settings.verificationContentLimit()),
                    settings.agentTimeout());

            var listener = new ConsoleListener();
            var request = new RebaseRequest(source, target, settings.maxAttempts());
            RunHandle handle;
            if (continueRebase) {
                handle = workflow.continueInProgress(request, continuationSnapshot(repo), listener);
            } else {
                handle = workflow.start(request, listener);
            }

            var result = awaitResult(handle);
            writeLogFile(result.log());
            if (handle.validationError() != null) {
                return EXIT_USAGE;
            }
            return result.success() ? EXIT_SUCCESS : EXIT_FAILURE;
        } catch (ValidationException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (GitAPIException e) {
            err.println("Unable to read repository state: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private RepoSnapshot continuationSnapshot(GitRebaseRepo repo) throws GitAPIException, ValidationException {
        var current = repo.currentRevision();
        var commit = snapshotCommit != null ? snapshotCommit : current.branchTips().get(source);
        if (commit == null) {
            throw new ValidationException(
                    ValidationError.BRANCH_NOT_FOUND,
                    "No --snapshot given and branch '%s' does not exist".formatted(source));
        }
        return new RepoSnapshot(commit, source, current.branchTips());
    }

    private RunResult awaitResult(RunHandle handle) {
        var hook = new Thread(handle::cancel, "mergepilot-cancel");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return handle.result().join();
        } catch (CompletionException e) {
            logger.error("Run finished abnormally", e);
            return new RunResult(false, String.valueOf(e.getCause()), handle.eventLog());
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                logger.debug("JVM already shutting down; cancel hook stays registered");
            }
        }
    }

    private void writeLogFile(List<LogEntry> entries) {
        if (logFile == null) {
            return;
        }
        try {
            var lines = entries.stream().map(Json::toJson).toList();
            Files.write(logFile, lines);
            logger.info("Wrote {} event log entries to {}", entries.size(), logFile);
        } catch (IOException e) {
            err.println("Failed to write log file " + logFile + ": " + e.getMessage());
        }
    }

    static StreamingChatModel openAiModel(RebaseSettings settings) {
        var apiKey = System.getenv(settings.llmApiKeyEnv());
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("Environment variable %s is not set".formatted(settings.llmApiKeyEnv()));
        }
        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(apiKey)
                .modelName(settings.llmModel())
                .timeout(settings.agentTimeout());
        if (settings.llmBaseUrl() != null) {
            builder.baseUrl(settings.llmBaseUrl());
        }
        return builder.build();
    }

    private final class ConsoleListener implements RunListener {
        @Override
        public void onLog(LogEntry entry) {
            out.println(entry.toDisplayString());
        }

        @Override
        public void onComplete(boolean success, @Nullable String error) {
            if (success) {
                out.println("Rebase of %s onto %s completed.".formatted(source, target));
            } else {
                err.println("Rebase failed: " + error);
            }
        }
    }
}
