package ai.mergepilot.testutil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.RepositoryCache;
import org.eclipse.jgit.revwalk.RevCommit;

/** A throwaway git repository on {@code main} with one initial commit. */
public class GitFixture implements AutoCloseable {
    public final Path root;
    public final Git git;

    public GitFixture(Path root) throws GitAPIException, IOException {
        this.root = root;
        git = Git.init().setDirectory(root.toFile()).setInitialBranch("main").call();
        var config = git.getRepository().getConfig();
        config.setString("user", null, "name", "Test User");
        config.setString("user", null, "email", "test@example.com");
        config.setBoolean("commit", null, "gpgsign", false);
        config.save();
        commitFile("initial.txt", "initial content\n", "Initial commit");
    }

    public void write(String path, String content) throws IOException {
        var file = root.resolve(path);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    public String read(String path) throws IOException {
        return Files.readString(root.resolve(path), StandardCharsets.UTF_8);
    }

    public RevCommit commitFile(String path, String content, String message) throws GitAPIException, IOException {
        write(path, content);
        git.add().addFilepattern(path).call();
        return git.commit().setMessage(message).call();
    }

    public void checkout(String branch) throws GitAPIException {
        git.checkout().setName(branch).call();
    }

    public void createBranch(String branch) throws GitAPIException {
        git.checkout().setCreateBranch(true).setName(branch).call();
    }

    public String tip(String branch) throws IOException {
        var ref = git.getRepository().exactRef("refs/heads/" + branch);
        return ref == null ? "" : ref.getObjectId().getName();
    }

    /**
     * main and feature both change line two of {@code shared.txt}; rebasing feature onto main conflicts. Leaves
     * feature checked out.
     */
    public void divergeOnSharedFile() throws GitAPIException, IOException {
        commitFile("shared.txt", "line one\nline two\nline three\n", "Add shared file");
        createBranch("feature");
        commitFile("shared.txt", "line one\nline two from feature\nline three\n", "Feature edit");
        checkout("main");
        commitFile("shared.txt", "line one\nline two from main\nline three\n", "Main edit");
        checkout("feature");
    }

    @Override
    public void close() {
        git.close();
        RepositoryCache.clear();
    }
}
