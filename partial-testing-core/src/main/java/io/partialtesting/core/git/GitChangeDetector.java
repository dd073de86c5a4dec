package io.partialtesting.core.git;

import io.partialtesting.core.config.PartialTestingConfig;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.dircache.DirCacheIterator;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.revwalk.filter.RevFilter;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.FileTreeIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the change set with JGit by comparing a base ref (or its merge base with HEAD)
 * against HEAD, the index, or the working tree.
 *
 * <p>The new side of the comparison is chosen by the configuration:
 * <ul>
 *   <li>{@code includeUncommitted}: the working tree, untracked files included</li>
 *   <li>{@code includeStaged} only: the index</li>
 *   <li>neither: the HEAD commit</li>
 * </ul>
 * A single diff is taken so every path is reported once with one {@link ChangeKind}.
 */
public final class GitChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(GitChangeDetector.class);

    private final Path projectDir;
    private final PartialTestingConfig config;

    public GitChangeDetector(Path projectDir, PartialTestingConfig config) {
        this.projectDir = projectDir;
        this.config = config;
    }

    /**
     * Returns the changed paths (relative to the repository root) in diff order, without duplicates
     * and without paths matching {@code excludePaths}.
     *
     * @throws DiffUnavailableException if the directory is not a repository or the base ref is unknown
     */
    public List<ChangeRecord> detectChanges() {
        Map<String, ChangeRecord> changes = new LinkedHashMap<>();

        try (Repository repository = new FileRepositoryBuilder()
                    .findGitDir(projectDir.toFile())
                    .setMustExist(true)
                    .build();
             Git git = new Git(repository)) {

            ObjectId headId = repository.resolve("HEAD");
            if (headId == null) {
                throw new DiffUnavailableException(
                        "HEAD could not be resolved in " + projectDir + " (is this an empty repository?)");
            }

            ObjectId baseId = resolveBaseRef(repository);
            if (baseId == null) {
                throw new DiffUnavailableException(
                        "Base ref '" + config.baseRef() + "' could not be resolved. "
                        + "Ensure the ref exists (e.g. run 'git fetch origin' in CI).");
            }

            if (config.useMergeBase()) {
                baseId = mergeBase(repository, headId, baseId);
            }

            List<DiffEntry> diffs = git.diff()
                    .setOldTree(prepareTreeParser(repository, baseId))
                    .setNewTree(newSide(repository, headId))
                    .call();

            for (DiffEntry entry : diffs) {
                switch (entry.getChangeType()) {
                    case ADD, COPY -> record(changes, ChangeRecord.added(entry.getNewPath()));
                    case MODIFY -> record(changes, ChangeRecord.modified(entry.getNewPath()));
                    case DELETE -> record(changes, ChangeRecord.deleted(entry.getOldPath()));
                    case RENAME -> {
                        record(changes, ChangeRecord.deleted(entry.getOldPath()));
                        record(changes, ChangeRecord.added(entry.getNewPath()));
                    }
                }
            }

        } catch (DiffUnavailableException e) {
            log.error("Failed to detect git changes: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Failed to detect git changes: {}", e.getMessage());
            throw new DiffUnavailableException(
                    "Partial Testing: unable to detect git changes in " + projectDir + ". "
                    + "Verify the repository exists and the base ref '" + config.baseRef() + "' is valid.",
                    e);
        }

        List<ChangeRecord> result = new ArrayList<>();
        for (ChangeRecord change : changes.values()) {
            if (isExcluded(change.path())) {
                log.debug("Excluded by pattern: {}", change.path());
                continue;
            }
            result.add(change);
        }

        log.info("Detected {} changed files", result.size());
        result.forEach(c -> log.debug("  {} {}", c.kind(), c.path()));
        return result;
    }

    /**
     * A path reported twice (e.g. deleted by a rename and re-added) collapses into a single
     * {@link ChangeKind#MODIFIED} record.
     */
    private static void record(Map<String, ChangeRecord> changes, ChangeRecord change) {
        changes.merge(change.path(), change, (previous, current) ->
                previous.kind() == current.kind() ? previous : ChangeRecord.modified(previous.path()));
    }

    private AbstractTreeIterator newSide(Repository repository, ObjectId headId) throws IOException {
        if (config.includeUncommitted()) {
            return new FileTreeIterator(repository);
        }
        if (config.includeStaged()) {
            return new DirCacheIterator(repository.readDirCache());
        }
        return prepareTreeParser(repository, headId);
    }

    private ObjectId resolveBaseRef(Repository repository) throws IOException {
        // As-is first: "origin/master", a SHA, a tag
        ObjectId id = repository.resolve(config.baseRef());
        if (id != null) return id;

        return repository.resolve("refs/remotes/" + config.baseRef());
    }

    private ObjectId mergeBase(Repository repository, ObjectId headId, ObjectId baseId) throws IOException {
        try (RevWalk walk = new RevWalk(repository)) {
            walk.setRevFilter(RevFilter.MERGE_BASE);
            walk.markStart(walk.parseCommit(headId));
            walk.markStart(walk.parseCommit(baseId));
            RevCommit mergeBase = walk.next();
            if (mergeBase == null) {
                throw new DiffUnavailableException(
                        "HEAD and base ref '" + config.baseRef() + "' have no common ancestor");
            }
            log.info("Merge base of HEAD and {}: {}", config.baseRef(), mergeBase.getName());
            return mergeBase.getId();
        }
    }

    private AbstractTreeIterator prepareTreeParser(Repository repository, ObjectId objectId) throws IOException {
        try (RevWalk walk = new RevWalk(repository)) {
            RevCommit commit = walk.parseCommit(objectId);
            ObjectId treeId = commit.getTree().getId();

            try (ObjectReader reader = repository.newObjectReader()) {
                CanonicalTreeParser parser = new CanonicalTreeParser();
                parser.reset(reader, treeId);
                return parser;
            }
        }
    }

    private boolean isExcluded(String filePath) {
        for (String pattern : config.excludePaths()) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            if (matcher.matches(Path.of(filePath))) {
                return true;
            }
        }
        return false;
    }
}
