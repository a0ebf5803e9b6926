package com.hooklight.core.state;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session-wide state shared by all hooks of a project, persisted in {@code hooks-state.json}.
 * <p>
 * Only the {@code session}, {@code tests} and {@code files} sections are interpreted here.
 * Everything else in the document (other sections written by other hooks, unknown fields
 * inside known sections) is kept as-is and written back untouched.
 * <p>
 * Instances are treated as values: updates go through {@link #copy()} so callers holding the
 * previous state never see a change.
 */
@JsonPropertyOrder({"session", "tests", "files"})
public class HooksState {

    private Session session = new Session();
    private Tests tests = new Tests();
    private Files files = new Files();
    private final Map<String, Object> other = new LinkedHashMap<>();

    /**
     * A state with empty sections, matching what a fresh project starts with.
     */
    public static HooksState defaults() {
        var state = new HooksState();
        state.other.put("errors", new LinkedHashMap<>());
        var build = new LinkedHashMap<String, Object>();
        build.put("lastRun", null);
        build.put("status", "unknown");
        build.put("errors", new ArrayList<>());
        build.put("fixAttempts", 0);
        state.other.put("build", build);
        var git = new LinkedHashMap<String, Object>();
        git.put("mainBranch", "main");
        git.put("currentBranch", "main");
        git.put("featureBranch", null);
        git.put("featureStartedAt", null);
        git.put("featureDescription", null);
        git.put("checkpoints", new ArrayList<>());
        git.put("pendingMerge", false);
        state.other.put("git", git);
        state.other.put("devServers", new LinkedHashMap<>());
        return state;
    }

    public HooksState copy() {
        var copy = new HooksState();
        copy.session = session.copy();
        copy.tests = tests.copy();
        copy.files = files.copy();
        copy.other.putAll(other);
        return copy;
    }

    public Session getSession() { return session; }
    public void setSession(Session session) { this.session = session == null ? new Session() : session; }
    public Tests getTests() { return tests; }
    public void setTests(Tests tests) { this.tests = tests == null ? new Tests() : tests; }
    public Files getFiles() { return files; }
    public void setFiles(Files files) { this.files = files == null ? new Files() : files; }

    @JsonAnyGetter
    public Map<String, Object> getOther() { return other; }

    @JsonAnySetter
    public void setOther(String key, Object value) { other.put(key, value); }

    @JsonPropertyOrder({"id", "startedAt"})
    public static class Session {
        private String id = "";
        private String startedAt = "";
        private final Map<String, Object> other = new LinkedHashMap<>();

        Session copy() {
            var copy = new Session();
            copy.id = id;
            copy.startedAt = startedAt;
            copy.other.putAll(other);
            return copy;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id == null ? "" : id; }
        public String getStartedAt() { return startedAt; }
        public void setStartedAt(String startedAt) { this.startedAt = startedAt == null ? "" : startedAt; }

        @JsonAnyGetter
        public Map<String, Object> getOther() { return other; }

        @JsonAnySetter
        public void setOther(String key, Object value) { other.put(key, value); }
    }

    @JsonPropertyOrder({"passingFiles", "failingFiles", "pendingFixes"})
    public static class Tests {
        private List<String> passingFiles = new ArrayList<>();
        private List<String> failingFiles = new ArrayList<>();
        private List<PendingFix> pendingFixes = new ArrayList<>();
        private final Map<String, Object> other = new LinkedHashMap<>();

        Tests copy() {
            var copy = new Tests();
            copy.passingFiles = new ArrayList<>(passingFiles);
            copy.failingFiles = new ArrayList<>(failingFiles);
            copy.pendingFixes = new ArrayList<>(pendingFixes);
            copy.other.putAll(other);
            return copy;
        }

        public List<String> getPassingFiles() { return passingFiles; }
        public void setPassingFiles(List<String> passingFiles) { this.passingFiles = mutable(passingFiles); }
        public List<String> getFailingFiles() { return failingFiles; }
        public void setFailingFiles(List<String> failingFiles) { this.failingFiles = mutable(failingFiles); }
        public List<PendingFix> getPendingFixes() { return pendingFixes; }
        public void setPendingFixes(List<PendingFix> pendingFixes) { this.pendingFixes = mutable(pendingFixes); }

        @JsonAnyGetter
        public Map<String, Object> getOther() { return other; }

        @JsonAnySetter
        public void setOther(String key, Object value) { other.put(key, value); }
    }

    @JsonPropertyOrder({"modifiedSinceCheckpoint", "modifiedThisSession"})
    public static class Files {
        private List<String> modifiedSinceCheckpoint = new ArrayList<>();
        private List<String> modifiedThisSession = new ArrayList<>();
        private final Map<String, Object> other = new LinkedHashMap<>();

        Files copy() {
            var copy = new Files();
            copy.modifiedSinceCheckpoint = new ArrayList<>(modifiedSinceCheckpoint);
            copy.modifiedThisSession = new ArrayList<>(modifiedThisSession);
            copy.other.putAll(other);
            return copy;
        }

        public List<String> getModifiedSinceCheckpoint() { return modifiedSinceCheckpoint; }
        public void setModifiedSinceCheckpoint(List<String> files) { this.modifiedSinceCheckpoint = mutable(files); }
        public List<String> getModifiedThisSession() { return modifiedThisSession; }
        public void setModifiedThisSession(List<String> files) { this.modifiedThisSession = mutable(files); }

        @JsonAnyGetter
        public Map<String, Object> getOther() { return other; }

        @JsonAnySetter
        public void setOther(String key, Object value) { other.put(key, value); }
    }

    private static <T> List<T> mutable(List<T> list) {
        return list == null ? new ArrayList<>() : new ArrayList<>(list);
    }
}
