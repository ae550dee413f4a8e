package com.thughari.oteditor.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory replica of a shared plain-text document. The line list always holds at least one
 * line; the version only moves forward.
 */
@Getter
public class SharedDocument {

    private final String id;
    @Setter
    private String title;
    @Setter
    private String language;
    private final List<String> content = new ArrayList<>();
    private long version;
    private long lastModified;
    private final Set<String> collaborators = new LinkedHashSet<>();

    public SharedDocument(String id) {
        this(id, "Untitled Document", List.of(""), "javascript", 0, 0);
    }

    public SharedDocument(String id, String title, List<String> lines, String language, long version, long lastModified) {
        this.id = id;
        this.title = title;
        this.language = language;
        this.version = version;
        this.lastModified = lastModified;
        resetLines(lines);
    }

    public List<String> getContent() {
        return Collections.unmodifiableList(content);
    }

    public Set<String> getCollaborators() {
        return Collections.unmodifiableSet(collaborators);
    }

    public int lineCount() {
        return content.size();
    }

    public String line(int index) {
        return content.get(index);
    }

    public void setLine(int index, String text) {
        content.set(index, text);
    }

    public void insertLine(int index, String text) {
        content.add(index, text);
    }

    public void removeLine(int index) {
        content.remove(index);
        if (content.isEmpty()) {
            content.add("");
        }
    }

    public void advanceVersion(long now) {
        version++;
        lastModified = now;
    }

    /**
     * Full-state replacement used by version sync. Never lowers the version.
     */
    public void restore(VersionSnapshot snapshot, long now) {
        if (snapshot.getVersion() < version) {
            throw new IllegalArgumentException("Snapshot version " + snapshot.getVersion() + " is behind local version " + version);
        }
        resetLines(snapshot.getContent());
        version = snapshot.getVersion();
        lastModified = now;
    }

    public VersionSnapshot snapshot() {
        return VersionSnapshot.builder()
                .version(version)
                .content(List.copyOf(content))
                .build();
    }

    public boolean addCollaborator(String userId) {
        return collaborators.add(userId);
    }

    public boolean removeCollaborator(String userId) {
        return collaborators.remove(userId);
    }

    public String text() {
        return String.join("\n", content);
    }

    private void resetLines(List<String> lines) {
        content.clear();
        if (lines != null) {
            for (String line : lines) {
                content.add(line == null ? "" : line);
            }
        }
        if (content.isEmpty()) {
            content.add("");
        }
    }

    @Override
    public String toString() {
        return "SharedDocument{id=" + id + ", version=" + version + ", lines=" + content.size() + "}";
    }
}
