package com.team.issuemetrics.util;

import com.team.issuemetrics.model.github.ChangedFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiffParserTest {

    private final DiffParser diffParser = new DiffParser();

    @Test
    void summarizeFiles_tagsEachFileWithStatus() {
        String summary = diffParser.summarizeFiles(List.of(
                new ChangedFile("src/App.java", "modified", 12, 3, null),
                new ChangedFile("src/New.java", "added", 40, 0, null),
                new ChangedFile("src/Old.java", "removed", 0, 22, null),
                new ChangedFile("src/Moved.java", "renamed", 0, 0, null)));

        assertThat(summary.split("\n")).containsExactly(
                "[modified] src/App.java (+12/-3)",
                "[added] src/New.java (+40/-0)",
                "[removed] src/Old.java (+0/-22)",
                "[renamed] src/Moved.java (+0/-0)");
    }

    @Test
    void buildPatchText_truncatesAtMaxLength() {
        String patch = "x".repeat(100);

        String text = diffParser.buildPatchText(List.of(new ChangedFile("a.txt", "modified", 1, 1, patch)), 50);

        assertThat(text).hasSize(50 + DiffParser.TRUNCATED_MARKER.length());
        assertThat(text).startsWith("--- a.txt ---\n").endsWith(DiffParser.TRUNCATED_MARKER);
    }

    @Test
    void diffSummary_fallsBackToFileListWithoutPatches() {
        List<ChangedFile> binaryOnly = List.of(new ChangedFile("logo.png", "added", 0, 0, null));

        assertThat(diffParser.diffSummary(binaryOnly, 5000)).isEqualTo("[added] logo.png (+0/-0)");
        assertThat(diffParser.diffSummary(List.of(), 5000)).isEmpty();
    }
}
