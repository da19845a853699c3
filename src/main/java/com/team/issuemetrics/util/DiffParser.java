package com.team.issuemetrics.util;

import com.team.issuemetrics.model.github.ChangedFile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 將 PR 的變更檔案整理成給 AI 看的 diff 文字。
 */
@Component
public class DiffParser {

    static final String TRUNCATED_MARKER = "\n... (truncated)";

    /**
     * 檔案變更摘要，一行一個檔案：{@code [modified] src/App.java (+12/-3)}
     */
    public String summarizeFiles(List<ChangedFile> files) {
        if (files == null || files.isEmpty()) return "";

        return files.stream()
                .map(f -> String.format("%s %s (+%d/-%d)",
                        statusTag(f.status()), f.filename(), f.additions(), f.deletions()))
                .collect(Collectors.joining("\n"));
    }

    /**
     * 串接所有檔案的 patch，超過 maxLength 字元就截斷。
     * 沒有任何 patch 時回傳空字串。
     */
    public String buildPatchText(List<ChangedFile> files, int maxLength) {
        if (files == null || files.isEmpty()) return "";

        String patch = files.stream()
                .filter(f -> f.patch() != null && !f.patch().isEmpty())
                .map(f -> "--- " + f.filename() + " ---\n" + f.patch())
                .collect(Collectors.joining("\n\n"));

        if (patch.length() > maxLength) {
            return patch.substring(0, maxLength) + TRUNCATED_MARKER;
        }
        return patch;
    }

    /**
     * patch 優先，沒有 patch 時退回檔案摘要。
     */
    public String diffSummary(List<ChangedFile> files, int maxPatchLength) {
        String patch = buildPatchText(files, maxPatchLength);
        return patch.isEmpty() ? summarizeFiles(files) : patch;
    }

    private String statusTag(String status) {
        if (status == null) return "[modified]";
        return switch (status) {
            case "added" -> "[added]";
            case "removed" -> "[removed]";
            case "renamed" -> "[renamed]";
            default -> "[modified]";
        };
    }
}
