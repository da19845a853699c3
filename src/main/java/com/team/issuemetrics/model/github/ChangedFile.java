package com.team.issuemetrics.model.github;

/**
 * PR 中的單一變更檔案（pulls/{n}/files）。
 *
 * @param status added / removed / renamed / modified ...
 * @param patch  unified diff 片段，二進位或過大的檔案為 null
 */
public record ChangedFile(String filename, String status, int additions, int deletions, String patch) {
}
