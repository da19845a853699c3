package com.team.issuemetrics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * AI 批次評估設定。
 */
@Configuration
@ConfigurationProperties(prefix = "workflow.evaluation")
@Getter
@Setter
public class EvaluationConfig {

    /** 品質評估每筆成功後的間隔（毫秒） */
    private long qualityDelayMs = 1000;

    /** 一致性評估每筆成功後的間隔（毫秒），會多打 GitHub API 所以較長 */
    private long consistencyDelayMs = 2000;

    /** 未指定 limit 時的批次大小 */
    private int defaultBatchSize = 10;

    /** 單次呼叫允許的最大批次大小 */
    private int maxBatchSize = 20;

    /** 單次 HTTP 呼叫的處理期限（秒），超過就停在下一筆之前 */
    private int requestTimeoutSeconds = 55;
}
