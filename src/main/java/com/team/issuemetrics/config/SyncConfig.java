package com.team.issuemetrics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

/**
 * Issue 同步設定。
 */
@Configuration
@ConfigurationProperties(prefix = "workflow.sync")
@Getter
@Setter
public class SyncConfig {

    /** 是否啟用排程同步 */
    private boolean autoSyncEnabled = false;

    /** 排程同步的 cron */
    private String cron = "0 0 * * * *";

    /** 排程同步後，每個評估軸最多跑幾輪批次 */
    private int autoEvaluateMaxRounds = 5;

    /** 計算日期與衝刺時使用的時區 */
    private String zoneId = "UTC";

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }
}
