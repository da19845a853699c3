package com.team.issuemetrics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** 同步時間、目前衝刺都以此為準；測試可換成固定時鐘 */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
