package com.team.issuemetrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IssueMetricsApplication {

    public static void main(String[] args) {
        SpringApplication.run(IssueMetricsApplication.class, args);
    }
}
