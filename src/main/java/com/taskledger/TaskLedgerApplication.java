package com.taskledger;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Standalone host for the ledger. Without a web server the process stays alive only for the
 * scheduled memory cleanup; embedding applications normally import the beans instead.
 */
@SpringBootApplication
@EnableScheduling
public class TaskLedgerApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(TaskLedgerApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
