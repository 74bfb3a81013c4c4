package com.signals.common.kafka;

import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Shuts the application down with a non-zero exit code.
 */
@RequiredArgsConstructor
@Slf4j
public class ProcessTerminator {

    public static final int FAILURE_EXIT_CODE = 1;

    private final ConfigurableApplicationContext context;

    public void terminate(String reason, Throwable cause) {
        log.error("Fatal error, shutting down: {}", reason, cause);
        int exitCode = SpringApplication.exit(context, () -> FAILURE_EXIT_CODE);
        System.exit(exitCode);
    }
}
