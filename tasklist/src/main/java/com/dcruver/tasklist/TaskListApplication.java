package com.dcruver.tasklist;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the outline task list.
 *
 * Indexes checkbox lists and labeled lines ("TODO", "FIXME", "Next:") of a
 * notebook into a task database and offers shell commands to browse and
 * filter the open tasks.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Slf4j
public class TaskListApplication {

    public static void main(String[] args) {
        log.info("Starting task list...");
        SpringApplication.run(TaskListApplication.class, args);
    }
}
