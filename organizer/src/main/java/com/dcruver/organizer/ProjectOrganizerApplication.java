package com.dcruver.organizer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Project Organizer.
 *
 * Scans file trees, classifies files into buckets, groups them into inferred
 * projects and relocates them into a target layout. Every relocation is journaled
 * so a reorganization can be rolled back.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class ProjectOrganizerApplication {

    public static void main(String[] args) {
        log.info("Starting Project Organizer...");
        SpringApplication.run(ProjectOrganizerApplication.class, args);
    }
}
