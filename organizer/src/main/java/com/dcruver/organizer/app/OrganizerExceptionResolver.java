package com.dcruver.organizer.app;

import com.dcruver.organizer.config.ConfigurationException;
import com.dcruver.organizer.io.RecordValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.command.CommandExceptionResolver;
import org.springframework.shell.command.CommandHandlingResult;
import org.springframework.stereotype.Component;

/**
 * Maps command failures to process exit codes.
 */
@Component
@Slf4j
public class OrganizerExceptionResolver implements CommandExceptionResolver {

    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIGURATION = 2;
    public static final int EXIT_VALIDATION = 3;

    @Override
    public CommandHandlingResult resolve(Exception ex) {
        int exitCode = exitCodeFor(ex);
        String prefix = switch (exitCode) {
            case EXIT_CONFIGURATION -> "Configuration error";
            case EXIT_VALIDATION -> "Invalid record";
            default -> "Command failed";
        };

        if (exitCode == EXIT_FAILURE) {
            log.error("Command failed", ex);
        } else {
            log.error("{}: {}", prefix, ex.getMessage());
        }
        return CommandHandlingResult.of(prefix + ": " + ex.getMessage() + "\n", exitCode);
    }

    static int exitCodeFor(Exception ex) {
        if (ex instanceof ConfigurationException) {
            return EXIT_CONFIGURATION;
        }
        if (ex instanceof RecordValidationException) {
            return EXIT_VALIDATION;
        }
        return EXIT_FAILURE;
    }
}
