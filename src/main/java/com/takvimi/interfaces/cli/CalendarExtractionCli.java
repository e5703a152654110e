package com.takvimi.interfaces.cli;

import com.takvimi.TakvimiApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Path;

/**
 * Command-line entry point: {@code CalendarExtractionCli <pdf-path> <year>}.
 * Starts the application context without the web server and writes the result to the working directory.
 */
public final class CalendarExtractionCli {

    private static final Logger log = LoggerFactory.getLogger(CalendarExtractionCli.class);

    private CalendarExtractionCli() {
    }

    public static void main(String[] args) {
        if (args.length != 2) {
            log.error("Usage: CalendarExtractionCli <pdf-path> <year>");
            System.exit(2);
        }
        int status = 0;
        try (ConfigurableApplicationContext context = new SpringApplicationBuilder(TakvimiApplication.class)
                .web(WebApplicationType.NONE)
                .run()) {
            context.getBean(CalendarExtractionCommand.class).run(Path.of(args[0]), args[1], Path.of(""));
        } catch (RuntimeException ex) {
            log.error("Extraction failed: {}", ex.getMessage(), ex);
            status = 1;
        }
        System.exit(status);
    }
}
