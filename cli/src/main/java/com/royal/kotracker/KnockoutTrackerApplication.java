package com.royal.kotracker;

import com.royal.kotracker.cli.CommandLineOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.royal.kotracker")
public class KnockoutTrackerApplication {

    private static final Logger log = LoggerFactory.getLogger(KnockoutTrackerApplication.class);

    public static void main(String[] args) {
        System.exit(launch(args));
    }

    /**
     * Start the application and return its exit code; malformed options give 1 without starting it
     */
    static int launch(String[] args) {
        String[] arguments;
        try {
            arguments = CommandLineOptions.toPropertyArguments(args);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            return 1;
        }
        SpringApplication application = new SpringApplication(KnockoutTrackerApplication.class);
        return SpringApplication.exit(application.run(arguments));
    }
}
