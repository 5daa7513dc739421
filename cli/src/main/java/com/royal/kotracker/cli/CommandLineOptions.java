package com.royal.kotracker.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps the short command-line options onto application properties so that
 * {@code --hero NAME --min-bb 100 --verbose --report out.json} configure the same
 * app.* keys as application.yml. Positional arguments (input paths) pass through.
 */
public final class CommandLineOptions {
    
    public static final String USAGE = 
            "Usage: knockout-tracker INPUT [...] [--hero NAME] [--min-bb 100] [--verbose] [--report FILE]";
    
    private static final Map<String, String> VALUE_OPTIONS = Map.of(
            "--hero", "app.tracker.hero",
            "--min-bb", "app.tracker.min-bb",
            "--min_bb", "app.tracker.min-bb",
            "--report", "app.report.json.path");
    
    private static final Map<String, String> FLAG_OPTIONS = Map.of(
            "--verbose", "app.tracker.diagnostics");
    
    private CommandLineOptions() {
    }
    
    public static String[] toPropertyArguments(String[] args) {
        List<String> converted = new ArrayList<>(args.length);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            int eq = arg.indexOf('=');
            String option = eq > 0 ? arg.substring(0, eq) : arg;
            
            if (VALUE_OPTIONS.containsKey(option)) {
                String value;
                if (eq > 0) {
                    value = arg.substring(eq + 1);
                } else if (i + 1 < args.length) {
                    value = args[++i];
                } else {
                    throw new IllegalArgumentException("Option " + option + " needs a value. " + USAGE);
                }
                converted.add("--" + VALUE_OPTIONS.get(option) + "=" + value);
            } else if (FLAG_OPTIONS.containsKey(option)) {
                String value = eq > 0 ? arg.substring(eq + 1) : "true";
                converted.add("--" + FLAG_OPTIONS.get(option) + "=" + value);
            } else {
                converted.add(arg);
            }
        }
        return converted.toArray(new String[0]);
    }
}
