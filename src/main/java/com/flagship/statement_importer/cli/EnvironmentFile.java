package com.flagship.statement_importer.cli;

/**
 * Locates the environment file given with {@code -e/--environment} before the
 * Spring context starts, and turns it into a {@code spring.config.import} location.
 *
 * The default {@code .env} is optional; an explicitly named file must exist.
 */
public final class EnvironmentFile {

    static final String DEFAULT_FILE = ".env";

    private EnvironmentFile() {
        // Utility class
    }

    /**
     * @return the value for {@code spring.config.import}
     */
    public static String configImport(String[] args) {
        String explicit = find(args);
        if (explicit == null) {
            return "optional:file:" + DEFAULT_FILE + "[.properties]";
        }
        return "file:" + explicit + "[.properties]";
    }

    static String find(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (("-e".equals(arg) || "--environment".equals(arg)) && i + 1 < args.length) {
                return args[i + 1];
            }
            if (arg.startsWith("--environment=")) {
                return arg.substring("--environment=".length());
            }
            if (arg.startsWith("-e") && arg.length() > 2 && !arg.startsWith("--")) {
                // picocli accepts both -eFILE and -e=FILE
                String value = arg.substring(2);
                return value.startsWith("=") ? value.substring(1) : value;
            }
        }
        return null;
    }
}
