package com.example.subtitlesync.config;

import java.util.Map;

/**
 * Maps the short command-line options onto the property keys read by {@link AppSettings}.
 * Keeping the short names out of application.properties means environment variables such as
 * {@code TYPE} or {@code METHOD} cannot change a run.
 */
public final class CommandLineOptions {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("plex-url", "plex.url"),
            Map.entry("plex-token", "plex.token"),
            Map.entry("opensubtitles-api-key", "opensubtitles.api-key"),
            Map.entry("opensubtitles-username", "opensubtitles.username"),
            Map.entry("opensubtitles-password", "opensubtitles.password"),
            Map.entry("languages", "subtitles.languages"),
            Map.entry("method", "subtitles.method"),
            Map.entry("library", "subtitles.library"),
            Map.entry("type", "subtitles.type"),
            Map.entry("max-downloads", "subtitles.max-downloads"),
            Map.entry("report", "subtitles.report"));

    private CommandLineOptions() {
    }

    /**
     * Rewrite {@code --name=value} options to the property they set. Flags such as
     * {@code --status} and positional arguments pass through unchanged.
     */
    public static String[] toPropertyArguments(String[] args) {
        String[] rewritten = new String[args.length];
        for (int i = 0; i < args.length; i++) {
            rewritten[i] = rewrite(args[i]);
        }
        return rewritten;
    }

    static String rewrite(String arg) {
        if (!arg.startsWith("--")) {
            return arg;
        }
        int separator = arg.indexOf('=');
        String name = separator < 0 ? arg.substring(2) : arg.substring(2, separator);
        String key = ALIASES.get(name);
        if (key == null) {
            return arg;
        }
        return "--" + key + (separator < 0 ? "" : arg.substring(separator));
    }
}
