package com.migratorx.cli.command;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.convert.DurationStyle;

/**
 * Read-only view over the process arguments: positional words ({@code upgrade replica db-2}) and
 * Spring style {@code --name=value} options.
 *
 * <p>A boolean option given without a value ({@code --simulate}) is true; {@code --simulate=false}
 * turns it off.
 */
public final class CommandLine {

    private final List<String> words;
    private final ApplicationArguments arguments;

    public CommandLine(ApplicationArguments arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("arguments must not be null");
        }
        this.arguments = arguments;
        this.words = List.copyOf(arguments.getNonOptionArgs());
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    /** Positional word at {@code index}, or a usage error naming what was expected. */
    public String word(int index, String expected) {
        if (index >= words.size() || words.get(index).isBlank()) {
            throw new UsageException(expected + " is required");
        }
        return words.get(index);
    }

    public List<String> words() {
        return words;
    }

    /** Last value of {@code --name}, or {@code defaultValue} when absent or empty. */
    public String option(String name, String defaultValue) {
        List<String> values = arguments.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return defaultValue;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    public Path path(String name) {
        String value = option(name, null);
        return value == null ? null : Path.of(value);
    }

    public Path path(String name, String defaultValue) {
        return Path.of(option(name, defaultValue));
    }

    public boolean flag(String name, boolean defaultValue) {
        if (!arguments.containsOption(name)) {
            return defaultValue;
        }
        String value = option(name, "true").toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new UsageException("--" + name + " expects true or false, got \"" + value + "\"");
        };
    }

    /** ISO-8601 ({@code PT5M}) or simple ({@code 30s}, {@code 5m}, {@code 1h}) duration. */
    public Duration duration(String name) {
        String value = option(name, null);
        if (value == null) {
            return null;
        }
        try {
            return DurationStyle.detectAndParse(value);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new UsageException("--" + name + " is not a duration: " + value);
        }
    }
}
