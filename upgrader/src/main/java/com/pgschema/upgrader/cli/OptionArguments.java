package com.pgschema.upgrader.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rewrites {@code --name value} pairs into the {@code --name=value} form Spring parses.
 * Only options that take a value are joined; flags such as {@code --tls} never consume the next token.
 */
final class OptionArguments {

    static final Set<String> VALUE_OPTIONS = Set.of(
        "path", "schema", "strategy",
        ConnectionTargetResolver.CONNECTION_STRING, "host", "port", "user", "password", "database");

    private OptionArguments() {
        // Utility class - prevent instantiation
    }

    static String[] normalize(String... sourceArgs) {
        List<String> normalized = new ArrayList<>(sourceArgs.length);
        for (int i = 0; i < sourceArgs.length; i++) {
            String arg = sourceArgs[i];
            if (takesSeparateValue(arg) && i + 1 < sourceArgs.length && !sourceArgs[i + 1].startsWith("--")) {
                normalized.add(arg + "=" + sourceArgs[++i]);
            } else {
                normalized.add(arg);
            }
        }
        return normalized.toArray(new String[0]);
    }

    private static boolean takesSeparateValue(String arg) {
        return arg.startsWith("--") && !arg.contains("=") && VALUE_OPTIONS.contains(arg.substring(2));
    }
}
