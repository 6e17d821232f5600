package org.exprcalc.cli.console;

import com.typesafe.config.Config;

import java.util.List;
import java.util.Locale;

/**
 * How the console front ends talk to the user: prompts, output prefixes and exit keywords.
 *
 * @param inputPrompt Printed before reading an input line, e.g. {@code "in> "}.
 * @param treeHeader Printed on its own line before the AST, e.g. {@code "ast>"}.
 * @param outputPrefix Printed before a result, e.g. {@code "out> "}.
 * @param errorPrefix Printed before an error message, e.g. {@code "err> "}.
 * @param showTree Whether the AST is printed before each result.
 * @param exitKeywords Lines that end an interactive session, compared case-insensitively.
 */
public record ConsoleOptions(
        String inputPrompt,
        String treeHeader,
        String outputPrefix,
        String errorPrefix,
        boolean showTree,
        List<String> exitKeywords
) {
    public ConsoleOptions {
        exitKeywords = exitKeywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
    }

    /**
     * Gets the built-in defaults, matching {@code reference.conf}.
     * @return The default options.
     */
    public static ConsoleOptions defaults() {
        return new ConsoleOptions("in> ", "ast>", "out> ", "err> ", false, List.of("exit", "quit"));
    }

    /**
     * Reads the options from a configuration block.
     * @param config The {@code exprcalc.console} block.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static ConsoleOptions fromConfig(Config config) {
        return new ConsoleOptions(
                config.getString("input-prompt"),
                config.getString("tree-header"),
                config.getString("output-prefix"),
                config.getString("error-prefix"),
                config.getBoolean("show-tree"),
                config.getStringList("exit-keywords"));
    }

    /**
     * Returns a copy with tree printing switched on or off.
     * @param enabled Whether to print the tree.
     * @return The adjusted options.
     */
    public ConsoleOptions withShowTree(boolean enabled) {
        return new ConsoleOptions(inputPrompt, treeHeader, outputPrefix, errorPrefix, enabled, exitKeywords);
    }

    /**
     * Checks whether a trimmed input line is one of the exit keywords.
     * @param line The trimmed input line.
     * @return {@code true} if the line ends the session.
     */
    public boolean isExitKeyword(String line) {
        return exitKeywords.contains(line.toLowerCase(Locale.ROOT));
    }
}
