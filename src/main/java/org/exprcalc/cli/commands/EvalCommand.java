package org.exprcalc.cli.commands;

import org.exprcalc.cli.CommandLineInterface;
import org.exprcalc.cli.console.ConsoleOptions;
import org.exprcalc.cli.console.LineEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "eval",
    mixinStandardHelpOptions = true,
    description = "Evaluates one expression given as arguments, or read as a single line from standard input."
)
public class EvalCommand implements Callable<Integer> {

    /** Exit code when the expression could not be calculated. */
    public static final int EXIT_CALCULATION_FAILED = 1;

    private static final Logger log = LoggerFactory.getLogger(EvalCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = "--tree", negatable = true,
            description = "Print the syntax tree before the result (default: exprcalc.console.show-tree).")
    private Boolean tree;

    @Parameters(arity = "0..*", paramLabel = "EXPRESSION",
            description = "The expression. Several arguments are joined with spaces.")
    private List<String> words;

    @Override
    public Integer call() throws IOException {
        ConsoleOptions console = parent.getConsoleOptions();
        if (tree != null) {
            console = console.withShowTree(tree);
        }
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        String line;
        if (words == null || words.isEmpty()) {
            out.print(console.inputPrompt());
            out.flush();
            line = readStandardInput();
            if (line == null) {
                log.debug("Standard input is empty, nothing to evaluate.");
                return 0;
            }
        } else {
            line = String.join(" ", words);
        }

        line = line.trim();
        if (line.isEmpty() || console.isExitKeyword(line)) {
            return 0;
        }

        final LineEvaluator evaluator = new LineEvaluator(parent.createCalculator(), console, out, err);
        return evaluator.evaluate(line) ? 0 : EXIT_CALCULATION_FAILED;
    }

    private static String readStandardInput() throws IOException {
        // Not closed: closing would close System.in.
        final BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return reader.readLine();
    }
}
