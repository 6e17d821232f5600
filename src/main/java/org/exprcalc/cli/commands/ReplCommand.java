package org.exprcalc.cli.commands;

import org.exprcalc.cli.CommandLineInterface;
import org.exprcalc.cli.console.ConsoleOptions;
import org.exprcalc.cli.console.LineEvaluator;
import org.exprcalc.cli.console.ReplSession;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "repl",
    mixinStandardHelpOptions = true,
    description = "Starts an interactive session. Type 'exit' or 'quit', or press Ctrl+D, to leave."
)
public class ReplCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--tree", negatable = true,
            description = "Print the syntax tree before each result (default: exprcalc.console.show-tree).")
    private Boolean tree;

    @Override
    public Integer call() throws IOException {
        ConsoleOptions console = parent.getConsoleOptions();
        if (tree != null) {
            console = console.withShowTree(tree);
        }

        try (Terminal terminal = openTerminal()) {
            final LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory())
                    .build();
            final PrintWriter writer = terminal.writer();
            final LineEvaluator evaluator = new LineEvaluator(parent.createCalculator(), console, writer, writer);
            new ReplSession(lineReader, evaluator, console).run();
        }
        return 0;
    }

    private static Terminal openTerminal() throws IOException {
        // logback.xml keeps JLine's own warning about the dumb fallback quiet.
        try {
            return TerminalBuilder.builder().system(true).build();
        } catch (IOException | IllegalStateException e) {
            log.debug("System terminal unavailable, using a dumb terminal: {}", e.getMessage());
            return TerminalBuilder.builder().dumb(true).build();
        }
    }
}
