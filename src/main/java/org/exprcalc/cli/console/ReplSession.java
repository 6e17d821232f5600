package org.exprcalc.cli.console;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An interactive read-evaluate-print loop. Each line is calculated independently;
 * errors are reported and the session continues. The session ends on an exit keyword,
 * end of input (Ctrl+D) or an interrupt (Ctrl+C).
 */
public class ReplSession {

    private static final Logger log = LoggerFactory.getLogger(ReplSession.class);

    private final LineReader lineReader;
    private final LineEvaluator lineEvaluator;
    private final ConsoleOptions options;

    public ReplSession(LineReader lineReader, LineEvaluator lineEvaluator, ConsoleOptions options) {
        this.lineReader = lineReader;
        this.lineEvaluator = lineEvaluator;
        this.options = options;
    }

    /**
     * Runs the loop until the user ends the session.
     * @return The number of lines that produced a result.
     */
    public int run() {
        int succeeded = 0;
        int failed = 0;
        while (true) {
            String line;
            try {
                line = lineReader.readLine(options.inputPrompt());
            } catch (UserInterruptException e) {
                // Ctrl+C
                log.debug("Interrupted, ending session.");
                break;
            } catch (EndOfFileException e) {
                // Ctrl+D
                log.debug("End of input, ending session.");
                break;
            }
            if (line == null) {
                break;
            }

            line = line.trim();
            // Skip empty lines (just pressing Enter)
            if (line.isEmpty()) {
                continue;
            }
            if (options.isExitKeyword(line)) {
                break;
            }

            if (lineEvaluator.evaluate(line)) {
                succeeded++;
            } else {
                failed++;
            }
        }
        log.info("Session ended after {} successful and {} failed calculations.", succeeded, failed);
        return succeeded;
    }
}
