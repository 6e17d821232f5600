package org.exprcalc.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Starts the command line in a fresh JVM, so whatever Logback prints while it configures
 * itself ends up in the captured streams.
 */
@Tag("integration")
class CommandLineInterfaceProcessTest {

    @TempDir
    Path tempDir;

    private record Result(int exitCode, String stdout, String stderr) {}

    private Result run(List<String> jvmOptions, String... args) throws IOException, InterruptedException {
        String classPath = System.getProperty("surefire.test.class.path", System.getProperty("java.class.path"));
        List<String> command = new ArrayList<>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        command.addAll(jvmOptions);
        command.add("-cp");
        command.add(classPath);
        command.add(CommandLineInterface.class.getName());
        command.addAll(List.of(args));

        Path stderrFile = tempDir.resolve("stderr.txt");
        Process process = new ProcessBuilder(command)
                .directory(tempDir.toFile())
                .redirectError(stderrFile.toFile())
                .start();
        process.getOutputStream().close();
        String stdout = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        assertThat(process.waitFor(60, TimeUnit.SECONDS)).isTrue();
        return new Result(process.exitValue(), stdout, Files.readString(stderrFile, StandardCharsets.UTF_8));
    }

    @Test
    void eval_writesOnlyTheResultToStandardOutput() throws Exception {
        // Act
        Result result = run(List.of(), "eval", "2+3");

        // Assert
        assertThat(result.exitCode()).isZero();
        assertThat(result.stdout().lines()).containsExactly("out> 5");
    }

    @Test
    void eval_keepsStandardOutputCleanWithJsonLogging() throws Exception {
        Result result = run(List.of("-Dlogging.format=JSON", "-Dlogging.default-level=DEBUG"), "eval", "6 * 7");

        assertThat(result.exitCode()).isZero();
        assertThat(result.stdout().lines()).containsExactly("out> 42");
        assertThat(result.stderr()).contains("\"level\":\"DEBUG\"");
    }

    @Test
    void eval_writesErrorsToStandardError() throws Exception {
        Result result = run(List.of(), "eval", "1 / 0");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.stdout()).isEmpty();
        assertThat(result.stderr().lines()).contains("err> division by zero: 1 / 0");
    }
}
