package org.exprcalc.cli.console;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ConsoleOptionsTest {

    @Test
    void fromConfig_matchesReferenceDefaults() {
        ConsoleOptions options = ConsoleOptions.fromConfig(ConfigFactory.defaultReference().getConfig("exprcalc.console"));

        assertThat(options).isEqualTo(ConsoleOptions.defaults());
    }

    @Test
    void isExitKeyword_ignoresCase() {
        ConsoleOptions options = new ConsoleOptions("> ", "ast>", "= ", "! ", false, List.of("Exit", "BYE"));

        assertThat(options.isExitKeyword("exit")).isTrue();
        assertThat(options.isExitKeyword("bye")).isTrue();
        assertThat(options.isExitKeyword("quit")).isFalse();
        assertThat(options.isExitKeyword("1 + 1")).isFalse();
    }

    @Test
    void withShowTree_changesOnlyTheTreeFlag() {
        ConsoleOptions options = ConsoleOptions.defaults().withShowTree(true);

        assertThat(options.showTree()).isTrue();
        assertThat(options.outputPrefix()).isEqualTo("out> ");
    }
}
