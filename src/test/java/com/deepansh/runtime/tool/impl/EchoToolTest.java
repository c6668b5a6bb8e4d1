package com.deepansh.runtime.tool.impl;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EchoToolTest {

    private final EchoTool tool = new EchoTool();

    @Test
    void execute_defaultRepeat_echoesOnce() {
        assertThat(tool.execute(tool.parseArguments(Map.of("message", "ping")))).isEqualTo("Echo: ping");
    }

    @Test
    void execute_repeatAsString_isParsed() {
        EchoTool.Args args = tool.parseArguments(Map.of("message", "hi", "repeat", "3"));

        assertThat(tool.execute(args)).isEqualTo("Echo: hi hi hi");
    }

    @Test
    void parseArguments_missingMessage_throws() {
        assertThatThrownBy(() -> tool.parseArguments(Map.of("repeat", 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("'message' is required");
    }

    @Test
    void parseArguments_repeatOutOfRange_throws() {
        assertThatThrownBy(() -> tool.parseArguments(Map.of("message", "x", "repeat", 6)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 1 and 5");
        assertThatThrownBy(() -> tool.parseArguments(Map.of("message", "x", "repeat", "many")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not an integer");
    }
}
