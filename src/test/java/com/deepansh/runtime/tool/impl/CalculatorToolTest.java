package com.deepansh.runtime.tool.impl;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalculatorToolTest {

    private final CalculatorTool tool = new CalculatorTool();

    @Test
    void execute_add_returnsPlainResult() {
        String result = tool.execute(tool.parseArguments(Map.of("operation", "add", "a", 2, "b", 3)));

        assertThat(result).isEqualTo("Result: 5");
    }

    @Test
    void execute_divide_keepsFraction() {
        String result = tool.execute(tool.parseArguments(Map.of("operation", "divide", "a", 7, "b", 2)));

        assertThat(result).isEqualTo("Result: 3.5");
    }

    @Test
    void execute_divideByZero_returnsError() {
        String result = tool.execute(tool.parseArguments(Map.of("operation", "divide", "a", 1, "b", 0)));

        assertThat(result).isEqualTo("Error: Division by zero");
    }

    @Test
    void parseArguments_numericStrings_areAccepted() {
        CalculatorTool.Args args = tool.parseArguments(Map.of("operation", "MULTIPLY", "a", "1.5", "b", " 4 "));

        assertThat(args.operation()).isEqualTo("multiply");
        assertThat(tool.execute(args)).isEqualTo("Result: 6");
    }

    @Test
    void parseArguments_unknownOperation_throws() {
        assertThatThrownBy(() -> tool.parseArguments(Map.of("operation", "pow", "a", 1, "b", 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("operation");
    }

    @Test
    void parseArguments_missingOperand_throws() {
        assertThatThrownBy(() -> tool.parseArguments(Map.of("operation", "add", "a", 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("'b' is required");
    }
}
