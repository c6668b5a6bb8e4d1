package com.deepansh.runtime.tool.impl;

import com.deepansh.runtime.tool.AgentTool;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Basic arithmetic, so the model does not have to do it in its head.
 */
@Component
public class CalculatorTool implements AgentTool<CalculatorTool.Args> {

    private static final List<String> OPERATIONS = List.of("add", "subtract", "multiply", "divide");

    public record Args(String operation, double a, double b) {}

    @Override
    public String getName() {
        return "calculator";
    }

    @Override
    public String getDescription() {
        return "Performs basic arithmetic (add, subtract, multiply, divide) on two numbers.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "operation", Map.of(
                                "type", "string",
                                "enum", OPERATIONS,
                                "description", "The arithmetic operation to perform"
                        ),
                        "a", Map.of("type", "number", "description", "First operand"),
                        "b", Map.of("type", "number", "description", "Second operand")
                ),
                "required", List.of("operation", "a", "b")
        );
    }

    @Override
    public Args parseArguments(Map<String, Object> raw) {
        Object operation = raw.get("operation");
        if (operation == null || !OPERATIONS.contains(operation.toString().toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("'operation' must be one of " + OPERATIONS);
        }
        return new Args(operation.toString().toLowerCase(Locale.ROOT), number(raw, "a"), number(raw, "b"));
    }

    @Override
    public String execute(Args args) {
        double result;
        switch (args.operation()) {
            case "add" -> result = args.a() + args.b();
            case "subtract" -> result = args.a() - args.b();
            case "multiply" -> result = args.a() * args.b();
            case "divide" -> {
                if (args.b() == 0) {
                    return "Error: Division by zero";
                }
                result = args.a() / args.b();
            }
            default -> throw new IllegalArgumentException("Unsupported operation: " + args.operation());
        }
        return "Result: " + format(result);
    }

    private static double number(Map<String, Object> raw, String key) {
        Object value = raw.get(key);
        if (value instanceof Number n) return n.doubleValue();
        if (value == null) throw new IllegalArgumentException("'" + key + "' is required");
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' is not a number: " + value);
        }
    }

    private static String format(double value) {
        if (Double.isInfinite(value) || Double.isNaN(value)) return String.valueOf(value);
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
