package com.example.Botlyne.tools;

import com.example.Botlyne.model.EvaluationResult;
import com.example.Botlyne.util.ArithmeticEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Description;
import org.springframework.stereotype.Component;

import java.util.function.Function;

/**
 * The arithmetic evaluator exposed to Spring AI as a tool.
 */
@Component(CalculatorToolDefinition.NAME)
@Description("Evaluates an arithmetic expression with + - * / % ^, parentheses and abs, sqrt, min, max, round, pow")
public class CalculatorToolFunction implements Function<CalculatorToolFunction.Request, CalculatorToolFunction.Response> {

    private static final Logger log = LoggerFactory.getLogger(CalculatorToolFunction.class);

    public record Request(String expression) {
    }

    public record Response(String result, String error) {
    }

    @Override
    public Response apply(Request request) {
        EvaluationResult result = ArithmeticEvaluator.evaluate(request == null ? null : request.expression());
        if (result.success()) {
            log.debug("calculator: {} = {}", result.expression(), result.formatted());
            return new Response(result.formatted(), null);
        }
        log.debug("calculator rejected '{}': {}", result.expression(), result.error());
        return new Response(null, result.error());
    }
}
