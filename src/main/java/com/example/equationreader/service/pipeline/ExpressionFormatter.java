package com.example.equationreader.service.pipeline;

import com.example.equationreader.service.parser.Expression;

import java.util.regex.Pattern;

/**
 * Turns a parsed tree into the calculator form reported to clients: {@code lhs = rhs} for
 * equations, {@code ^} for powers and subscripts folded into the identifier ({@code p_{h}} to
 * {@code ph}).
 */
public final class ExpressionFormatter {

    private static final Pattern SUBSCRIPT = Pattern.compile("_\\{?([a-zA-Z0-9]+)\\}?");

    private ExpressionFormatter() {
    }

    public static String format(Expression expression) {
        String rendered = expression instanceof Expression.Equation equation
                ? equation.lhs().render() + " = " + equation.rhs().render()
                : expression.render();
        rendered = rendered.replace("**", "^");
        return SUBSCRIPT.matcher(rendered).replaceAll("$1");
    }
}
