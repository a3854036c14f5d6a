package com.example.equationreader.service.parser;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression tree produced by both parser collaborators. {@link #render()} follows the
 * conventions of symbolic-algebra libraries ({@code **} for powers, {@code Eq(lhs, rhs)} for
 * equations) so that callers can post-process a single, predictable string form.
 */
public interface Expression {

    int ADDITIVE = 10;
    int MULTIPLICATIVE = 20;
    int UNARY = 30;
    int POWER = 40;
    int ATOM = 50;

    String render();

    default int precedence() {
        return ATOM;
    }

    /**
     * Renders {@code expression}, parenthesised when it binds looser than {@code minimum}.
     */
    static String wrap(Expression expression, int minimum) {
        String rendered = expression.render();
        return expression.precedence() < minimum ? "(" + rendered + ")" : rendered;
    }

    record NumberLiteral(String literal) implements Expression {

        public NumberLiteral {
            Objects.requireNonNull(literal, "literal");
        }

        @Override
        public String render() {
            return literal;
        }
    }

    record Symbol(String name) implements Expression {

        public Symbol {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String render() {
            return name;
        }
    }

    record Binary(char operator, Expression left, Expression right) implements Expression {

        public Binary {
            if ("+-*/".indexOf(operator) < 0) {
                throw new IllegalArgumentException("Unsupported operator " + operator);
            }
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String render() {
            return switch (operator) {
                case '+' -> wrap(left, ADDITIVE) + " + " + wrap(right, ADDITIVE);
                case '-' -> wrap(left, ADDITIVE) + " - " + wrap(right, MULTIPLICATIVE);
                case '*' -> wrap(left, MULTIPLICATIVE) + "*" + wrap(right, MULTIPLICATIVE);
                default -> wrap(left, MULTIPLICATIVE) + "/" + wrap(right, UNARY);
            };
        }

        @Override
        public int precedence() {
            return operator == '+' || operator == '-' ? ADDITIVE : MULTIPLICATIVE;
        }
    }

    record Negation(Expression operand) implements Expression {

        public Negation {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public String render() {
            return "-" + wrap(operand, UNARY);
        }

        @Override
        public int precedence() {
            return UNARY;
        }
    }

    record Power(Expression base, Expression exponent) implements Expression {

        public Power {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(exponent, "exponent");
        }

        @Override
        public String render() {
            return wrap(base, ATOM) + "**" + wrap(exponent, ATOM);
        }

        @Override
        public int precedence() {
            return POWER;
        }
    }

    record FunctionCall(String name, List<Expression> arguments) implements Expression {

        public FunctionCall {
            Objects.requireNonNull(name, "name");
            arguments = List.copyOf(arguments);
        }

        @Override
        public String render() {
            return name + "(" + arguments.stream().map(Expression::render).collect(Collectors.joining(", ")) + ")";
        }
    }

    record Tuple(List<Expression> items) implements Expression {

        public Tuple {
            items = List.copyOf(items);
        }

        @Override
        public String render() {
            return "(" + items.stream().map(Expression::render).collect(Collectors.joining(", ")) + ")";
        }
    }

    record Equation(Expression lhs, Expression rhs) implements Expression {

        public Equation {
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(rhs, "rhs");
        }

        @Override
        public String render() {
            return "Eq(" + lhs.render() + ", " + rhs.render() + ")";
        }
    }
}
