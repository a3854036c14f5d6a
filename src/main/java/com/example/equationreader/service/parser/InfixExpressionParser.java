package com.example.equationreader.service.parser;

import com.example.equationreader.service.parser.Expression.Binary;
import com.example.equationreader.service.parser.Expression.Equation;
import com.example.equationreader.service.parser.Expression.FunctionCall;
import com.example.equationreader.service.parser.Expression.Negation;
import com.example.equationreader.service.parser.Expression.NumberLiteral;
import com.example.equationreader.service.parser.Expression.Power;
import com.example.equationreader.service.parser.Expression.Symbol;
import com.example.equationreader.service.parser.Expression.Tuple;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses plain infix math such as {@code 2x^2 + sin(x) = 3}. Juxtaposed factors multiply, and a
 * name directly followed by an opening parenthesis is a function call. Names that are not known
 * functions are kept as opaque calls.
 */
@Component
public class InfixExpressionParser implements GenericExpressionParser {

    private static final String OPERATORS = "+-*/^=(),";
    private static final int MAX_TOKENS = 1024;
    private static final int MAX_NESTING = 256;

    private enum Kind {
        NUMBER,
        IDENT,
        OPERATOR
    }

    private record Token(Kind kind, String text, int position, boolean spaced) {
    }

    @Override
    public Expression parse(String text) throws ExpressionParseException {
        if (text == null || text.isBlank()) {
            throw new ExpressionParseException("Empty expression");
        }
        List<Token> tokens = tokenize(text);
        if (tokens.size() > MAX_TOKENS) {
            throw new ExpressionParseException("Expression too long", tokens.get(MAX_TOKENS).position());
        }
        return new Session(tokens).statement();
    }

    private static List<Token> tokenize(String text) throws ExpressionParseException {
        List<Token> tokens = new ArrayList<>();
        int length = text.length();
        int i = 0;
        boolean spaced = false;
        while (i < length) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                spaced = true;
                i++;
                continue;
            }
            int start = i;
            if (LatexTokenizer.isDigit(c) || (c == '.' && i + 1 < length && LatexTokenizer.isDigit(text.charAt(i + 1)))) {
                while (i < length && LatexTokenizer.isDigit(text.charAt(i))) {
                    i++;
                }
                if (i + 1 < length && text.charAt(i) == '.' && LatexTokenizer.isDigit(text.charAt(i + 1))) {
                    i++;
                    while (i < length && LatexTokenizer.isDigit(text.charAt(i))) {
                        i++;
                    }
                }
                tokens.add(new Token(Kind.NUMBER, text.substring(start, i), start, spaced));
            } else if (LatexTokenizer.isLetter(c) || c == '_') {
                while (i < length && (LatexTokenizer.isLetter(text.charAt(i))
                        || LatexTokenizer.isDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(Kind.IDENT, text.substring(start, i), start, spaced));
            } else if (c == '*' && i + 1 < length && text.charAt(i + 1) == '*') {
                tokens.add(new Token(Kind.OPERATOR, "**", start, spaced));
                i += 2;
            } else if (OPERATORS.indexOf(c) >= 0) {
                tokens.add(new Token(Kind.OPERATOR, String.valueOf(c), start, spaced));
                i++;
            } else {
                throw new ExpressionParseException("Unexpected character '" + c + "'", i);
            }
            spaced = false;
        }
        return tokens;
    }

    private static final class Session {

        private final List<Token> tokens;
        private int index;
        private int nesting;

        private Session(List<Token> tokens) {
            this.tokens = tokens;
        }

        Expression statement() throws ExpressionParseException {
            Expression result = expression();
            if (accept("=")) {
                Expression rhs = expression();
                if (at("=")) {
                    throw error("Chained equalities are not supported");
                }
                result = new Equation(result, rhs);
            }
            if (index < tokens.size()) {
                throw error("Unexpected '" + tokens.get(index).text() + "'");
            }
            return result;
        }

        private Expression expression() throws ExpressionParseException {
            Expression left = term();
            while (true) {
                if (accept("+")) {
                    left = new Binary('+', left, term());
                } else if (accept("-")) {
                    left = new Binary('-', left, term());
                } else {
                    return left;
                }
            }
        }

        private Expression term() throws ExpressionParseException {
            Expression left = unary();
            while (true) {
                if (accept("*")) {
                    left = new Binary('*', left, unary());
                } else if (accept("/")) {
                    left = new Binary('/', left, unary());
                } else if (startsPrimary()) {
                    left = new Binary('*', left, power());
                } else {
                    return left;
                }
            }
        }

        private Expression unary() throws ExpressionParseException {
            descend();
            try {
                if (accept("-")) {
                    return new Negation(unary());
                }
                if (accept("+")) {
                    return unary();
                }
                return power();
            } finally {
                nesting--;
            }
        }

        private Expression power() throws ExpressionParseException {
            Expression base = primary();
            if (accept("^") || accept("**")) {
                return new Power(base, unary());
            }
            return base;
        }

        private Expression primary() throws ExpressionParseException {
            descend();
            try {
                return primaryOperand();
            } finally {
                nesting--;
            }
        }

        private Expression primaryOperand() throws ExpressionParseException {
            if (index >= tokens.size()) {
                throw error("Unexpected end of expression");
            }
            Token token = tokens.get(index++);
            if (token.kind() == Kind.NUMBER) {
                return new NumberLiteral(token.text());
            }
            if (token.kind() == Kind.IDENT) {
                if (at("(") && !tokens.get(index).spaced()) {
                    return call(token.text());
                }
                if (MathVocabulary.KNOWN_FUNCTIONS.contains(token.text()) && startsPrimary()) {
                    return new FunctionCall(token.text(), List.of(power()));
                }
                return new Symbol(token.text());
            }
            if (token.text().equals("(")) {
                List<Expression> items = new ArrayList<>();
                items.add(expression());
                while (accept(",")) {
                    items.add(expression());
                }
                expect(")");
                return items.size() == 1 ? items.get(0) : new Tuple(items);
            }
            index--;
            throw error("Unexpected '" + token.text() + "'");
        }

        private Expression call(String name) throws ExpressionParseException {
            expect("(");
            List<Expression> arguments = new ArrayList<>();
            if (!accept(")")) {
                do {
                    arguments.add(expression());
                } while (accept(","));
                expect(")");
            }
            return new FunctionCall(name, arguments);
        }

        private void descend() throws ExpressionParseException {
            if (++nesting > MAX_NESTING) {
                throw error("Nesting too deep");
            }
        }

        private boolean startsPrimary() {
            if (index >= tokens.size()) {
                return false;
            }
            Token token = tokens.get(index);
            return token.kind() != Kind.OPERATOR || token.text().equals("(");
        }

        private boolean at(String operator) {
            return index < tokens.size()
                    && tokens.get(index).kind() == Kind.OPERATOR
                    && tokens.get(index).text().equals(operator);
        }

        private boolean accept(String operator) {
            if (at(operator)) {
                index++;
                return true;
            }
            return false;
        }

        private void expect(String operator) throws ExpressionParseException {
            if (!accept(operator)) {
                throw error("Expected '" + operator + "'");
            }
        }

        private ExpressionParseException error(String message) {
            return new ExpressionParseException(message, index < tokens.size() ? tokens.get(index).position() : -1);
        }
    }
}
