package com.example.equationreader.service.parser;

import com.example.equationreader.service.parser.Expression.Binary;
import com.example.equationreader.service.parser.Expression.Equation;
import com.example.equationreader.service.parser.Expression.FunctionCall;
import com.example.equationreader.service.parser.Expression.Negation;
import com.example.equationreader.service.parser.Expression.NumberLiteral;
import com.example.equationreader.service.parser.Expression.Power;
import com.example.equationreader.service.parser.Expression.Symbol;
import com.example.equationreader.service.parser.Expression.Tuple;
import com.example.equationreader.service.parser.LatexTokenizer.Kind;
import com.example.equationreader.service.parser.LatexTokenizer.Token;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the subset of LaTeX math markup produced by equation OCR models.
 * Implicit multiplication, fractions, roots, trigonometric and logarithmic functions, absolute
 * values, integrals, limits and bounded sums are understood. Anything else (comma lists, text
 * blocks, unknown commands) is rejected so that the caller can fall back to a repaired input.
 */
@Component
public class LatexMarkupParser implements StructuredMarkupParser {

    private static final Set<String> IGNORED_COMMANDS = Set.of(
            "left", "right", "big", "Big", "bigg", "Bigg", "bigl", "bigr", "Bigl", "Bigr",
            "displaystyle", "textstyle", "limits", "quad", "qquad", ",", ";", ":", "!", " ");
    private static final Set<String> MULTIPLY_COMMANDS = Set.of("cdot", "times", "ast");
    private static final Set<String> ARROW_COMMANDS = Set.of("to", "rightarrow", "longrightarrow");
    private static final Set<String> FRACTION_COMMANDS = Set.of("frac", "dfrac", "tfrac");
    private static final Set<String> STRUCTURE_COMMANDS = Set.of("sqrt", "int", "lim", "sum", "mathit", "operatorname", "infty");
    private static final int MAX_TOKENS = 1024;
    private static final int MAX_NESTING = 256;

    @Override
    public Expression parse(String markup) throws ExpressionParseException {
        if (markup == null || markup.isBlank()) {
            throw new ExpressionParseException("Empty markup");
        }
        List<Token> tokens = LatexTokenizer.tokenize(markup);
        if (tokens.size() > MAX_TOKENS) {
            throw new ExpressionParseException("Markup too long", tokens.get(MAX_TOKENS).position());
        }
        return new Session(tokens).statement();
    }

    private static final class Session {

        private final List<Token> tokens;
        private int index;
        private int integralDepth;
        private int nesting;

        private Session(List<Token> tokens) {
            this.tokens = tokens;
        }

        Expression statement() throws ExpressionParseException {
            Expression result = expression();
            if (acceptSymbol("=")) {
                Expression rhs = expression();
                if (atSymbol("=")) {
                    throw error("Chained equalities are not supported");
                }
                result = new Equation(result, rhs);
            }
            Token trailing = peek();
            if (trailing != null) {
                throw error("Unexpected '" + trailing.text() + "'");
            }
            return result;
        }

        private Expression expression() throws ExpressionParseException {
            Expression left = term();
            while (true) {
                if (acceptSymbol("+")) {
                    left = new Binary('+', left, term());
                } else if (acceptSymbol("-")) {
                    left = new Binary('-', left, term());
                } else {
                    return left;
                }
            }
        }

        private Expression term() throws ExpressionParseException {
            Expression left = unary();
            while (true) {
                if (acceptSymbol("*") || acceptCommand(MULTIPLY_COMMANDS)) {
                    left = new Binary('*', left, unary());
                } else if (acceptSymbol("/") || acceptCommand(Set.of("div"))) {
                    left = new Binary('/', left, unary());
                } else if (startsImplicitFactor()) {
                    left = new Binary('*', left, power());
                } else {
                    return left;
                }
            }
        }

        private Expression unary() throws ExpressionParseException {
            descend();
            try {
                if (acceptSymbol("-")) {
                    return new Negation(unary());
                }
                if (acceptSymbol("+")) {
                    return unary();
                }
                return power();
            } finally {
                nesting--;
            }
        }

        private Expression power() throws ExpressionParseException {
            Expression base = postfix();
            if (acceptSymbol("^")) {
                return new Power(base, superscript());
            }
            if (acceptSymbol("**")) {
                return new Power(base, unary());
            }
            return base;
        }

        private Expression postfix() throws ExpressionParseException {
            Expression operand = atom();
            while (acceptSymbol("!")) {
                operand = new FunctionCall("factorial", List.of(operand));
            }
            return operand;
        }

        private Expression superscript() throws ExpressionParseException {
            if (acceptSymbol("{")) {
                Expression exponent = expression();
                expectSymbol("}");
                return exponent;
            }
            if (acceptSymbol("-")) {
                return new Negation(argument());
            }
            return argument();
        }

        private Expression atom() throws ExpressionParseException {
            Token token = peek();
            if (token == null) {
                throw error("Unexpected end of markup");
            }
            if (token.kind() == Kind.NUMBER) {
                index++;
                return new NumberLiteral(token.text());
            }
            if (token.kind() == Kind.LETTER) {
                index++;
                return identifier(token.text());
            }
            descend();
            try {
                return token.kind() == Kind.COMMAND ? command(token.text()) : group(token.text());
            } finally {
                nesting--;
            }
        }

        /**
         * Every recursive path passes through {@link #unary()} or a group or command in
         * {@link #atom()}, so bounding those two bounds the stack.
         */
        private void descend() throws ExpressionParseException {
            if (++nesting > MAX_NESTING) {
                throw error("Nesting too deep");
            }
        }

        private Expression identifier(String base) throws ExpressionParseException {
            if (!acceptSymbol("_")) {
                return new Symbol(base);
            }
            String name = base + "_" + subscriptName();
            if (acceptSymbol("(")) {
                Expression argument = expression();
                expectSymbol(")");
                return new FunctionCall(name, List.of(argument));
            }
            return new Symbol(name);
        }

        private String subscriptName() throws ExpressionParseException {
            if (!acceptSymbol("{")) {
                return subscriptPart(next());
            }
            StringBuilder name = new StringBuilder();
            while (!acceptSymbol("}")) {
                name.append(subscriptPart(next()));
            }
            if (name.length() == 0) {
                throw error("Empty subscript");
            }
            return name.toString();
        }

        private String subscriptPart(Token token) throws ExpressionParseException {
            if (token.kind() == Kind.LETTER) {
                return token.text();
            }
            if (token.kind() == Kind.NUMBER && token.text().indexOf('.') < 0) {
                return token.text();
            }
            if (token.kind() == Kind.COMMAND && MathVocabulary.isGreekCommand(token.text())) {
                return MathVocabulary.greekSymbolName(token.text());
            }
            if (token.kind() == Kind.COMMAND && token.text().equals("mathit")) {
                return word();
            }
            throw new ExpressionParseException("Unsupported subscript '" + token.text() + "'", token.position());
        }

        private String word() throws ExpressionParseException {
            expectSymbol("{");
            StringBuilder word = new StringBuilder();
            while (!acceptSymbol("}")) {
                Token token = next();
                if (token.kind() != Kind.LETTER && token.kind() != Kind.NUMBER) {
                    throw new ExpressionParseException("Unexpected '" + token.text() + "' in name", token.position());
                }
                word.append(token.text());
            }
            if (word.length() == 0) {
                throw error("Empty name");
            }
            return word.toString();
        }

        private Expression group(String symbol) throws ExpressionParseException {
            String closing = switch (symbol) {
                case "(" -> ")";
                case "[" -> "]";
                case "{" -> "}";
                case "|" -> "|";
                default -> null;
            };
            if (closing == null) {
                throw error("Unexpected '" + symbol + "'");
            }
            index++;
            Expression inner = expression();
            expectSymbol(closing);
            return symbol.equals("|") ? new FunctionCall("Abs", List.of(inner)) : inner;
        }

        private Expression command(String name) throws ExpressionParseException {
            if (MathVocabulary.isGreekCommand(name)) {
                index++;
                return identifier(MathVocabulary.greekSymbolName(name));
            }
            if (FRACTION_COMMANDS.contains(name)) {
                index++;
                Expression numerator = argument();
                Expression denominator = argument();
                return new Binary('/', numerator, denominator);
            }
            if (MathVocabulary.MARKUP_FUNCTIONS.containsKey(name)) {
                index++;
                return functionApplication(name, MathVocabulary.MARKUP_FUNCTIONS.get(name));
            }
            switch (name) {
                case "infty" -> {
                    index++;
                    return new Symbol("oo");
                }
                case "mathit" -> {
                    index++;
                    return identifier(word());
                }
                case "operatorname" -> {
                    index++;
                    String function = word();
                    return functionApplication(function, function);
                }
                case "sqrt" -> {
                    index++;
                    return root();
                }
                case "int" -> {
                    index++;
                    return integral();
                }
                case "lim" -> {
                    index++;
                    return limit();
                }
                case "sum" -> {
                    index++;
                    return sum();
                }
                default -> throw error("Unsupported command \\" + name);
            }
        }

        private Expression functionApplication(String command, String function) throws ExpressionParseException {
            Expression base = null;
            if (command.equals("log") && acceptSymbol("_")) {
                base = argument();
            }
            Expression exponent = null;
            if (acceptSymbol("^")) {
                exponent = superscript();
            }
            Expression operand;
            if (atSymbol("(") || atSymbol("[") || atSymbol("{")) {
                operand = group(peek().text());
            } else {
                operand = power();
                while (startsImplicitFactor() && !atFunctionCommand()) {
                    operand = new Binary('*', operand, power());
                }
            }
            Expression call = new FunctionCall(function, base == null ? List.of(operand) : List.of(operand, base));
            return exponent == null ? call : new Power(call, exponent);
        }

        private Expression root() throws ExpressionParseException {
            if (acceptSymbol("[")) {
                Expression degree = expression();
                expectSymbol("]");
                Expression radicand = argument();
                return new Power(radicand, new Binary('/', new NumberLiteral("1"), degree));
            }
            return new FunctionCall("sqrt", List.of(argument()));
        }

        private Expression integral() throws ExpressionParseException {
            Expression lower = null;
            Expression upper = null;
            for (int bound = 0; bound < 2; bound++) {
                if (lower == null && acceptSymbol("_")) {
                    lower = argument();
                } else if (upper == null && acceptSymbol("^")) {
                    upper = argument();
                }
            }
            if ((lower == null) != (upper == null)) {
                throw error("Integral needs both bounds or none");
            }
            Expression integrand;
            integralDepth++;
            try {
                integrand = atDifferential() ? new NumberLiteral("1") : expression();
            } finally {
                integralDepth--;
            }
            if (!atDifferential()) {
                throw error("Missing differential");
            }
            index++;
            Symbol variable = new Symbol(next().text());
            Expression limits = lower == null ? variable : new Tuple(List.of(variable, lower, upper));
            return new FunctionCall("Integral", List.of(integrand, limits));
        }

        private Expression limit() throws ExpressionParseException {
            expectSymbol("_");
            expectSymbol("{");
            String variable = boundVariable();
            boolean arrow = acceptCommand(ARROW_COMMANDS) || (acceptSymbol("-") && acceptSymbol(">"));
            if (!arrow) {
                throw error("Expected limit arrow");
            }
            Expression target = expression();
            expectSymbol("}");
            Expression body = term();
            return new FunctionCall("Limit", List.of(body, new Symbol(variable), target));
        }

        private Expression sum() throws ExpressionParseException {
            expectSymbol("_");
            expectSymbol("{");
            String variable = boundVariable();
            expectSymbol("=");
            Expression from = expression();
            expectSymbol("}");
            if (!acceptSymbol("^")) {
                throw error("Unbounded sum");
            }
            Expression to = argument();
            Expression body = term();
            return new FunctionCall("Sum", List.of(body, new Tuple(List.of(new Symbol(variable), from, to))));
        }

        private String boundVariable() throws ExpressionParseException {
            Token token = next();
            if (token.kind() == Kind.LETTER) {
                return token.text();
            }
            if (token.kind() == Kind.COMMAND && MathVocabulary.isGreekCommand(token.text())) {
                return MathVocabulary.greekSymbolName(token.text());
            }
            throw new ExpressionParseException("Expected a variable", token.position());
        }

        /**
         * A braced group or a single token, as taken by {@code \frac} and friends. Multi-digit
         * numbers contribute only their first digit so that {@code \frac12} reads as one half.
         */
        private Expression argument() throws ExpressionParseException {
            if (acceptSymbol("{")) {
                Expression inner = expression();
                expectSymbol("}");
                return inner;
            }
            Token token = peek();
            if (token == null) {
                throw error("Missing argument");
            }
            if (token.kind() == Kind.NUMBER) {
                return new NumberLiteral(leadingDigit(token));
            }
            if (token.kind() == Kind.LETTER) {
                index++;
                return new Symbol(token.text());
            }
            if (token.kind() == Kind.COMMAND || atSymbol("(")) {
                return atom();
            }
            throw error("Missing argument");
        }

        private String leadingDigit(Token token) {
            String text = token.text();
            if (text.length() == 1 || text.charAt(0) == '.') {
                index++;
                return text;
            }
            tokens.set(index, new Token(Kind.NUMBER, text.substring(1), token.position() + 1));
            return text.substring(0, 1);
        }

        private boolean startsImplicitFactor() {
            Token token = peek();
            if (token == null || (integralDepth > 0 && atDifferential())) {
                return false;
            }
            return switch (token.kind()) {
                case NUMBER, LETTER -> true;
                case SYMBOL -> token.text().equals("(") || token.text().equals("[") || token.text().equals("{");
                case COMMAND -> MathVocabulary.isGreekCommand(token.text())
                        || FRACTION_COMMANDS.contains(token.text())
                        || STRUCTURE_COMMANDS.contains(token.text())
                        || MathVocabulary.MARKUP_FUNCTIONS.containsKey(token.text());
            };
        }

        private boolean atFunctionCommand() {
            Token token = peek();
            return token != null && token.kind() == Kind.COMMAND
                    && (MathVocabulary.MARKUP_FUNCTIONS.containsKey(token.text()) || token.text().equals("operatorname"));
        }

        private boolean atDifferential() {
            Token token = peek();
            if (token == null || token.kind() != Kind.LETTER || !token.text().equals("d")) {
                return false;
            }
            int ahead = skipIgnored(index + 1);
            return ahead < tokens.size() && tokens.get(ahead).kind() == Kind.LETTER;
        }

        private Token peek() {
            index = skipIgnored(index);
            return index < tokens.size() ? tokens.get(index) : null;
        }

        private Token next() throws ExpressionParseException {
            Token token = peek();
            if (token == null) {
                throw error("Unexpected end of markup");
            }
            index++;
            return token;
        }

        private int skipIgnored(int from) {
            int position = from;
            while (position < tokens.size()
                    && tokens.get(position).kind() == Kind.COMMAND
                    && IGNORED_COMMANDS.contains(tokens.get(position).text())) {
                position++;
            }
            return position;
        }

        private boolean atSymbol(String symbol) {
            Token token = peek();
            return token != null && token.kind() == Kind.SYMBOL && token.text().equals(symbol);
        }

        private boolean acceptSymbol(String symbol) {
            if (atSymbol(symbol)) {
                index++;
                return true;
            }
            return false;
        }

        private boolean acceptCommand(Set<String> names) {
            Token token = peek();
            if (token != null && token.kind() == Kind.COMMAND && names.contains(token.text())) {
                index++;
                return true;
            }
            return false;
        }

        private void expectSymbol(String symbol) throws ExpressionParseException {
            if (!acceptSymbol(symbol)) {
                throw error("Expected '" + symbol + "'");
            }
        }

        private ExpressionParseException error(String message) {
            Token token = peek();
            return new ExpressionParseException(message, token == null ? -1 : token.position());
        }
    }
}
