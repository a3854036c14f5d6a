package com.example.equationreader.service.pipeline;

import com.example.equationreader.service.parser.Expression;
import com.example.equationreader.service.parser.Expression.Binary;
import com.example.equationreader.service.parser.Expression.Equation;
import com.example.equationreader.service.parser.Expression.FunctionCall;
import com.example.equationreader.service.parser.Expression.NumberLiteral;
import com.example.equationreader.service.parser.Expression.Power;
import com.example.equationreader.service.parser.Expression.Symbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExpressionFormatterTest {

    @Test
    void shouldWriteEquationsWithEqualsSign() {
        Expression equation = new Equation(new Symbol("x"), new NumberLiteral("1"));

        assertThat(ExpressionFormatter.format(equation)).isEqualTo("x = 1");
    }

    @Test
    void shouldUseCaretForPowers() {
        Expression power = new Binary('+', new Power(new Symbol("x"), new NumberLiteral("2")), new NumberLiteral("1"));

        assertThat(ExpressionFormatter.format(power)).isEqualTo("x^2 + 1");
    }

    @Test
    void shouldFoldSubscriptsIntoIdentifiers() {
        Expression call = new FunctionCall("p_h", List.of(new Symbol("r")));
        Expression difference = new Binary('-', new Symbol("r"), new Symbol("r_star"));

        assertThat(ExpressionFormatter.format(call)).isEqualTo("ph(r)");
        assertThat(ExpressionFormatter.format(difference)).isEqualTo("r - rstar");
    }
}
