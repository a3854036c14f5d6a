package com.example.equationreader.service.pipeline;

import com.example.equationreader.service.correction.SemanticCorrector;
import com.example.equationreader.service.parser.Expression;
import com.example.equationreader.service.parser.ExpressionParseException;
import com.example.equationreader.service.parser.GenericExpressionParser;
import com.example.equationreader.service.parser.StructuredMarkupParser;
import com.example.equationreader.util.BracketBalancer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates cleaned markup by trying increasingly destructive repairs until a parser accepts
 * one. Tiers are never revisited; a parse failure only moves the machine to the next tier, and
 * when the last tier fails the balanced cleaned markup is reported unvalidated.
 *
 * <p>Every accepted expression is formatted and the formatted text is parsed again by the
 * generic parser, so a validated result is always a string a parser accepted verbatim.</p>
 */
@Service
public class TieredCanonicalizer {

    private static final Logger log = LoggerFactory.getLogger(TieredCanonicalizer.class);

    private final StructuredMarkupParser markupParser;
    private final GenericExpressionParser expressionParser;
    private final SemanticCorrector corrector;

    public TieredCanonicalizer(StructuredMarkupParser markupParser,
                               GenericExpressionParser expressionParser,
                               SemanticCorrector corrector) {
        this.markupParser = markupParser;
        this.expressionParser = expressionParser;
        this.corrector = corrector;
    }

    public CanonicalizationOutcome canonicalize(String cleaned) {
        return canonicalize(cleaned, null);
    }

    /**
     * @param cleaned          output of the structural cleaner
     * @param primaryCandidate standardized text replacing {@code cleaned} as the primary tier
     *                         input, or {@code null}
     */
    public CanonicalizationOutcome canonicalize(String cleaned, String primaryCandidate) {
        String source = cleaned == null ? "" : cleaned;
        String raw = BracketBalancer.balance(source);
        String refined = BracketBalancer.balance(corrector.correct(source));
        String primary = primaryCandidate == null || primaryCandidate.isBlank()
                ? raw
                : BracketBalancer.balance(primaryCandidate.strip());

        List<ParseAttempt> attempts = new ArrayList<>();
        Tier tier = Tier.PRIMARY;
        while (tier != null) {
            String input = switch (tier) {
                case PRIMARY -> primary;
                case HEURISTIC -> refined;
                case DEEP_CLEAN -> DeepCleaner.clean(refined);
                case RAW_FALLBACK -> raw;
            };
            ParseAttempt attempt = attempt(tier, input);
            attempts.add(attempt);
            if (attempt.succeeded()) {
                log.debug("Tier {} accepted '{}' as '{}'", tier.label(), input, attempt.expression());
                return new CanonicalizationOutcome(attempt.expression(), true, tier, raw, refined, attempts);
            }
            log.debug("Tier {} rejected '{}': {}", tier.label(), input, attempt.failureReason());
            tier = tier.next();
        }
        log.warn("No parser accepted '{}', reporting it unvalidated", raw);
        return new CanonicalizationOutcome(raw, false, null, raw, refined, attempts);
    }

    private ParseAttempt attempt(Tier tier, String input) {
        if (input.isBlank()) {
            return ParseAttempt.failure(tier, input, "Empty input");
        }
        try {
            Expression parsed = tier.usesStructuredParser()
                    ? markupParser.parse(input)
                    : expressionParser.parse(input);
            String formatted = ExpressionFormatter.format(parsed);
            expressionParser.parse(formatted);
            return ParseAttempt.success(tier, input, formatted);
        } catch (ExpressionParseException ex) {
            return ParseAttempt.failure(tier, input, ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Parser failed unexpectedly in tier {}", tier.label(), ex);
            return ParseAttempt.failure(tier, input, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }
}
