package com.example.equationreader.service.correction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the correction table over structurally cleaned markup.
 */
@Component
public class SemanticCorrector {

    private static final Logger log = LoggerFactory.getLogger(SemanticCorrector.class);

    private final CorrectionRuleTable table;

    public SemanticCorrector() {
        this(CorrectionRuleTable.standard());
    }

    public SemanticCorrector(CorrectionRuleTable table) {
        this.table = table;
    }

    public String correct(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String current = text;
        for (CleaningRule rule : table.rules()) {
            String next = rule.apply(current);
            if (log.isTraceEnabled() && !next.equals(current)) {
                log.trace("Rule {} rewrote '{}' to '{}'", rule.name(), current, next);
            }
            current = next;
        }
        return current;
    }
}
