package com.z254.lighthouse.beacon.remediation.guardrail;

import com.z254.lighthouse.beacon.config.BeaconProperties;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Keeps generated ad copy free of prohibited claims and flags trademark use in headlines.
 */
@Component
public class ComplianceGuardrail implements Guardrail {

    private final List<String> prohibitedTerms;
    private final List<String> trademarkTerms;

    public ComplianceGuardrail(BeaconProperties properties) {
        this.prohibitedTerms = lowerCase(properties.getRemediation().getProhibitedTerms());
        this.trademarkTerms = lowerCase(properties.getRemediation().getTrademarkTerms());
    }

    @Override
    public String getName() {
        return "compliance";
    }

    @Override
    public boolean isCritical() {
        return false;
    }

    @Override
    public GuardrailResult check(ProposedAction action) {
        Object text = action.param("text");
        if (text != null) {
            String copy = text.toString().toLowerCase(Locale.ROOT);
            for (String term : prohibitedTerms) {
                if (copy.contains(term)) {
                    return GuardrailResult.block("Prohibited term in ad copy: " + term);
                }
            }
        }
        Object headlines = action.param("headlines");
        if (headlines instanceof Collection<?> list && !trademarkTerms.isEmpty()) {
            for (Object headline : list) {
                String h = String.valueOf(headline).toLowerCase(Locale.ROOT);
                for (String term : trademarkTerms) {
                    if (h.contains(term)) {
                        return GuardrailResult.warn("Trademark term in headline: " + term,
                                "Confirm trademark authorization");
                    }
                }
            }
        }
        return GuardrailResult.pass();
    }

    private static List<String> lowerCase(List<String> terms) {
        return terms.stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
    }
}
