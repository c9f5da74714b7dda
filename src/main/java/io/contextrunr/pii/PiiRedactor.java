package io.contextrunr.pii;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects and redacts personally identifiable information before anything is persisted.
 *
 * <p>Rules run in a fixed order, each one over the output of the previous one:</p>
 * <ol>
 *   <li>EMAIL, PHONE, CREDIT_CARD, SSN, IP_ADDRESS</li>
 *   <li>NAME ("Name: First Last" constructs, the label is kept)</li>
 *   <li>DOB, BANK_ACCOUNT, LICENSE_PLATE</li>
 * </ol>
 *
 * <p>Rules are not mutually exclusive. A later rule may rewrite text an earlier rule already
 * produced, so the order and the patterns must stay exactly as they are for stored content
 * to remain comparable across versions.</p>
 */
@Component
public class PiiRedactor {

    private static final List<PiiRule> RULES = List.of(
            PiiRule.of("EMAIL", "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Z|a-z]{2,}\\b", "[EMAIL]"),
            PiiRule.of("PHONE", "\\b\\+?1?[-.\\s]?\\(?(\\d{3})\\)?[-.\\s]?(\\d{3})[-.\\s]?(\\d{4})\\b", "[PHONE]"),
            PiiRule.of("CREDIT_CARD", "\\b\\d{4}[-\\s]?(\\d{4}[-\\s]?){2}\\d{4}\\b", "[CREDIT_CARD]"),
            PiiRule.of("SSN", "\\b\\d{3}-\\d{2}-\\d{4}\\b", "[SSN]"),
            PiiRule.of("IP_ADDRESS", "\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b", "[IP_ADDRESS]"),
            PiiRule.of("NAME", "\\b(Name|name)\\s*[:\\-]\\s*([A-Z][a-z]+ [A-Z][a-z]+)", "$1: [NAME]"),
            PiiRule.of("DOB", "\\b(\\d{1,2}[/\\-]\\d{1,2}[/\\-]\\d{4}|\\d{4}[/\\-]\\d{1,2}[/\\-]\\d{1,2})\\b", "[DOB]"),
            PiiRule.of("BANK_ACCOUNT", "\\b\\d{8,12}\\b", "[BANK_ACCOUNT]"),
            PiiRule.of("LICENSE_PLATE", "\\b[A-Z]{1,3}\\d{3,4}[A-Z]{0,3}\\b", "[LICENSE_PLATE]")
    );

    private static final List<Pattern> SENSITIVE_INDICATORS = List.of(
            Pattern.compile("password[:\\s]+[^\\s]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("api[-_\\s]?key[:\\s]+[^\\s]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("token[:\\s]+[^\\s]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("secret[:\\s]+[^\\s]+", Pattern.CASE_INSENSITIVE)
    );

    /**
     * Redacts PII from text by applying every rule in order.
     *
     * @param text the raw text, may be null
     * @return the redacted text, empty for null input
     */
    public String redact(String text) {
        if (text == null) return "";

        String result = text;
        for (PiiRule rule : RULES) {
            result = rule.redact(result);
        }
        return result;
    }

    /**
     * Scans text without modifying it. Each rule scans the original text on its own,
     * so matches of different rules may overlap.
     *
     * @return matches ordered by rule, then by offset
     */
    public List<PiiMatch> detect(String text) {
        if (text == null || text.isEmpty()) return List.of();

        List<PiiMatch> matches = new ArrayList<>();
        for (PiiRule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                matches.add(new PiiMatch(rule.type(), matcher.group(), matcher.start(), matcher.end(), rule.token()));
            }
        }
        return matches;
    }

    /**
     * Flags secret-like key/value pairs (password, api key, token, secret).
     * Callers use it to refuse storage outright instead of redacting.
     */
    public boolean validateSensitiveContext(String text) {
        if (text == null || text.isBlank()) return false;
        for (Pattern indicator : SENSITIVE_INDICATORS) {
            if (indicator.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    /** Rule types in application order. */
    public List<String> ruleTypes() {
        return RULES.stream().map(PiiRule::type).toList();
    }
}
