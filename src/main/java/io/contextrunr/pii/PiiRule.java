package io.contextrunr.pii;

import java.util.regex.Pattern;

/**
 * One entry of the redaction rule table: a recognizer paired with its replacement.
 * The replacement follows {@link java.util.regex.Matcher#replaceAll(String)} syntax,
 * so a rule may keep part of the match (e.g. the "Name:" label).
 */
record PiiRule(String type, Pattern pattern, String replacement) {

    static PiiRule of(String type, String regex, String replacement) {
        return new PiiRule(type, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
    }

    /** The token this rule leaves in redacted text, e.g. {@code [EMAIL]}. */
    String token() {
        return "[" + type + "]";
    }

    String redact(String text) {
        return pattern.matcher(text).replaceAll(replacement);
    }
}
