package io.contextrunr.pii;

/**
 * A single PII occurrence found by {@link PiiRedactor#detect(String)}.
 *
 * @param type             the rule that matched (EMAIL, PHONE, ...)
 * @param matchedValue     the matched substring of the scanned text
 * @param startOffset      inclusive start offset in the scanned text
 * @param endOffset        exclusive end offset in the scanned text
 * @param replacementToken the token {@link PiiRedactor#redact(String)} substitutes for it
 */
public record PiiMatch(
        String type,
        String matchedValue,
        int startOffset,
        int endOffset,
        String replacementToken
) {
}
