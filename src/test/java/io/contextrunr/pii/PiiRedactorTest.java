package io.contextrunr.pii;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PiiRedactorTest {

    private final PiiRedactor redactor = new PiiRedactor();

    @Test
    void shouldRedactEmail() {
        assertEquals("My email is [EMAIL]", redactor.redact("My email is john.doe@example.com"));
    }

    @Test
    void shouldRedactSsn() {
        assertEquals("SSN [SSN] on file", redactor.redact("SSN 123-45-6789 on file"));
    }

    @Test
    void shouldRedactIpAddress() {
        assertEquals("server at [IP_ADDRESS]", redactor.redact("server at 192.168.1.10"));
    }

    @Test
    void shouldKeepNameLabel() {
        assertEquals("Name: [NAME]", redactor.redact("Name: John Smith"));
    }

    @Test
    void shouldRedactDateOfBirth() {
        assertEquals("born [DOB]", redactor.redact("born 01/02/1990"));
        assertEquals("born [DOB]", redactor.redact("born 1990-02-01"));
    }

    @Test
    void shouldRedactBankAccount() {
        assertEquals("account [BANK_ACCOUNT]", redactor.redact("account 12345678"));
    }

    @Test
    void shouldRedactPhoneNumber() {
        String redacted = redactor.redact("call 5551234567 today");
        assertTrue(redacted.contains("[PHONE]"));
        assertFalse(redacted.contains("5551234567"));
    }

    @Test
    void shouldRedactLicensePlate() {
        assertEquals("plate [LICENSE_PLATE]", redactor.redact("plate ABC1234"));
    }

    @Test
    void shouldLeaveCleanTextUntouched() {
        String text = "I prefer dark roast coffee in the morning.";
        assertEquals(text, redactor.redact(text));
    }

    @Test
    void shouldReturnEmptyForNull() {
        assertEquals("", redactor.redact(null));
        assertTrue(redactor.detect(null).isEmpty());
    }

    @Test
    void shouldBeIdempotent() {
        String once = redactor.redact("Mail a@b.com, SSN 123-45-6789, Name: Jane Doe, born 01/02/1990");
        assertEquals(once, redactor.redact(once));
    }

    @Test
    void shouldDetectInRuleOrder() {
        List<PiiMatch> matches = redactor.detect("SSN 123-45-6789, mail a@b.com");

        assertEquals(2, matches.size());
        assertEquals("EMAIL", matches.get(0).type());
        assertEquals("a@b.com", matches.get(0).matchedValue());
        assertEquals("[EMAIL]", matches.get(0).replacementToken());
        assertEquals("SSN", matches.get(1).type());
        assertEquals(4, matches.get(1).startOffset());
        assertEquals(15, matches.get(1).endOffset());
    }

    @Test
    void shouldOrderMatchesOfOneRuleByOffset() {
        List<PiiMatch> matches = redactor.detect("x@a.com then y@b.com");

        assertEquals(2, matches.size());
        assertTrue(matches.get(0).startOffset() < matches.get(1).startOffset());
        assertEquals("y@b.com", matches.get(1).matchedValue());
    }

    @Test
    void shouldFlagSensitiveContext() {
        assertTrue(redactor.validateSensitiveContext("my password: hunter2"));
        assertTrue(redactor.validateSensitiveContext("API_KEY: sk-123"));
        assertTrue(redactor.validateSensitiveContext("token abc.def"));
        assertTrue(redactor.validateSensitiveContext("the secret: swordfish"));
        assertFalse(redactor.validateSensitiveContext("I like hiking on weekends"));
        assertFalse(redactor.validateSensitiveContext(null));
    }

    @Test
    void shouldExposeRuleOrder() {
        assertEquals(List.of("EMAIL", "PHONE", "CREDIT_CARD", "SSN", "IP_ADDRESS", "NAME", "DOB",
                "BANK_ACCOUNT", "LICENSE_PLATE"), redactor.ruleTypes());
    }
}
