package io.contextrunr.channel;

import io.contextrunr.pii.PiiMatch;
import io.contextrunr.pii.PiiRedactor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Lets adapters check text before handing it to the engine: which PII rules match,
 * what the redacted form looks like, and whether it carries secrets that should not be stored at all.
 */
@RestController
@RequestMapping("/api/pii")
public class PiiController {

    private final PiiRedactor piiRedactor;

    public PiiController(PiiRedactor piiRedactor) {
        this.piiRedactor = piiRedactor;
    }

    @PostMapping("/inspect")
    public ResponseEntity<InspectionDto> inspect(@RequestBody InspectRequestDto request) {
        String text = request.text();
        List<MatchDto> matches = piiRedactor.detect(text).stream().map(MatchDto::from).toList();
        return ResponseEntity.ok(new InspectionDto(
                piiRedactor.validateSensitiveContext(text),
                piiRedactor.redact(text),
                matches));
    }

    @GetMapping("/rules")
    public List<String> rules() {
        return piiRedactor.ruleTypes();
    }

    public record InspectRequestDto(String text) {}

    public record InspectionDto(boolean sensitive, String redacted, List<MatchDto> matches) {}

    public record MatchDto(String type, int startOffset, int endOffset, String replacementToken) {
        static MatchDto from(PiiMatch match) {
            return new MatchDto(match.type(), match.startOffset(), match.endOffset(), match.replacementToken());
        }
    }
}
