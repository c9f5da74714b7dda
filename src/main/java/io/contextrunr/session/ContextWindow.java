package io.contextrunr.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps a session's history within its token budget.
 *
 * <p>Tokens are estimated as {@code characters / 4}, a fixed approximation rather than real
 * tokenization. The division is applied once to the summed characters of a message list,
 * never per message, so short messages cannot round down to zero tokens each. Key behaviors:</p>
 * <ul>
 *   <li>System messages are always kept in full</li>
 *   <li>Keeps the longest suffix of non-system messages whose accumulated characters,
 *       divided by 4, fit in {@code maxTokenLimit - systemTokens}</li>
 *   <li>Older messages are dropped whole, never trimmed or summarized</li>
 *   <li>A history with at most one non-system message is left as is</li>
 * </ul>
 */
public class ContextWindow {

    private static final Logger log = LoggerFactory.getLogger(ContextWindow.class);
    static final int CHARS_PER_TOKEN = 4;

    private final int maxTokenLimit;

    public ContextWindow(int maxTokenLimit) {
        if (maxTokenLimit <= 0) {
            throw new IllegalArgumentException("Token limit must be positive");
        }
        this.maxTokenLimit = maxTokenLimit;
    }

    public int maxTokenLimit() {
        return maxTokenLimit;
    }

    public static int estimateTokens(List<Message> messages) {
        return totalChars(messages) / CHARS_PER_TOKEN;
    }

    /**
     * Returns the history to retain: the input itself when within budget, otherwise
     * system messages followed by the retained non-system suffix in chronological order.
     */
    public List<Message> fit(List<Message> history) {
        if (estimateTokens(history) <= maxTokenLimit) {
            return history;
        }

        List<Message> systemMessages = new ArrayList<>();
        List<Message> conversation = new ArrayList<>();
        for (Message msg : history) {
            if (msg.isSystem()) {
                systemMessages.add(msg);
            } else {
                conversation.add(msg);
            }
        }

        if (conversation.size() <= 1) {
            return history;
        }

        int remainingTokens = maxTokenLimit - estimateTokens(systemMessages);

        // Walk back from the most recent message while the suffix still fits
        int keptChars = 0;
        int splitIndex = conversation.size();
        for (int i = conversation.size() - 1; i >= 0; i--) {
            int candidateChars = keptChars + conversation.get(i).content().length();
            if (candidateChars / CHARS_PER_TOKEN > remainingTokens) {
                break;
            }
            keptChars = candidateChars;
            splitIndex = i;
        }

        List<Message> retained = new ArrayList<>(systemMessages);
        retained.addAll(conversation.subList(splitIndex, conversation.size()));

        log.debug("Truncated history: dropped {} of {} messages to fit {} tokens",
                history.size() - retained.size(), history.size(), maxTokenLimit);
        return retained;
    }

    private static int totalChars(List<Message> messages) {
        int total = 0;
        for (Message msg : messages) {
            total += msg.content().length();
        }
        return total;
    }
}
