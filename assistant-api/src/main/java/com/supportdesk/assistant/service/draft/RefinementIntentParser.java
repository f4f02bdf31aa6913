package com.supportdesk.assistant.service.draft;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads draft feedback typed in a draft thread. Checks run in priority order: approval, rejection,
 * style keywords, content additions, then topic mentions. Unrecognised text yields no intent.
 */
@Component
public class RefinementIntentParser {

    private static final Pattern APPROVE = Pattern.compile("^(looks good|look good|approve|approved|ship it|send it|good to go)\\b");
    private static final Pattern REJECT = Pattern.compile("^(reject|rejected|no thanks|not good|needs work|don't send|do not send)\\b\\s*(.*)$");
    private static final Pattern SIMPLIFY = Pattern.compile("\\bsimplify\\b|\\bsimpler\\b|make it simpler");
    private static final Pattern FORMALIZE = Pattern.compile("\\bformal(ize|ise)\\b|more formal");
    private static final Pattern SHORTEN = Pattern.compile("\\bshorten\\b|make it shorter|too long");
    private static final Pattern ADD_BRACKETED = Pattern.compile("(?i)^(?:add|include)\\s*\\[(.+)]\\s*$");
    private static final Pattern ADD = Pattern.compile("(?i)^(?:add|include)\\s+(?!topic\\s)(.+)");
    private static final Pattern MENTION_TOPIC = Pattern.compile("(?i)(?:mention|include)\\s+topic\\s+(.+)");

    public Optional<RefinementIntent> parse(String rawText) {
        String text = rawText == null ? "" : rawText.trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        String normalized = text.toLowerCase(Locale.ROOT);

        if (APPROVE.matcher(normalized).find()) {
            return Optional.of(new RefinementIntent.Approve());
        }
        Matcher reject = REJECT.matcher(normalized);
        if (reject.find()) {
            String reason = reject.group(2) == null ? "" : reject.group(2).trim();
            return Optional.of(new RefinementIntent.Reject(reason.isEmpty() ? null : reason));
        }
        if (SIMPLIFY.matcher(normalized).find()) {
            return Optional.of(new RefinementIntent.Simplify());
        }
        if (FORMALIZE.matcher(normalized).find()) {
            return Optional.of(new RefinementIntent.Formalize());
        }
        if (SHORTEN.matcher(normalized).find()) {
            return Optional.of(new RefinementIntent.Shorten());
        }
        Optional<String> bracketed = firstGroup(ADD_BRACKETED, text);
        if (bracketed.isPresent()) {
            return bracketed.map(RefinementIntent.AddContent::new);
        }
        Optional<String> addition = firstGroup(ADD, text);
        if (addition.isPresent()) {
            return addition.map(RefinementIntent.AddContent::new);
        }
        return firstGroup(MENTION_TOPIC, text).map(RefinementIntent.MentionTopic::new);
    }

    private static Optional<String> firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(1).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
