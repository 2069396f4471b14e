package com.abba.answerdesk.application.messaging.classifier;

import com.abba.answerdesk.domain.model.MessageCategory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class KeywordMessageClassifier implements MessageClassifier {

    private static final int KEYWORD_WEIGHT = 2;
    private static final int PATTERN_WEIGHT = 3;
    private static final int SENDER_ROLE_BOOST = 2;
    private static final int SENDER_ROLE_PENALTY = 1;

    private static final List<MessageCategory> SCORED = List.of(
            MessageCategory.BUSINESS,
            MessageCategory.PERSONAL,
            MessageCategory.SUPPORT,
            MessageCategory.NETWORKING,
            MessageCategory.SALES);

    private static final Map<MessageCategory, List<String>> KEYWORDS = Map.of(
            MessageCategory.BUSINESS, List.of("meeting", "proposal", "contract", "partnership", "invoice", "project",
                    "deadline", "schedule", "collaboration", "opportunit", "agenda", "stakeholder"),
            MessageCategory.PERSONAL, List.of("birthday", "family", "dinner", "party", "weekend", "miss you",
                    "congrat", "vacation", "wedding", "love"),
            MessageCategory.SUPPORT, List.of("help", "issue", "problem", "error", "bug", "broken", "not working",
                    "refund", "support", "fix", "crash"),
            MessageCategory.NETWORKING, List.of("connect", "network", "introduc", "conference", "event", "meetup",
                    "linkedin", "profile", "mentor"),
            MessageCategory.SALES, List.of("price", "pricing", "discount", "offer", "buy", "purchase", "deal",
                    "quote", "subscription", "trial", "cost"));

    private static final Map<MessageCategory, Pattern> PATTERNS = Map.of(
            MessageCategory.BUSINESS, Pattern.compile(
                    "\\b(schedule|book|set up|arrange)\\s+(a\\s+)?(call|meeting|demo|interview)\\b", Pattern.CASE_INSENSITIVE),
            MessageCategory.PERSONAL, Pattern.compile(
                    "\\b(how are you|happy birthday|see you (soon|later|tonight))\\b", Pattern.CASE_INSENSITIVE),
            MessageCategory.SUPPORT, Pattern.compile(
                    "\\b(cannot|can't|unable to)\\s+(log ?in|access|open|connect|use)\\b", Pattern.CASE_INSENSITIVE),
            MessageCategory.NETWORKING, Pattern.compile(
                    "\\b(would love to connect|let'?s connect|connection request|grab (a )?coffee)\\b", Pattern.CASE_INSENSITIVE),
            MessageCategory.SALES, Pattern.compile(
                    "\\b(how much|special offer|limited time|free trial)\\b", Pattern.CASE_INSENSITIVE));

    private static final Map<String, Map<MessageCategory, Integer>> PLATFORM_ADJUSTMENTS = Map.of(
            "linkedin", Map.of(MessageCategory.BUSINESS, 2, MessageCategory.NETWORKING, 2, MessageCategory.PERSONAL, -1),
            "gmail", Map.of(MessageCategory.BUSINESS, 1, MessageCategory.SUPPORT, 1, MessageCategory.SALES, 1),
            "telegram", Map.of(MessageCategory.PERSONAL, 1),
            "facebook", Map.of(MessageCategory.PERSONAL, 2, MessageCategory.BUSINESS, -1),
            "instagram", Map.of(MessageCategory.PERSONAL, 1, MessageCategory.SALES, 1));

    private static final List<String> BUSINESS_ROLES = List.of("recruiter", "ceo", "founder", "manager", "director",
            "hiring", "talent", "consultant", "partner", "hr@", "careers", "business");

    private static final List<String> PERSONAL_RELATIONS = List.of("mom", "mum", "dad", "brother", "sister", "friend",
            "family", "wife", "husband", "aunt", "uncle", "cousin", "grandma", "grandpa", "bestie");

    @Override
    public MessageCategory classify(String content, String sender, String platform) {
        Map<MessageCategory, Integer> scores = score(content, sender, platform);

        MessageCategory best = MessageCategory.GENERAL;
        int bestScore = 0;
        for (MessageCategory category : SCORED) {
            int score = scores.get(category);
            if (score > bestScore) {
                best = category;
                bestScore = score;
            }
        }
        return best;
    }

    Map<MessageCategory, Integer> score(String content, String sender, String platform) {
        Map<MessageCategory, Integer> scores = new EnumMap<>(MessageCategory.class);
        SCORED.forEach(category -> scores.put(category, 0));

        String text = normalize(content);
        for (MessageCategory category : SCORED) {
            for (String keyword : KEYWORDS.get(category)) {
                if (text.contains(keyword)) {
                    scores.merge(category, KEYWORD_WEIGHT, Integer::sum);
                }
            }
            Matcher matcher = PATTERNS.get(category).matcher(text);
            while (matcher.find()) {
                scores.merge(category, PATTERN_WEIGHT, Integer::sum);
            }
        }

        PLATFORM_ADJUSTMENTS.getOrDefault(normalize(platform), Map.of())
                .forEach((category, delta) -> scores.merge(category, delta, Integer::sum));

        String from = normalize(sender);
        if (containsAny(from, BUSINESS_ROLES)) {
            scores.merge(MessageCategory.BUSINESS, SENDER_ROLE_BOOST, Integer::sum);
            scores.merge(MessageCategory.PERSONAL, -SENDER_ROLE_PENALTY, Integer::sum);
        }
        if (containsAny(from, PERSONAL_RELATIONS)) {
            scores.merge(MessageCategory.PERSONAL, SENDER_ROLE_BOOST, Integer::sum);
            scores.merge(MessageCategory.BUSINESS, -SENDER_ROLE_PENALTY, Integer::sum);
        }
        return scores;
    }

    private boolean containsAny(String value, List<String> terms) {
        return terms.stream().anyMatch(value::contains);
    }

    private String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
