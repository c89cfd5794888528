package com.example.Botlyne.service;

import com.example.Botlyne.model.QueryRoute;
import com.example.Botlyne.model.RouteDecision;
import com.example.Botlyne.util.ArithmeticEvaluator;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based classification of an inbound message. Rules are checked in order and the first
 * match wins:
 * <ol>
 *   <li>a contact email while the conversation is waiting for one</li>
 *   <li>an explicit request for a human</li>
 *   <li>a bare arithmetic expression</li>
 *   <li>greetings, thanks, farewells and small talk</li>
 *   <li>everything else goes to the knowledge base</li>
 * </ol>
 */
@Component
public class QueryRouter {

    static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9-]+(\\.[A-Za-z0-9-]+)*\\.[A-Za-z]{2,}");

    private static final Pattern HUMAN_REQUEST = Pattern.compile(
            "\\b(?:"
                    + "(?:talk|speak|chat|connect|transfer)(?: me)? (?:to|with) (?:a |an |the |your )?"
                    + "(?:real |live )?(?:human|person|agent|representative|rep|operator|manager|someone|support team)"
                    + "|human (?:agent|being|support|help)"
                    + "|real (?:person|human)"
                    + "|live (?:agent|person|support|chat)"
                    + "|customer (?:service|support) (?:agent|representative|rep)"
                    + "|escalate"
                    + ")\\b");

    private static final Pattern MATH_PREFIX = Pattern.compile(
            "^(?:what is|what's|whats|calculate|compute|evaluate|solve)\\s*[:]?\\s*");

    private static final Pattern MATH_BODY = Pattern.compile("^[0-9a-z+\\-*/%^().,\\s]+$");

    private static final Pattern WORD = Pattern.compile("[a-z]+");

    private static final Pattern MATH_SIGNAL = Pattern.compile("[+\\-*/%^]|[a-z]+\\s*\\(");

    private static final Pattern SMALL_TALK = Pattern.compile(
            "^(?:hi|hii+|hello|hey|heya|hiya|yo|greetings|howdy"
                    + "|good (?:morning|afternoon|evening|day|night)"
                    + "|thanks|thank you|thank you so much|thanks a lot|many thanks|thx|ty|cheers"
                    + "|bye|goodbye|bye bye|see you|see ya|later|take care"
                    + "|how are you|how are you doing|how's it going|what's up|whats up|sup"
                    + "|ok|okay|cool|great|nice|awesome|got it|perfect|sounds good"
                    + "|who are you|what can you do"
                    + ")(?: (?:there|again|everyone|all|bot|so much|very much))*$");

    public RouteDecision route(String message, boolean contactPending) {
        String trimmed = message == null ? "" : message.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);

        if (contactPending) {
            Matcher email = EMAIL.matcher(trimmed);
            if (email.find()) {
                return new RouteDecision(QueryRoute.CONTACT_EMAIL, email.group());
            }
        }

        if (HUMAN_REQUEST.matcher(lower).find()) {
            return new RouteDecision(QueryRoute.ESCALATION_REQUEST, trimmed);
        }

        String expression = mathExpression(lower);
        if (expression != null) {
            return new RouteDecision(QueryRoute.MATH_QUERY, expression);
        }

        if (isSmallTalk(lower)) {
            return new RouteDecision(QueryRoute.CONVERSATIONAL, trimmed);
        }

        return new RouteDecision(QueryRoute.KB_QUERY, trimmed);
    }

    /**
     * The bare expression if the message is only arithmetic, else null.
     */
    static String mathExpression(String lower) {
        String candidate = MATH_PREFIX.matcher(lower).replaceFirst("");
        candidate = candidate.replaceAll("[?=!.\\s]+$", "").trim();
        if (candidate.isEmpty() || !MATH_BODY.matcher(candidate).matches()) {
            return null;
        }
        if (candidate.chars().noneMatch(Character::isDigit) || !MATH_SIGNAL.matcher(candidate).find()) {
            return null;
        }
        Matcher words = WORD.matcher(candidate);
        while (words.find()) {
            if (!ArithmeticEvaluator.FUNCTIONS.contains(words.group())) {
                return null;
            }
        }
        return candidate;
    }

    static boolean isSmallTalk(String lower) {
        String normalized = lower.replaceAll("[^a-z' ]", " ").replaceAll("\\s+", " ").trim();
        return !normalized.isEmpty() && SMALL_TALK.matcher(normalized).matches();
    }
}
