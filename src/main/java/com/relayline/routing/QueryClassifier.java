package com.relayline.routing;

import com.relayline.model.QueryType;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword-based intent detector. Time-sensitive keywords win over app-data keywords;
 * anything else is general. A keyword matches at the start of a word, so "updates" counts
 * for "update" while "know" does not count for "now".
 */
public class QueryClassifier {

    public static final List<String> DEFAULT_TIME_SENSITIVE_KEYWORDS = List.of(
            "current", "latest", "today", "now", "recent", "news", "update");

    public static final List<String> DEFAULT_APP_DATA_KEYWORDS = List.of(
            "progress", "score", "performance", "study", "grade", "accuracy", "completed");

    private final Pattern timeSensitive;
    private final Pattern appData;

    public QueryClassifier() {
        this(DEFAULT_TIME_SENSITIVE_KEYWORDS, DEFAULT_APP_DATA_KEYWORDS);
    }

    public QueryClassifier(List<String> timeSensitiveKeywords, List<String> appDataKeywords) {
        this.timeSensitive = compile(timeSensitiveKeywords);
        this.appData = compile(appDataKeywords);
    }

    public QueryType classify(String message) {
        if (message == null || message.isBlank()) {
            return QueryType.GENERAL;
        }
        if (timeSensitive != null && timeSensitive.matcher(message).find()) {
            return QueryType.TIME_SENSITIVE;
        }
        if (appData != null && appData.matcher(message).find()) {
            return QueryType.APP_DATA;
        }
        return QueryType.GENERAL;
    }

    private static Pattern compile(List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return null;
        }
        String alternation = keywords.stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .map(keyword -> Pattern.quote(keyword.trim().toLowerCase(Locale.ROOT)))
                .collect(Collectors.joining("|"));
        if (alternation.isEmpty()) {
            return null;
        }
        return Pattern.compile("\\b(?:" + alternation + ")", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
