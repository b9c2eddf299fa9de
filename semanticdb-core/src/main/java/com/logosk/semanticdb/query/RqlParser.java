package com.logosk.semanticdb.query;

import com.google.common.base.Splitter;
import com.logosk.semanticdb.exceptions.MissingParameterException;
import com.logosk.semanticdb.exceptions.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for the Resonance Query Language.
 * <pre>
 *   (Φ :intention "find comfort" :context "fear")
 *   (QUERY :from A :to C :max_length 4 :min_coherence 0.6)
 *   (EXPLORE :entity love :depth 2)
 *   (CONTEXT :keyword love)
 * </pre>
 * Values are bare tokens or single/double quoted strings without escapes. A key that is
 * not followed by a value is read as the flag {@code true}.
 */
public class RqlParser {

    static final String FLAG = "true";
    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private record Token(String text, boolean quoted) {
        boolean isKey() {
            return !quoted && text.startsWith(":") && text.length() > 1;
        }
    }

    public RqlQuery parse(String text) {
        if (text == null) {
            throw new ValidationException("RQL query must not be null");
        }
        String trimmed = text.strip();
        if (!trimmed.startsWith("(") || !trimmed.endsWith(")")) {
            throw new ValidationException("RQL query must be wrapped in parentheses: (Φ ...)");
        }
        List<Token> tokens = tokenize(trimmed.substring(1, trimmed.length() - 1));
        if (tokens.isEmpty()) {
            throw new ValidationException("Empty RQL query");
        }

        QueryType type = QueryType.fromKeyword(tokens.get(0).text());
        Map<String, String> params = parameters(tokens.subList(1, tokens.size()));

        return switch (type) {
            case PHI -> new RqlQuery.PhiQuery(
                    first(params, "intention", "намерение"),
                    first(params, "context", "контекст"),
                    list(first(params, "blind_spots", "слепые_пятна")),
                    list(params.get("phi_meta")));
            case PATH -> new RqlQuery.PathQuery(
                    require(params, type, "from"),
                    require(params, type, "to"),
                    positiveInt(params, RqlQuery.PathQuery.DEFAULT_MAX_LENGTH, "max_length", "depth"),
                    number(params, "min_coherence", RqlQuery.PathQuery.DEFAULT_MIN_COHERENCE));
            case EXPLORE -> new RqlQuery.ExploreQuery(
                    require(params, type, "entity"),
                    positiveInt(params, RqlQuery.ExploreQuery.DEFAULT_DEPTH, "depth", "max_length"));
            case CONTEXT -> new RqlQuery.ContextQuery(first(params, "keyword", "context", "контекст"));
        };
    }

    private static List<Token> tokenize(String inner) {
        List<Token> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    tokens.add(new Token(current.toString(), true));
                    current.setLength(0);
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if ((c == '"' || c == '\'') && current.length() == 0) {
                quote = c;
            } else if (Character.isWhitespace(c)) {
                if (current.length() > 0) {
                    tokens.add(new Token(current.toString(), false));
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (quote != 0) {
            throw new ValidationException("Unterminated quoted value in RQL query");
        }
        if (current.length() > 0) {
            tokens.add(new Token(current.toString(), false));
        }
        return tokens;
    }

    private static Map<String, String> parameters(List<Token> tokens) {
        Map<String, String> params = new LinkedHashMap<>();
        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            if (!token.isKey()) {
                i++;
                continue;
            }
            String key = token.text().substring(1);
            if (i + 1 < tokens.size() && !tokens.get(i + 1).isKey()) {
                params.put(key, tokens.get(i + 1).text());
                i += 2;
            } else {
                params.put(key, FLAG);
                i++;
            }
        }
        return params;
    }

    private static String first(Map<String, String> params, String... keys) {
        for (String key : keys) {
            String value = params.get(key);
            if (value != null) {
                return value;
            }
        }
        return "";
    }

    private static String require(Map<String, String> params, QueryType type, String key) {
        String value = params.get(key);
        if (value == null || value.isBlank()) {
            throw new MissingParameterException(type.keyword(), key);
        }
        return value;
    }

    private static List<String> list(String value) {
        return value == null || value.isEmpty() ? List.of() : LIST_SPLITTER.splitToList(value);
    }

    private static int positiveInt(Map<String, String> params, int fallback, String... keys) {
        for (String key : keys) {
            String value = params.get(key);
            if (value == null) {
                continue;
            }
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed < 1) {
                    throw new ValidationException(":" + key + " must be at least 1, was " + parsed);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new ValidationException(":" + key + " must be an integer, was '" + value + "'", e);
            }
        }
        return fallback;
    }

    private static double number(Map<String, String> params, String key, double fallback) {
        String value = params.get(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(":" + key + " must be a number, was '" + value + "'", e);
        }
    }
}
