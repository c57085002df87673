package io.lunahistory.core.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds FTS5 MATCH expressions from caller keywords.
 */
public final class FullTextQuery {

    private FullTextQuery() {
    }

    /**
     * Joins the non-blank keywords with {@code OR}. A keyword of several words matches entries
     * containing all of them, in any order and position. Every word is quoted as an FTS5 string,
     * so characters such as {@code -}, {@code :} or {@code *} are matched as text instead of being
     * read as query syntax.
     *
     * @return empty when no keyword has any content
     */
    public static Optional<String> anyOf(List<String> keywords) {
        if (keywords == null) {
            return Optional.empty();
        }
        List<String> terms = new ArrayList<>();
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            terms.add(allOf(keyword.trim().split("\\s+")));
        }
        if (terms.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join(" OR ", terms));
    }

    private static String allOf(String[] words) {
        if (words.length == 1) {
            return quote(words[0]);
        }
        List<String> quoted = new ArrayList<>(words.length);
        for (String word : words) {
            quoted.add(quote(word));
        }
        return "(" + String.join(" AND ", quoted) + ")";
    }

    private static String quote(String word) {
        return "\"" + word.replace("\"", "\"\"") + "\"";
    }
}
