package io.vaultflow.approval;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a task body asks for something that needs human sign-off.
 */
public final class ApprovalKeywordMatcher {
    private final List<String> keywords;
    private final List<Pattern> patterns;

    public ApprovalKeywordMatcher(List<String> keywords) {
        this.keywords = List.copyOf(keywords);
        List<Pattern> compiled = new ArrayList<>();
        for (String keyword : this.keywords) {
            compiled.add(Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE));
        }
        this.patterns = List.copyOf(compiled);
    }

    public List<String> matched(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i).matcher(body).find()) {
                out.add(keywords.get(i));
            }
        }
        return out;
    }
}
