package com.taxdesk.engine.bookkeeping;

import java.util.regex.Pattern;

/**
 * Description-matching rule. The pattern is searched (not fully matched) against the raw description.
 */
public record ClassificationRule(Pattern matcher, String category, String subcategory) {

    public static ClassificationRule caseInsensitive(String regex, String category, String subcategory) {
        return new ClassificationRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), category, subcategory);
    }

    public boolean matches(String description) {
        return description != null && matcher.matcher(description).find();
    }
}
