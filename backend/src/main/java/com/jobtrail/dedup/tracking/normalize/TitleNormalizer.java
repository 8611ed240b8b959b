package com.jobtrail.dedup.tracking.normalize;

import com.jobtrail.dedup.tracking.model.SeniorityLevel;
import com.jobtrail.dedup.tracking.model.TitleKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Case-folds titles and strips posting noise. Seniority words are never removed from the
 * normalized title; {@link #key(String)} only separates them for comparison.
 */
public final class TitleNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NOISE_PARENTHETICAL = Pattern.compile(
        "\\((?:remote|hybrid|on-?site|in[- ]office|m/f/d|f/m/d|m/w/d|w/m/d|all genders|"
            + "full[- ]time|part[- ]time|contract|temporary|temp|urgent)[^)]*\\)"
    );
    private static final Pattern NOISE_SUFFIX = Pattern.compile(
        "\\s*[-\\u2013\\u2014|:,]\\s*(?:remote|hybrid|on-?site|work from home|wfh|full[- ]time|part[- ]time|"
            + "urgent(?:ly hiring)?|immediate start|(?:job|req|requisition)\\s*(?:id)?\\s*#?\\s*[\\w-]+)\\s*$"
    );
    private static final Pattern NOISE_PREFIX = Pattern.compile(
        "^(?:urgent(?:ly)?(?: hiring)?|now hiring|hiring|we are hiring)\\s*[:!\\-\\u2013\\u2014]+\\s*"
    );
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s\\-\\u2013\\u2014|:,;.!*]+$");
    private static final Pattern REPEATED_BANG = Pattern.compile("!+");

    private static final Map<String, SeniorityLevel> SENIORITY_TOKENS = Map.ofEntries(
        Map.entry("senior", SeniorityLevel.SENIOR),
        Map.entry("sr", SeniorityLevel.SENIOR),
        Map.entry("snr", SeniorityLevel.SENIOR),
        Map.entry("junior", SeniorityLevel.JUNIOR),
        Map.entry("jr", SeniorityLevel.JUNIOR),
        Map.entry("staff", SeniorityLevel.STAFF),
        Map.entry("lead", SeniorityLevel.LEAD),
        Map.entry("principal", SeniorityLevel.PRINCIPAL)
    );
    private static final Map<String, SeniorityLevel> GRADE_TOKENS = Map.of(
        "i", SeniorityLevel.GRADE_1,
        "1", SeniorityLevel.GRADE_1,
        "ii", SeniorityLevel.GRADE_2,
        "2", SeniorityLevel.GRADE_2,
        "iii", SeniorityLevel.GRADE_3,
        "3", SeniorityLevel.GRADE_3,
        "iv", SeniorityLevel.GRADE_4,
        "4", SeniorityLevel.GRADE_4
    );
    private static final Set<String> EXECUTIVE_WORDS = Set.of("manager", "director", "head", "chief", "vp");
    private static final Set<String> ENTRY_WORDS = Set.of("entry", "associate", "intern", "graduate", "trainee");
    public static final String DEFAULT_CATEGORY = "Other";
    // first keyword that prefixes a title token wins, so order is significant
    private static final List<Map.Entry<String, String>> CATEGORY_KEYWORDS = List.of(
        Map.entry("software", "Software Engineering"),
        Map.entry("developer", "Software Engineering"),
        Map.entry("engineer", "Engineering"),
        Map.entry("data", "Data Science"),
        Map.entry("analyst", "Data Analysis"),
        Map.entry("marketing", "Marketing"),
        Map.entry("sales", "Sales"),
        Map.entry("manager", "Management"),
        Map.entry("designer", "Design"),
        Map.entry("product", "Product Management"),
        Map.entry("devops", "DevOps"),
        Map.entry("qa", "Quality Assurance"),
        Map.entry("hr", "Human Resources"),
        Map.entry("finance", "Finance"),
        Map.entry("accounting", "Finance")
    );

    private TitleNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String value = collapse(raw.replace('\u00A0', ' ').toLowerCase(Locale.ROOT));
        value = REPEATED_BANG.matcher(value).replaceAll(" ");
        value = NOISE_PREFIX.matcher(value).replaceAll("");
        value = NOISE_PARENTHETICAL.matcher(value).replaceAll(" ");
        String previous;
        do {
            previous = value;
            value = NOISE_SUFFIX.matcher(value).replaceAll("");
        } while (!value.equals(previous));
        value = TRAILING_PUNCTUATION.matcher(collapse(value)).replaceAll("");
        return collapse(value);
    }

    public static TitleKey key(String normalizedTitle) {
        String normalized = normalizedTitle == null ? "" : normalizedTitle;
        List<String> tokens = new ArrayList<>();
        for (String token : WHITESPACE.split(normalized)) {
            String cleaned = stripEdgePunctuation(token);
            if (!cleaned.isEmpty()) {
                tokens.add(cleaned);
            }
        }
        SeniorityLevel level = SeniorityLevel.NONE;
        List<String> core = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            SeniorityLevel tokenLevel = SENIORITY_TOKENS.get(token);
            if (tokenLevel == null && i == tokens.size() - 1 && tokens.size() > 1) {
                tokenLevel = GRADE_TOKENS.get(token);
            }
            if (tokenLevel != null && level == SeniorityLevel.NONE) {
                level = tokenLevel;
                continue;
            }
            if (tokenLevel != null) {
                continue;
            }
            core.add(token);
        }
        if (core.isEmpty()) {
            return new TitleKey(normalized, normalized, SeniorityLevel.NONE);
        }
        return new TitleKey(normalized, String.join(" ", core), level);
    }

    public static String experienceLevel(TitleKey key) {
        if (key == null) {
            return SeniorityLevel.NONE.experienceLevel();
        }
        if (key.level().isQualified()) {
            return key.level().experienceLevel();
        }
        for (String token : WHITESPACE.split(key.core())) {
            if (EXECUTIVE_WORDS.contains(token)) {
                return "executive";
            }
            if (ENTRY_WORDS.contains(token)) {
                return "entry";
            }
        }
        return SeniorityLevel.NONE.experienceLevel();
    }

    public static String category(TitleKey key) {
        if (key == null || key.normalized().isBlank()) {
            return DEFAULT_CATEGORY;
        }
        List<String> tokens = new ArrayList<>();
        for (String token : WHITESPACE.split(key.normalized())) {
            tokens.add(stripEdgePunctuation(token));
        }
        for (Map.Entry<String, String> keyword : CATEGORY_KEYWORDS) {
            for (String token : tokens) {
                if (token.startsWith(keyword.getKey())) {
                    return keyword.getValue();
                }
            }
        }
        return DEFAULT_CATEGORY;
    }

    private static String stripEdgePunctuation(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && isEdgePunctuation(token.charAt(start))) {
            start++;
        }
        while (end > start && isEdgePunctuation(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(start, end);
    }

    private static boolean isEdgePunctuation(char c) {
        return c == '.' || c == ',' || c == '-' || c == '(' || c == ')' || c == '/' || c == ':' || c == ';';
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }
}
