package com.ryuqq.devloop.core.finding;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 연기 사유 텍스트를 고정된 범주로 분류.
 *
 * <p><strong>판정 순서:</strong></p>
 * <ol>
 *   <li>심각도 축소 표현이 있으면 다른 사유와 무관하게 SEVERITY_MINIMIZING</li>
 *   <li>유효 범주 키워드가 있으면 해당 범주</li>
 *   <li>"동작한다" 표현이면 WORKS_AS_IS</li>
 *   <li>"나중에" 표현이면 DEFER_WITHOUT_REASON</li>
 *   <li>그 외 UNRECOGNIZED</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DeferralJustifications {

    private record Rule(JustificationCategory category, List<Pattern> patterns) {

        boolean matches(String text) {
            for (Pattern pattern : patterns) {
                if (pattern.matcher(text).find()) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final List<Rule> RULES = List.of(
        rule(JustificationCategory.SEVERITY_MINIMIZING,
            "minor", "just a nit", "nit", "nitpick", "not a big deal", "trivial", "cosmetic",
            "low impact", "unlikely to matter", "harmless"),
        rule(JustificationCategory.OUT_OF_SCOPE_FILES,
            "out of scope", "out-of-scope", "outside the scope", "outside this change",
            "files outside", "not part of this change", "another module", "other module"),
        rule(JustificationCategory.NEEDS_OWN_DESIGN_CYCLE,
            "own design", "separate design", "design cycle", "testing cycle", "own testing",
            "dedicated design", "needs an adr", "requires a design"),
        rule(JustificationCategory.CROSS_COMPONENT_COORDINATION,
            "cross-component", "cross component", "coordination with", "coordinate with",
            "coordination across", "multiple services", "other teams"),
        rule(JustificationCategory.WORKS_AS_IS,
            "works as-is", "works as is", "works fine", "it works", "already works", "good enough"),
        rule(JustificationCategory.DEFER_WITHOUT_REASON,
            "later", "follow-up", "followup", "next time", "eventually", "todo", "someday")
    );

    private DeferralJustifications() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 연기 사유 분류.
     *
     * @param justification 사유 텍스트 (null 허용)
     * @return 분류 결과
     */
    public static JustificationCategory classify(String justification) {
        if (justification == null || justification.isBlank()) {
            return JustificationCategory.UNRECOGNIZED;
        }
        String text = justification.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.matches(text)) {
                return rule.category();
            }
        }
        return JustificationCategory.UNRECOGNIZED;
    }

    public static boolean isValid(String justification) {
        return classify(justification).isValid();
    }

    private static Rule rule(JustificationCategory category, String... keywords) {
        List<Pattern> patterns = Arrays.stream(keywords)
            .map(keyword -> Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b"))
            .toList();
        return new Rule(category, patterns);
    }
}
