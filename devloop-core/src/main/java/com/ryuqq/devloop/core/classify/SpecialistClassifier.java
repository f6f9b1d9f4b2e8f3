package com.ryuqq.devloop.core.classify;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 작업 설명을 specialist 라벨로 분류하는 키워드 테이블.
 *
 * <p><strong>선택 규칙 (가장 구체적인 일치가 우선):</strong></p>
 * <ol>
 *   <li>라벨별로 일치한 가장 긴 키워드 구문의 단어 수</li>
 *   <li>같으면 그 구문의 글자 수</li>
 *   <li>같으면 일치한 키워드 개수</li>
 *   <li>그래도 같으면 AMBIGUOUS</li>
 * </ol>
 *
 * <p>부작용 없는 순수 함수이며 스레드 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SpecialistClassifier {

    private record Keyword(String phrase, Pattern pattern, int words) {
    }

    private record Score(String label, int words, int length, int matches) {
    }

    private static final Comparator<Score> MOST_SPECIFIC = Comparator
        .comparingInt(Score::words)
        .thenComparingInt(Score::length)
        .thenComparingInt(Score::matches);

    private final Map<String, List<Keyword>> table;

    /**
     * Constructor.
     *
     * @param keywordTable 라벨 → 키워드 구문 목록
     */
    public SpecialistClassifier(Map<String, List<String>> keywordTable) {
        if (keywordTable == null || keywordTable.isEmpty()) {
            throw new IllegalArgumentException("keywordTable cannot be null or empty");
        }
        Map<String, List<Keyword>> compiled = new LinkedHashMap<>();
        keywordTable.forEach((label, phrases) -> {
            if (label == null || label.isBlank()) {
                throw new IllegalArgumentException("label cannot be null or blank");
            }
            compiled.put(label, phrases.stream().map(SpecialistClassifier::keyword).toList());
        });
        this.table = Map.copyOf(compiled);
    }

    /**
     * 기본 키워드 테이블로 생성.
     *
     * @return 분류기
     */
    public static SpecialistClassifier withDefaults() {
        Map<String, List<String>> defaults = new LinkedHashMap<>();
        defaults.put("auth-controller", List.of(
            "auth", "authentication", "jwt", "token", "oauth", "login", "jwks", "signing key", "key rotation"));
        defaults.put("global-controller", List.of(
            "global controller", "routing", "rate limiting", "rate limit", "meeting assignment", "region"));
        defaults.put("meeting-controller", List.of(
            "meeting controller", "meeting", "participant", "session join", "signaling"));
        defaults.put("media-handler", List.of(
            "media", "media handler", "webrtc", "audio", "video", "codec", "stream forwarding"));
        defaults.put("database", List.of(
            "database", "migration", "schema", "sql", "query", "index", "repository"));
        defaults.put("protocol", List.of(
            "protocol", "protobuf", "proto", "wire format", "message schema", "api contract"));
        defaults.put("infrastructure", List.of(
            "infrastructure", "kubernetes", "helm", "docker", "deployment", "terraform", "ci pipeline"));
        defaults.put("observability", List.of(
            "observability", "metrics", "tracing", "logging", "dashboard", "alert"));
        defaults.put("test", List.of(
            "test coverage", "integration test", "chaos test", "fuzz", "test harness", "flaky test"));
        return new SpecialistClassifier(defaults);
    }

    /**
     * 작업 설명 분류.
     *
     * @param task 작업 설명
     * @return 분류 결과
     */
    public Classification classify(String task) {
        if (task == null || task.isBlank()) {
            return Classification.unmatched();
        }
        String text = task.toLowerCase(Locale.ROOT);

        List<Score> scores = new ArrayList<>();
        table.forEach((label, keywords) -> {
            Score score = score(label, keywords, text);
            if (score != null) {
                scores.add(score);
            }
        });
        if (scores.isEmpty()) {
            return Classification.unmatched();
        }

        Score best = scores.stream().max(MOST_SPECIFIC).orElseThrow();
        List<String> tied = scores.stream()
            .filter(score -> MOST_SPECIFIC.compare(score, best) == 0)
            .map(Score::label)
            .sorted()
            .toList();
        return tied.size() == 1 ? Classification.matched(best.label()) : Classification.ambiguous(tied);
    }

    public boolean knows(String label) {
        return table.containsKey(label);
    }

    private static Score score(String label, List<Keyword> keywords, String text) {
        Keyword longest = null;
        int matches = 0;
        for (Keyword keyword : keywords) {
            if (keyword.pattern().matcher(text).find()) {
                matches++;
                if (longest == null
                    || keyword.words() > longest.words()
                    || (keyword.words() == longest.words() && keyword.phrase().length() > longest.phrase().length())) {
                    longest = keyword;
                }
            }
        }
        if (longest == null) {
            return null;
        }
        return new Score(label, longest.words(), longest.phrase().length(), matches);
    }

    private static Keyword keyword(String phrase) {
        String normalized = phrase.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("keyword cannot be blank");
        }
        Pattern pattern = Pattern.compile("\\b" + Pattern.quote(normalized) + "\\b");
        return new Keyword(normalized, pattern, normalized.split("\\s+").length);
    }
}
