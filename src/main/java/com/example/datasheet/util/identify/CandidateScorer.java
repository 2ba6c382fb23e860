package com.example.datasheet.util.identify;

import com.example.datasheet.util.document.DocumentBits;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于词频和位置的候选打分
 *
 * score = 出现次数 + 5（出现在标题中） + 3（出现在标题行中）
 * 按分数降序；同分按 token 字典序降序，保证结果确定。
 */
public class CandidateScorer {

    public static final int TITLE_BONUS = 5;
    public static final int HEADING_BONUS = 3;

    private final TokenClassifier classifier;

    public CandidateScorer(TokenClassifier classifier) {
        this.classifier = classifier;
    }

    public List<String> rank(DocumentBits bits) {
        List<String> pool = classifier.acceptedTokens(bits.scoringText());
        if (pool.isEmpty()) {
            return new ArrayList<>();
        }

        Map<String, Integer> freq = new LinkedHashMap<>();
        for (String tok : pool) {
            freq.merge(tok, 1, Integer::sum);
        }

        String title = bits.getTitle();
        String headings = bits.joinedHeadings();

        List<ScoredToken> scored = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : freq.entrySet()) {
            String tok = entry.getKey();
            int score = entry.getValue();
            if (title.contains(tok)) {
                score += TITLE_BONUS;
            }
            if (headings.contains(tok)) {
                score += HEADING_BONUS;
            }
            scored.add(new ScoredToken(tok, score));
        }

        scored.sort(Comparator.comparingInt(ScoredToken::getScore)
                .thenComparing(ScoredToken::getToken)
                .reversed());

        List<String> ranked = new ArrayList<>(scored.size());
        for (ScoredToken st : scored) {
            ranked.add(st.getToken());
        }
        return ranked;
    }

    /** 带分数的 token */
    static final class ScoredToken {
        private final String token;
        private final int score;

        ScoredToken(String token, int score) {
            this.token = token;
            this.score = score;
        }

        String getToken() { return token; }
        int getScore() { return score; }
    }
}
