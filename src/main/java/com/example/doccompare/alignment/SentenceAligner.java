package com.example.doccompare.alignment;

import com.example.doccompare.domain.InvalidConfigurationException;
import com.example.doccompare.domain.MatchPair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Greedily pairs sentences of an authoritative source with sentences of a derived rendering.
 *
 * <p>Each source sentence, in order, takes the most similar rendered sentence not yet taken
 * (first one wins on equal scores) if that score reaches the threshold. Matched pairs are diffed
 * token by token. Source sentences without a partner become missing rows in place; rendered
 * sentences never taken are appended afterwards as extra rows, in their original order.
 *
 * <p>The aligner keeps no state between calls and may be shared by concurrent callers.
 */
public final class SentenceAligner {
    private static final Logger log = LogManager.getLogger(SentenceAligner.class);

    public static final double DEFAULT_THRESHOLD = 0.3;

    private final TokenDiffer tokenDiffer;
    private final CharacterSimilarity similarity;

    public SentenceAligner() {
        this(new TokenDiffer(), new CharacterSimilarity());
    }

    public SentenceAligner(TokenDiffer tokenDiffer, CharacterSimilarity similarity) {
        this.tokenDiffer = tokenDiffer;
        this.similarity = similarity;
    }

    public List<MatchPair> align(List<String> left, List<String> right) {
        return align(left, right, DEFAULT_THRESHOLD);
    }

    public List<MatchPair> align(List<String> left, List<String> right, double threshold) {
        validateThreshold(threshold);
        List<String> leftSentences = List.copyOf(left);
        List<String> rightSentences = List.copyOf(right);

        boolean[] consumed = new boolean[rightSentences.size()];
        List<MatchPair> rows = new ArrayList<>(leftSentences.size() + rightSentences.size());
        for (String leftSentence : leftSentences) {
            double bestScore = 0.0;
            int bestIndex = -1;
            for (int i = 0; i < rightSentences.size(); i++) {
                if (consumed[i]) {
                    continue;
                }
                double score = similarity.ratio(leftSentence, rightSentences.get(i));
                if (score > bestScore) {
                    bestScore = score;
                    bestIndex = i;
                }
            }

            if (bestIndex != -1 && bestScore >= threshold) {
                consumed[bestIndex] = true;
                TokenDiff diff = tokenDiffer.diff(leftSentence, rightSentences.get(bestIndex));
                rows.add(new MatchPair(diff.left(), diff.right(), false));
                log.debug("Matched left sentence to right #{} (score {})", bestIndex, bestScore);
            } else {
                rows.add(MatchPair.missing(leftSentence));
                log.debug("No match for left sentence (best score {})", bestScore);
            }
        }

        for (int i = 0; i < rightSentences.size(); i++) {
            if (!consumed[i]) {
                rows.add(MatchPair.extra(rightSentences.get(i)));
            }
        }
        return Collections.unmodifiableList(rows);
    }

    public static void validateThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new InvalidConfigurationException(
                    "Match threshold must be between 0.0 and 1.0 but was " + threshold);
        }
    }
}
