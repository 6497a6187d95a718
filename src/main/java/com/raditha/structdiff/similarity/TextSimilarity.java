package com.raditha.structdiff.similarity;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual overlap of two source fragments.
 * Splits both fragments into word and punctuation tokens, diffs the token lists
 * with java-diff-utils and reports {@code 2 * matched / (|a| + |b|)}.
 */
public class TextSimilarity {

    private static final Pattern TOKEN = Pattern.compile("\\w+|[^\\s\\w]");

    /**
     * Calculate textual similarity of two fragments.
     *
     * @return Similarity score (0.0 to 1.0)
     */
    public double calculate(String text1, String text2) {
        if (text1 == null || text2 == null) {
            return 0.0;
        }
        return calculate(tokenize(text1), tokenize(text2));
    }

    /**
     * Calculate similarity of two token lists.
     */
    public double calculate(List<String> tokens1, List<String> tokens2) {
        if (tokens1.isEmpty() && tokens2.isEmpty()) {
            return 1.0;
        }

        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        if (tokens1.equals(tokens2)) {
            return 1.0;
        }

        Patch<String> patch = DiffUtils.diff(tokens1, tokens2);
        int changedSource = 0;
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            changedSource += delta.getSource().size();
        }
        int matched = tokens1.size() - changedSource;

        return (2.0 * matched) / (tokens1.size() + tokens2.size());
    }

    /**
     * Split source text into identifier/number tokens and single punctuation characters.
     * Whitespace is dropped, so formatting alone never changes the score.
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
