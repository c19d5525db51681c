package io.github.samzhu.router.util;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

/**
 * Prompt 相似度（Jaccard）
 *
 * <p>以空白切分、轉小寫後的 token 集合計算：{@code |A ∩ B| / |A ∪ B|}。
 * 任一方為空時相似度為 0。
 */
public final class PromptSimilarity {

    private PromptSimilarity() {
    }

    public static double jaccard(String first, String second) {
        if (StringUtils.isBlank(first) || StringUtils.isBlank(second)) {
            return 0.0;
        }
        Set<String> a = tokens(first);
        Set<String> b = tokens(second);

        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);

        return (double) intersection.size() / union.size();
    }

    private static Set<String> tokens(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).trim().split("\\s+"))
            .filter(StringUtils::isNotEmpty)
            .collect(Collectors.toSet());
    }
}
