package io.github.samzhu.router.util;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 請求內容解析工具
 *
 * <p>從 chat completion 格式的 payload 取出路由需要的資訊：
 * <ul>
 *   <li>最後一則 {@code user} 訊息（分類與 Session 相似度使用）</li>
 *   <li>概估 Token 數：所有訊息內容字元數 / 4</li>
 *   <li>成本單位：{@code cost_units}，預設 1，無條件進位且至少為 1</li>
 * </ul>
 *
 * <p>訊息內容可為字串，或為包含 {@code {"type": "text", "text": "..."}} 區塊的陣列；
 * 陣列中的非文字區塊（圖片等）不計入字元數。
 */
public final class PromptExtractor {

    private static final int CHARS_PER_TOKEN = 4;

    private PromptExtractor() {
    }

    /**
     * 是否包含至少一則 user 訊息
     */
    public static boolean hasUserMessage(JsonNode payload) {
        JsonNode messages = messages(payload);
        if (messages == null) {
            return false;
        }
        for (JsonNode message : messages) {
            if ("user".equals(message.path("role").asText())) {
                return true;
            }
        }
        return false;
    }

    /**
     * 最後一則 user 訊息的文字內容，不存在時為空字串
     */
    public static String lastUserPrompt(JsonNode payload) {
        JsonNode messages = messages(payload);
        if (messages == null) {
            return "";
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            JsonNode message = messages.get(i);
            if ("user".equals(message.path("role").asText())) {
                return contentText(message.path("content"));
            }
        }
        return "";
    }

    /**
     * 概估 Token 數
     */
    public static int approxTokens(JsonNode payload) {
        JsonNode messages = messages(payload);
        if (messages == null) {
            return 0;
        }
        long chars = 0;
        for (JsonNode message : messages) {
            chars += contentText(message.path("content")).length();
        }
        return (int) Math.min(Integer.MAX_VALUE, chars / CHARS_PER_TOKEN);
    }

    /**
     * 呼叫端提供的輸入 Token 數（{@code tokens_input}），未提供時回傳概估值
     */
    public static int tokensInput(JsonNode payload) {
        JsonNode declared = payload == null ? null : payload.get("tokens_input");
        if (declared != null && declared.canConvertToInt() && declared.asInt() >= 0) {
            return declared.asInt();
        }
        return approxTokens(payload);
    }

    /**
     * 本次請求消耗的成本單位
     */
    public static int costUnits(JsonNode payload) {
        JsonNode declared = payload == null ? null : payload.get("cost_units");
        if (declared == null || !declared.isNumber()) {
            return 1;
        }
        double value = Math.ceil(declared.asDouble());
        if (value < 1) {
            return 1;
        }
        return value >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) value;
    }

    private static JsonNode messages(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        JsonNode messages = payload.get("messages");
        return messages != null && messages.isArray() ? messages : null;
    }

    private static String contentText(JsonNode content) {
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            StringBuilder text = new StringBuilder();
            for (JsonNode part : content) {
                String value = part.path("text").asText("");
                if (StringUtils.isNotEmpty(value)) {
                    if (!text.isEmpty()) {
                        text.append(' ');
                    }
                    text.append(value);
                }
            }
            return text.toString();
        }
        return "";
    }
}
