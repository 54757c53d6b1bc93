package com.ollama.gateway.translator.structured;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 清理模型输出中的思考块与 markdown 代码围栏
 * <p>
 * 本地模型常把推理过程包在 &lt;think&gt; 标签里混进正文
 */
public final class ThinkTagCleaner {

    private static final Pattern THINK_BLOCK = Pattern.compile("<think>[\\s\\S]*?</think>", Pattern.CASE_INSENSITIVE);
    private static final Pattern THINK_END = Pattern.compile("</think>", Pattern.CASE_INSENSITIVE);
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)\\s*```");

    private ThinkTagCleaner() {
    }

    /**
     * 依次去掉思考块、取最后一个结束标签之后的内容、拆掉代码围栏
     */
    public static String prepare(String rawText) {
        String working = stripThinkBlocks(rawText);
        String afterThink = afterLastThinkEnd(rawText);
        if (afterThink != null) {
            working = afterThink;
        }
        return unwrapCodeFence(working);
    }

    /**
     * 反复删除成对的思考块，直到文本不再变化
     */
    public static String stripThinkBlocks(String text) {
        String current = text.trim();
        while (true) {
            String next = THINK_BLOCK.matcher(current).replaceAll("").trim();
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }

    /**
     * 最后一个 &lt;/think&gt; 之后的非空内容；没有结束标签或其后为空时返回 null
     */
    public static String afterLastThinkEnd(String text) {
        Matcher matcher = THINK_END.matcher(text);
        int lastEnd = -1;
        while (matcher.find()) {
            lastEnd = matcher.end();
        }
        if (lastEnd < 0) {
            return null;
        }
        String after = text.substring(lastEnd).trim();
        return after.isEmpty() ? null : after;
    }

    /**
     * 只拆第一个代码围栏
     */
    public static String unwrapCodeFence(String text) {
        Matcher matcher = CODE_FENCE.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return text;
    }
}
