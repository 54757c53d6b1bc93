package com.ollama.gateway.service;

import com.ollama.gateway.dto.genai.GenerateContentResponse;
import com.ollama.gateway.proxy.ChatResponseStream;
import com.ollama.gateway.translator.ResponseTranslator;

import java.io.Closeable;
import java.util.Iterator;

/**
 * 流式生成结果，每条下游记录独立转换
 * <p>
 * 不跨记录合并文本，也不做聚合；close() 取消下游请求。
 */
public class GenerateContentStream implements Iterator<GenerateContentResponse>, Closeable {

    private final ChatResponseStream source;
    private final ResponseTranslator translator;
    private int count = 0;

    public GenerateContentStream(ChatResponseStream source, ResponseTranslator translator) {
        this.source = source;
        this.translator = translator;
    }

    @Override
    public boolean hasNext() {
        return source.hasNext();
    }

    @Override
    public GenerateContentResponse next() {
        GenerateContentResponse response = translator.translate(source.next());
        count++;
        return response;
    }

    /**
     * 已产出的响应条数
     */
    public int count() {
        return count;
    }

    @Override
    public void close() {
        source.close();
    }
}
