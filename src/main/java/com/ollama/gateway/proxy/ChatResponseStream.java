package com.ollama.gateway.proxy;

import com.ollama.gateway.dto.ollama.OllamaChatResponse;
import com.ollama.gateway.exception.OllamaApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ollama 流式响应迭代器
 * <p>
 * 按需拉取：只有消费者要下一条且缓冲为空时才读一次网络，不会提前读。
 * close() 会关闭响应体以中止 HTTP 请求，之后不再产出任何记录。
 * 每次调用独立创建，不可复用。
 */
public class ChatResponseStream implements Iterator<OllamaChatResponse>, Closeable {

    private static final Logger log = LoggerFactory.getLogger(ChatResponseStream.class);

    private static final int READ_SIZE = 8192;

    private final InputStream body;
    private final NdjsonStreamDecoder<OllamaChatResponse> decoder =
            new NdjsonStreamDecoder<>(OllamaChatResponse::fromJson);
    private final Deque<OllamaChatResponse> pending = new ArrayDeque<>();
    private final byte[] readBuffer = new byte[READ_SIZE];
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private boolean exhausted = false;

    public ChatResponseStream(InputStream body) {
        this.body = body;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && !exhausted && !closed.get()) {
            readChunk();
        }
        return !closed.get() && !pending.isEmpty();
    }

    @Override
    public OllamaChatResponse next() {
        if (!hasNext()) {
            throw new NoSuchElementException("流式响应已结束");
        }
        return pending.poll();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 取消：关闭响应体，阻塞中的读取会以异常返回
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            body.close();
        } catch (IOException e) {
            log.debug("关闭流式响应体失败: {}", e.getMessage());
        }
    }

    private void readChunk() {
        int len;
        try {
            len = body.read(readBuffer);
        } catch (IOException e) {
            exhausted = true;
            if (closed.get()) {
                // 已被取消，读取异常是预期的
                return;
            }
            close();
            throw new OllamaApiException("chat", 502, "读取流式响应失败: " + e.getMessage(), e);
        }

        if (len == -1) {
            decoder.finish();
            exhausted = true;
            try {
                body.close();
            } catch (IOException e) {
                log.debug("关闭流式响应体失败: {}", e.getMessage());
            }
            return;
        }
        pending.addAll(decoder.feed(readBuffer, len));
    }
}
