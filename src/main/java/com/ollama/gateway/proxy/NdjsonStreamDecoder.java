package com.ollama.gateway.proxy;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.ollama.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * NDJSON 流解析器
 * <p>
 * Ollama 流式响应每行一个完整 JSON 对象，没有外层包装也没有长度前缀：
 * - 按字节缓冲，遇到换行切出一行（UTF-8 多字节字符不会包含 0x0A，按字节切分是安全的）
 * - 最后一段可能是半行，留在缓冲区等待后续数据
 * - 单行解析失败只记录并跳过，不影响前后行
 * - 流结束时残留的半行直接丢弃
 *
 * @param <T> 每行映射出的记录类型
 */
public class NdjsonStreamDecoder<T> {

    private static final Logger log = LoggerFactory.getLogger(NdjsonStreamDecoder.class);

    private static final byte NEWLINE = '\n';

    private final Function<JSONObject, T> mapper;
    private ByteBuffer buffer = ByteBuffer.allocate(0);

    public NdjsonStreamDecoder(Function<JSONObject, T> mapper) {
        this.mapper = mapper;
    }

    /**
     * 向缓冲区添加数据，返回本次新解析出的完整记录
     */
    public List<T> feed(byte[] data) {
        return feed(data, data.length);
    }

    public List<T> feed(byte[] data, int length) {
        // 合并旧缓冲区和新数据
        byte[] combined = new byte[buffer.remaining() + length];
        int previous = buffer.remaining();
        buffer.get(combined, 0, previous);
        System.arraycopy(data, 0, combined, previous, length);
        buffer = ByteBuffer.wrap(combined);

        return parseLines();
    }

    /**
     * 流结束：残留的半行不再解析
     */
    public void finish() {
        if (buffer.hasRemaining()) {
            String leftover = new String(buffer.array(), buffer.position(), buffer.remaining(), StandardCharsets.UTF_8);
            if (!leftover.isBlank()) {
                log.debug("流结束时丢弃不完整的行: {} 字节", buffer.remaining());
            }
        }
        buffer = ByteBuffer.allocate(0);
    }

    private List<T> parseLines() {
        List<T> records = new ArrayList<>();
        byte[] array = buffer.array();
        int lineStart = buffer.position();

        for (int i = lineStart; i < buffer.limit(); i++) {
            if (array[i] != NEWLINE) {
                continue;
            }
            String line = new String(array, lineStart, i - lineStart, StandardCharsets.UTF_8);
            lineStart = i + 1;
            if (line.isBlank()) {
                continue;
            }
            T record = decodeLine(line);
            if (record != null) {
                records.add(record);
            }
        }

        // 压缩剩余数据
        byte[] remaining = new byte[buffer.limit() - lineStart];
        System.arraycopy(array, lineStart, remaining, 0, remaining.length);
        buffer = ByteBuffer.wrap(remaining);
        return records;
    }

    private T decodeLine(String line) {
        try {
            JSONObject json = JSON.parseObject(line);
            if (json == null) {
                return null;
            }
            return mapper.apply(json);
        } catch (Exception e) {
            log.warn("解析 Ollama 流式响应行失败, 已跳过: {} ({})", line, e.getMessage());
            Metrics.instance().increment("stream_decode_errors_total");
            return null;
        }
    }
}
