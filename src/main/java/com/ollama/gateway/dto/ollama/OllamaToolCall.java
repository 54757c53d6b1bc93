package com.ollama.gateway.dto.ollama;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;

/**
 * Ollama 工具调用
 * <p>
 * arguments 始终是合法 JSON 文本，缺省为 "{}"
 *
 * @param type      固定为 function
 * @param name      函数名
 * @param arguments JSON 编码的参数
 */
public record OllamaToolCall(String type, String name, String arguments) {

    public static final String TYPE_FUNCTION = "function";

    public OllamaToolCall {
        type = type != null ? type : TYPE_FUNCTION;
        arguments = arguments != null && !arguments.isBlank() ? arguments : "{}";
    }

    public static OllamaToolCall function(String name, String arguments) {
        return new OllamaToolCall(TYPE_FUNCTION, name, arguments);
    }

    public boolean isFunction() {
        return TYPE_FUNCTION.equals(type);
    }

    public JSONObject toJson() {
        return JSONObject.of(
                "type", type, //
                "function", JSONObject.of("name", name, "arguments", arguments) //
        );
    }

    /**
     * Ollama 原生返回的 arguments 是对象，兼容字符串与对象两种写法
     */
    public static OllamaToolCall fromJson(JSONObject json) {
        JSONObject function = json.getJSONObject("function");
        if (function == null) {
            return new OllamaToolCall(json.getString("type"), null, null);
        }
        Object rawArgs = function.get("arguments");
        String arguments;
        if (rawArgs == null) {
            arguments = null;
        } else if (rawArgs instanceof String s) {
            arguments = s;
        } else {
            arguments = JSON.toJSONString(rawArgs);
        }
        return new OllamaToolCall(json.getString("type"), function.getString("name"), arguments);
    }
}
