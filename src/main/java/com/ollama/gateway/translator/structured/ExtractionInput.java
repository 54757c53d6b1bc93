package com.ollama.gateway.translator.structured;

/**
 * 抽取策略的输入
 *
 * @param rawText     模型原始输出，未做任何清理
 * @param workingText 去掉思考块和代码围栏后的文本
 */
public record ExtractionInput(String rawText, String workingText) {
}
