package com.ollama.gateway.proxy;

import java.time.Instant;
import java.util.List;

/**
 * 连通性检查结果
 *
 * @param status          检查状态
 * @param availableModels Ollama 上已有的模型
 * @param message         说明，成功时为空
 * @param checkedAt       检查完成时间，未完成时为空
 */
public record ConnectivityReport(Status status, List<String> availableModels, String message, Instant checkedAt) {

    public enum Status {
        PENDING,
        OK,
        MODEL_MISSING,
        UNREACHABLE
    }

    public static final ConnectivityReport PENDING = new ConnectivityReport(Status.PENDING, List.of(), null, null);

    public ConnectivityReport {
        availableModels = availableModels != null ? List.copyOf(availableModels) : List.of();
    }

    public boolean isHealthy() {
        return status == Status.OK;
    }
}
