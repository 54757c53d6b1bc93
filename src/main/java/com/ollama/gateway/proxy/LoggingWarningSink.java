package com.ollama.gateway.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 把警告写入日志
 */
@Component
public class LoggingWarningSink implements WarningSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingWarningSink.class);

    @Override
    public void warn(String message) {
        log.warn(message);
    }
}
