package com.luashroud.pipeline.config;

/**
 * 配置无效：未知的步骤或设置、类型不符、越界
 */
public class SettingsException extends RuntimeException {

    public SettingsException(String message) {
        super(message);
    }

    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
