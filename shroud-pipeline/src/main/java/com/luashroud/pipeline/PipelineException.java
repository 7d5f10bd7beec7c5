package com.luashroud.pipeline;

/**
 * 步骤执行失败，带上失败的步骤名
 */
public class PipelineException extends RuntimeException {

    private final String stepName;

    public PipelineException(String stepName, Throwable cause) {
        super("step '" + stepName + "' failed: " + cause.getMessage(), cause);
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }
}
