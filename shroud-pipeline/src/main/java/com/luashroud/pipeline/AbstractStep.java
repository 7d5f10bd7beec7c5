package com.luashroud.pipeline;

import com.luashroud.pipeline.config.StepSettings;

/**
 * 带已解析设置的步骤基类
 */
public abstract class AbstractStep implements Step {

    protected final StepSettings settings;

    protected AbstractStep(StepSettings settings) {
        this.settings = settings;
    }

    public StepSettings getSettings() {
        return settings;
    }

    @Override
    public String toString() {
        return getName() + settings;
    }
}
