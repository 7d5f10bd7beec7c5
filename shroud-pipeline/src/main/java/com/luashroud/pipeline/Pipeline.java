package com.luashroud.pipeline;

import com.luashroud.compiler.analysis.ScopeConsistencyChecker;
import com.luashroud.compiler.analysis.VariableRenamer;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.formatter.FormatConfig;
import com.luashroud.compiler.formatter.LuaFormatter;
import com.luashroud.compiler.parser.ParseException;
import com.luashroud.pipeline.config.PipelineConfig;
import com.luashroud.pipeline.config.SettingsException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 混淆流水线：解析 → 依次执行步骤 → 重命名 → 格式化输出
 */
public class Pipeline {

    private static final Logger LOG = Logger.getLogger(Pipeline.class.getName());

    private final PipelineConfig config;
    private final List<Step> steps = new ArrayList<>();

    /**
     * @throws SettingsException 配置中有未知的步骤或无效设置
     */
    public Pipeline(PipelineConfig config, StepRegistry registry) {
        config.validate();
        this.config = config;
        for (PipelineConfig.StepConfig step : config.getSteps()) {
            steps.add(registry.create(step.getName(), step.getSettings()));
        }
    }

    public static Pipeline fromConfig(PipelineConfig config) {
        return new Pipeline(config, StepRegistry.builtin());
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public List<Step> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    /**
     * 混淆一段源码
     *
     * @throws ParseException    输入无法解析
     * @throws PipelineException 某个步骤失败
     */
    public String apply(String source, String fileName) {
        long seed = config.getSeed() != null ? config.getSeed() : System.nanoTime();
        PipelineContext context = new PipelineContext(config, seed);
        LOG.info("开始混淆 " + fileName + "（" + context.getLuaVersion().getDisplayName() + "，种子 " + seed + "）");

        long start = System.nanoTime();
        TopNode top = context.newParser().parse(source, fileName);
        LOG.info(String.format("解析完成，用时 %.2f ms", millisSince(start)));

        top = run(top, context);

        String output = LuaFormatter.format(top, config.isPrettyPrint() ? FormatConfig.pretty() : FormatConfig.compact());
        LOG.info(String.format("混淆完成，输出 %d 字节（输入 %d 字节）", output.length(), source.length()));
        return output;
    }

    /**
     * 对已解析的树执行全部步骤和重命名
     */
    public TopNode run(TopNode top, PipelineContext context) {
        for (Step step : steps) {
            LOG.info("执行步骤 " + step.getName());
            long start = System.nanoTime();
            try {
                top = step.apply(top, context);
                if (config.isVerifyScopes()) {
                    ScopeConsistencyChecker.check(top);
                }
            } catch (RuntimeException e) {
                throw new PipelineException(step.getName(), e);
            }
            LOG.info(String.format("步骤 %s 完成，用时 %.2f ms", step.getName(), millisSince(start)));
        }
        if (config.isRenameVariables()) {
            long start = System.nanoTime();
            new VariableRenamer(context::generateName, config.getVarNamePrefix()).rename(top);
            LOG.info(String.format("变量重命名完成，用时 %.2f ms", millisSince(start)));
        }
        return top;
    }

    private static double millisSince(long start) {
        return (System.nanoTime() - start) / 1_000_000.0;
    }
}
