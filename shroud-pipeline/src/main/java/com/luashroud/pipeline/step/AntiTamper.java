package com.luashroud.pipeline.step;

import com.luashroud.compiler.analysis.Binding;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.pipeline.AbstractStep;
import com.luashroud.pipeline.FragmentTemplates;
import com.luashroud.pipeline.PipelineContext;
import com.luashroud.pipeline.config.SettingDescriptor;
import com.luashroud.pipeline.config.StepSettings;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 在程序开头插入防篡改检查；检查失败时脚本不断抛错
 *
 * <p>调试钩子检查依赖输出只有一行，格式化输出时跳过本步骤。</p>
 */
public class AntiTamper extends AbstractStep {

    private static final Logger LOG = Logger.getLogger(AntiTamper.class.getName());

    public static final String NAME = "AntiTamper";
    public static final String DESCRIPTION = "Breaks the script when it is modified";
    public static final List<SettingDescriptor> SETTINGS = Collections.unmodifiableList(Arrays.asList(
            SettingDescriptor.bool("UseDebug", true,
                    "Use the debug library; scripts will not run where it is unavailable")
    ));

    private final boolean useDebug;

    public AntiTamper(StepSettings settings) {
        super(settings);
        this.useDebug = settings.getBoolean("UseDebug");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return DESCRIPTION;
    }

    @Override
    public TopNode apply(TopNode top, PipelineContext context) {
        if (context.isPrettyPrint()) {
            LOG.warning("\"" + NAME + "\" 不能与格式化输出一起使用，已忽略");
            return top;
        }
        Map<String, String> values = new HashMap<>();
        values.put("GUARD", context.randomString(12));
        values.put("SEED", context.randomString(16));
        values.put("N1", Integer.toString(context.randomInt(1, 1 << 24)));
        values.put("N2", Integer.toString(context.randomInt(1, 1 << 24)));
        values.put("DEBUG_CHECKS", useDebug ? FragmentTemplates.load("anti_tamper_debug") : "");
        context.getSplicer().splice(FragmentTemplates.render("anti_tamper", values), top.getBody(), 0,
                Collections.<String, Binding>emptyMap());
        return top;
    }
}
