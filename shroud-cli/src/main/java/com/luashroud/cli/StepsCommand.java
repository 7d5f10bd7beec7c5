package com.luashroud.cli;

import com.luashroud.pipeline.StepRegistry;
import com.luashroud.pipeline.config.Presets;
import com.luashroud.pipeline.config.SettingDescriptor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * picocli steps 子命令：列出可用步骤、设置和预设
 */
@Command(name = "steps", description = "列出可用的混淆步骤及其设置")
public class StepsCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        PrintWriter out = spec.commandLine().getOut();
        for (StepRegistry.Entry entry : StepRegistry.builtin().getEntries()) {
            out.println(entry.getName() + " - " + entry.getDescription());
            for (SettingDescriptor setting : entry.getSchema()) {
                out.println("    " + setting);
            }
        }
        out.println();
        out.println("预设: " + String.join(", ", Presets.names()));
        out.flush();
    }
}
