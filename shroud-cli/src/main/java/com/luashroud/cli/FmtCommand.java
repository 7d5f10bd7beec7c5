package com.luashroud.cli;

import com.luashroud.compiler.formatter.FormatConfig;
import com.luashroud.compiler.lexer.LuaVersion;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * picocli fmt 子命令：格式化 Lua 文件（不做混淆）
 */
@Command(name = "fmt", description = "格式化 Lua 文件")
public class FmtCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Option(names = "--style", defaultValue = "pretty", description = "输出风格（pretty, compact, inline），默认 pretty")
    String style;

    @Option(names = "--indent-size", defaultValue = "4", description = "缩进空格数（默认 4）")
    int indentSize;

    @Option(names = "--use-tabs", description = "使用 Tab 缩进")
    boolean useTabs;

    @Option(names = "--lua-version", defaultValue = "Lua51", description = "源码方言（Lua51, LuaU）")
    String luaVersion;

    @Option(names = {"-o", "--output"}, description = "输出路径（默认覆盖源文件）")
    String output;

    @Override
    public Integer call() {
        LuaVersion version = LuaVersion.fromName(luaVersion);
        if (version == null) {
            throw new ParameterException(spec.commandLine(), "未知的方言 '" + luaVersion + "'（可选: Lua51, LuaU）");
        }
        FormatConfig config = style(style);
        config.setIndentSize(indentSize);
        config.setUseSpaces(!useTabs);
        return new ObfuscateRunner(spec.commandLine().getOut(), spec.commandLine().getErr())
                .formatFile(file, config, version, output);
    }

    private FormatConfig style(String name) {
        switch (name.toLowerCase()) {
            case "pretty":  return FormatConfig.pretty();
            case "compact": return FormatConfig.compact();
            case "inline":  return FormatConfig.inline();
            default:
                throw new ParameterException(spec.commandLine(),
                        "未知的输出风格 '" + name + "'（可选: pretty, compact, inline）");
        }
    }
}
