package com.luashroud.cli;

import com.luashroud.compiler.lexer.LuaVersion;
import com.luashroud.pipeline.config.PipelineConfig;
import com.luashroud.pipeline.config.SettingsException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * LuaShroud CLI 入口点（picocli）
 */
@Command(name = "luashroud", version = "LuaShroud v0.1.0",
         mixinStandardHelpOptions = true,
         description = "混淆 Lua 5.1 / LuaU 源码",
         subcommands = {FmtCommand.class, StepsCommand.class})
public class Main implements Callable<Integer> {

    static final String DEFAULT_PRESET = "Minify";

    @Spec
    CommandSpec spec;

    @Option(names = {"-p", "--preset"}, description = "内置预设（Minify, Weak, Medium, Strong），默认 Minify")
    String preset;

    @Option(names = {"-c", "--config"}, description = "JSON 配置文件")
    String configFile;

    @Option(names = "--seed", description = "随机种子，相同种子得到相同输出")
    Long seed;

    @Option(names = "--pretty", description = "格式化输出（多行、缩进）")
    boolean pretty;

    @Option(names = "--lua-version", description = "源码方言（Lua51, LuaU）")
    String luaVersion;

    @Option(names = {"-o", "--output"}, description = "输出路径（默认 <文件名>.obfuscated.lua）")
    String output;

    @Option(names = {"-v", "--verbose"}, description = "输出详细日志")
    boolean verbose;

    @Parameters(arity = "0..1", description = "Lua 源码文件")
    String file;

    @Override
    public Integer call() {
        configureLogging(verbose);
        if (file == null) {
            throw new ParameterException(spec.commandLine(), "缺少输入文件");
        }
        if (preset != null && configFile != null) {
            throw new ParameterException(spec.commandLine(), "--preset 与 --config 不能同时使用");
        }
        ObfuscateRunner runner = new ObfuscateRunner(spec.commandLine().getOut(), spec.commandLine().getErr());
        PipelineConfig config = runner.loadConfig(preset != null || configFile != null ? preset : DEFAULT_PRESET,
                configFile);
        if (config == null) {
            return 1;
        }
        try {
            applyOverrides(config);
        } catch (SettingsException e) {
            spec.commandLine().getErr().println("配置错误: " + e.getMessage());
            return 1;
        }
        return runner.obfuscateFile(file, config, output);
    }

    // 命令行参数覆盖配置文件中的值
    void applyOverrides(PipelineConfig config) {
        if (seed != null) {
            config.setSeed(seed);
        }
        if (pretty) {
            config.setPrettyPrint(true);
        }
        if (luaVersion != null) {
            LuaVersion version = LuaVersion.fromName(luaVersion);
            if (version == null) {
                throw new SettingsException("未知的方言 '" + luaVersion + "'（可选: Lua51, LuaU）");
            }
            config.setLuaVersion(version);
        }
    }

    /**
     * 默认只输出警告，--verbose 时输出 FINE 及以上
     */
    static void configureLogging(boolean verbose) {
        Level level = verbose ? Level.FINE : Level.WARNING;
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }

    public static void main(String[] args) {
        // Windows 控制台可能不是 UTF-8，按系统原生编码输出
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码名（native.encoding，JDK 17 起提供）
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
