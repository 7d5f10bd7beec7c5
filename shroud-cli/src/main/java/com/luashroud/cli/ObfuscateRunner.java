package com.luashroud.cli;

import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.formatter.FormatConfig;
import com.luashroud.compiler.formatter.LuaFormatter;
import com.luashroud.compiler.lexer.LuaVersion;
import com.luashroud.compiler.parser.ParseException;
import com.luashroud.compiler.parser.Parser;
import com.luashroud.pipeline.Pipeline;
import com.luashroud.pipeline.PipelineException;
import com.luashroud.pipeline.config.PipelineConfig;
import com.luashroud.pipeline.config.Presets;
import com.luashroud.pipeline.config.SettingsException;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 混淆、格式化执行器，返回进程退出码
 */
public class ObfuscateRunner {

    private final PrintWriter out;
    private final PrintWriter err;

    public ObfuscateRunner(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 读取预设或配置文件，出错时打印原因并返回 null
     */
    public PipelineConfig loadConfig(String preset, String configFile) {
        try {
            if (configFile != null) {
                Path path = Paths.get(configFile);
                if (!Files.exists(path)) {
                    err.println("错误: 配置文件不存在 - " + configFile);
                    return null;
                }
                return PipelineConfig.load(path);
            }
            return Presets.get(preset);
        } catch (SettingsException e) {
            err.println("配置错误: " + e.getMessage());
            return null;
        } catch (IOException e) {
            err.println("错误: 无法读取配置文件 - " + e.getMessage());
            return null;
        }
    }

    /**
     * 混淆文件并写到 outputPath（为 null 时写到源文件旁的 .obfuscated.lua）
     */
    public int obfuscateFile(String filePath, PipelineConfig config, String outputPath) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return 1;
        }
        Path target = outputPath != null ? Paths.get(outputPath) : defaultOutput(path);
        try {
            String source = read(path);
            Pipeline pipeline = Pipeline.fromConfig(config);
            String result = pipeline.apply(source, path.getFileName().toString());
            Files.write(target, result.getBytes(StandardCharsets.ISO_8859_1));
            out.println("已写入: " + target);
            return 0;
        } catch (ParseException e) {
            err.println("语法错误: " + e.getMessage());
            return 1;
        } catch (SettingsException e) {
            err.println("配置错误: " + e.getMessage());
            return 1;
        } catch (PipelineException e) {
            err.println("混淆失败: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        }
    }

    /**
     * 格式化文件；outputPath 为 null 时覆盖源文件
     */
    public int formatFile(String filePath, FormatConfig format, LuaVersion version, String outputPath) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return 1;
        }
        try {
            TopNode top = new Parser(version).parse(read(path), path.getFileName().toString());
            String formatted = LuaFormatter.format(top, format);
            Path target = outputPath != null ? Paths.get(outputPath) : path;
            Files.write(target, formatted.getBytes(StandardCharsets.ISO_8859_1));
            out.println("已格式化: " + target);
            return 0;
        } catch (ParseException e) {
            err.println("语法错误: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        }
    }

    // Lua 字符串是字节串，按 ISO-8859-1 读写保证字节不变
    private static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.ISO_8859_1);
    }

    static Path defaultOutput(Path source) {
        String name = source.getFileName().toString();
        String base = name.endsWith(".lua") ? name.substring(0, name.length() - 4) : name;
        return source.resolveSibling(base + ".obfuscated.lua");
    }
}
