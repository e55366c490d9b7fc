package com.imperium.searchinsight.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 启动前加载工作目录下的 .env 文件，将 KEY=VALUE 写入 System.setProperty，
 * 以便 application.yaml 中的 ${TAVILY_API_KEY} 等占位符能解析到 .env 里的值。
 * 已存在的环境变量和系统属性优先，不会被覆盖。
 */
public final class DotenvLoader {

    private static final Pattern ENV_LINE = Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_]*)=(.*)$");

    public static void load() {
        load(Paths.get(System.getProperty("user.dir")).resolve(".env"));
    }

    /**
     * @return 实际写入的键数量
     */
    public static int load(Path envPath) {
        if (!Files.isRegularFile(envPath)) {
            System.out.println("[DotenvLoader] .env file not found at: " + envPath);
            return 0;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(envPath);
        } catch (IOException e) {
            System.err.println("[DotenvLoader] Failed to load .env: " + e.getMessage());
            return 0;
        }
        int loaded = 0;
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Matcher matcher = ENV_LINE.matcher(trimmed);
            if (!matcher.matches()) {
                continue;
            }
            String key = matcher.group(1).trim();
            String value = unquote(matcher.group(2).trim());
            if (System.getenv(key) != null || System.getProperty(key) != null) {
                continue;
            }
            System.setProperty(key, value);
            loaded++;
            System.out.println("[DotenvLoader] Loaded: " + key + " = " + (isSecret(key) ? "***" : value));
        }
        return loaded;
    }

    private static boolean isSecret(String key) {
        return key.contains("KEY") || key.contains("SECRET") || key.contains("TOKEN");
    }

    static String unquote(String s) {
        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            return s.substring(1, s.length() - 1).replace("\\\"", "\"");
        }
        return s;
    }

    private DotenvLoader() {
    }
}
