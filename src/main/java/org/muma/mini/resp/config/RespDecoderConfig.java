package org.muma.mini.resp.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.function.Function;

/**
 * 解码器配置
 * 优先级: 环境变量 > 配置文件 (resp.properties) > 默认值
 */
@Getter
@Setter
public class RespDecoderConfig {

    private static final Logger log = LoggerFactory.getLogger(RespDecoderConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "resp.properties";

    // --- Limits ---
    // 数组最大嵌套层数，防止恶意输入把调用栈打爆
    private int maxNestingDepth = 512;
    // 与 Redis proto-max-bulk-len 默认值一致
    private long maxBulkLength = 512L * 1024 * 1024;
    // 单行 (简单字符串 / 错误 / 数字) 最大长度，64KB
    private int maxInlineLength = 64 * 1024;

    public RespDecoderConfig() {
    }

    public static RespDecoderConfig loadDefault() {
        return load(DEFAULT_CONFIG_FILE);
    }

    public static RespDecoderConfig load(String path) {
        RespDecoderConfig config = new RespDecoderConfig();
        config.loadConfig(path);
        return config;
    }

    // --- Loading Logic ---

    public void loadConfig(String path) {
        loadFile(path);
        applyEnvOverrides(System::getenv);

        log.info("RespDecoderConfig initialized: {}", this);
    }

    void loadFile(String path) {
        Properties props = loadProperties(path);

        this.maxNestingDepth = getInt(props, "decoder.max_nesting_depth", this.maxNestingDepth);
        this.maxBulkLength = getSize(props, "decoder.max_bulk_length", this.maxBulkLength);
        this.maxInlineLength = getInt(props, "decoder.max_inline_length", this.maxInlineLength);
    }

    void applyEnvOverrides(Function<String, String> env) {
        String depth = env.apply("RESP_MAX_NESTING_DEPTH");
        if (depth != null) {
            this.maxNestingDepth = parsePositiveInt("RESP_MAX_NESTING_DEPTH", depth, this.maxNestingDepth);
            log.info("Max nesting depth overridden by ENV: {}", this.maxNestingDepth);
        }

        String bulk = env.apply("RESP_MAX_BULK_LENGTH");
        if (bulk != null) {
            try {
                this.maxBulkLength = parseSize(bulk);
                log.info("Max bulk length overridden by ENV: {}", this.maxBulkLength);
            } catch (NumberFormatException e) {
                log.warn("Invalid RESP_MAX_BULK_LENGTH '{}', keeping {}.", bulk, this.maxBulkLength);
            }
        }

        String inline = env.apply("RESP_MAX_INLINE_LENGTH");
        if (inline != null) {
            this.maxInlineLength = parsePositiveInt("RESP_MAX_INLINE_LENGTH", inline, this.maxInlineLength);
            log.info("Max inline length overridden by ENV: {}", this.maxInlineLength);
        }
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 优先 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    // 辅助：解析带单位的大小 (64mb, 1gb)
    static long parseSize(String sizeStr) {
        String s = sizeStr.toLowerCase().trim();
        long multiplier = 1;
        if (s.endsWith("kb")) {
            multiplier = 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("mb")) {
            multiplier = 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("gb")) {
            multiplier = 1024 * 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("b")) {
            s = s.substring(0, s.length() - 1);
        }
        long value = Long.parseLong(s.trim());
        if (value < 0) {
            throw new NumberFormatException("negative size: " + sizeStr);
        }
        try {
            return Math.multiplyExact(value, multiplier);
        } catch (ArithmeticException e) {
            throw new NumberFormatException("size out of range: " + sizeStr);
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parsePositiveInt(key, val, defaultValue) : defaultValue;
    }

    private long getSize(Properties props, String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) {
            return defaultValue;
        }
        try {
            return parseSize(val);
        } catch (NumberFormatException e) {
            log.warn("Invalid {} '{}', using default {}.", key, val, defaultValue);
            return defaultValue;
        }
    }

    private int parsePositiveInt(String key, String val, int defaultValue) {
        int parsed;
        try {
            parsed = Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} '{}', using default {}.", key, val, defaultValue);
            return defaultValue;
        }
        if (parsed <= 0) {
            log.warn("{} must be positive, got {}, using default {}.", key, parsed, defaultValue);
            return defaultValue;
        }
        return parsed;
    }

    @Override
    public String toString() {
        return "RespDecoderConfig{maxNestingDepth=" + maxNestingDepth
                + ", maxBulkLength=" + maxBulkLength
                + ", maxInlineLength=" + maxInlineLength + "}";
    }
}
