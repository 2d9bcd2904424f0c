package com.wear.stitch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wear.stitch.config.YamlConfig;
import com.wear.stitch.core.stitcher.CompositeOptions;
import com.wear.stitch.core.stitcher.ScrollStitchStrategy;
import com.wear.stitch.dto.StitchSettings;
import com.wear.stitch.dto.StitchSettingsRequest;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 拼接配置服务
 * 负责拼接参数的持久化和运行时管理
 * <p>
 * 配置说明：
 * - yml 文件：wear-stitch.stitching 提供默认值
 * - {dataDir}/stitch-config.json：运行时修改后的参数，启动时覆盖 yml 默认值
 */
@Service
public class StitchConfigService {
    private static final Logger logger = LoggerFactory.getLogger(StitchConfigService.class);

    private static final String CONFIG_FILE_NAME = "stitch-config.json";

    @Autowired
    private YamlConfig yamlConfig;

    private final ObjectMapper mapper = new ObjectMapper();

    private Path configFilePath;
    private StitchSettings settings;

    @PostConstruct
    public void init() {
        Path dataDir = Paths.get(yamlConfig.getSystem().getDataDir());
        configFilePath = dataDir.resolve(CONFIG_FILE_NAME);

        YamlConfig.StitchingConfig defaults = yamlConfig.getStitching();
        settings = new StitchSettings(defaults.isRound(), defaults.isTransparency(), defaults.isParallel());
        loadPersistedConfig();

        logger.info("StitchConfigService initialized with {}, config file: {}", settings, configFilePath);
    }

    public synchronized StitchSettings getSettings() {
        return settings.copy();
    }

    /**
     * 修改拼接参数并持久化，返回修改后的参数
     */
    public synchronized StitchSettings update(StitchSettingsRequest request) {
        if (request.getRound() != null) {
            settings.setRound(request.getRound());
        }
        if (request.getTransparency() != null) {
            settings.setTransparency(request.getTransparency());
        }
        if (request.getParallel() != null) {
            settings.setParallel(request.getParallel());
        }
        savePersistedConfig();
        logger.info("Stitch settings changed to: {}", settings);
        return settings.copy();
    }

    /**
     * 按当前配置创建拼接策略；round / transparency 非空时覆盖配置
     */
    public ScrollStitchStrategy createStrategy(Boolean round, Boolean transparency) {
        StitchSettings current = getSettings();
        CompositeOptions options = new CompositeOptions(
                round != null ? round : current.isRound(),
                transparency != null ? transparency : current.isTransparency(),
                current.isParallel());
        return new ScrollStitchStrategy(options);
    }

    public Map<String, Object> getAllConfigs() {
        StitchSettings current = getSettings();
        YamlConfig.CaptureConfig capture = yamlConfig.getCapture();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("round", current.isRound());
        result.put("transparency", current.isTransparency());
        result.put("parallel", current.isParallel());
        result.put("configFilePath", configFilePath.toAbsolutePath().toString());

        Map<String, Object> captureDefaults = new LinkedHashMap<>();
        captureDefaults.put("outDir", capture.getOutDir());
        captureDefaults.put("filePrefix", capture.getFilePrefix());
        captureDefaults.put("adbArgs", capture.getAdbArgs());
        captureDefaults.put("interCaptureDelay", capture.getInterCaptureDelay());
        captureDefaults.put("maxCaptures", capture.getMaxCaptures());
        captureDefaults.put("keepCaptures", capture.isKeepCaptures());
        result.put("capture", captureDefaults);
        return result;
    }

    public Path getConfigFilePath() {
        return configFilePath;
    }

    private void loadPersistedConfig() {
        if (!Files.exists(configFilePath)) {
            logger.info("Stitch config file not found, using application.yml defaults");
            return;
        }
        try {
            StitchSettings persisted = mapper.readValue(configFilePath.toFile(), StitchSettings.class);
            settings = persisted;
            logger.info("Loaded stitch config from {}", configFilePath);
        } catch (IOException e) {
            logger.warn("Failed to load stitch config from JSON: {}, using defaults", e.getMessage());
        }
    }

    private void savePersistedConfig() {
        try {
            Path parent = configFilePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(configFilePath.toFile(), settings);
            logger.info("Saved stitch config to: {}", configFilePath);
        } catch (IOException e) {
            logger.error("Failed to save stitch config: {}", e.getMessage());
            throw new IllegalStateException("Failed to save stitch config to " + configFilePath, e);
        }
    }
}
