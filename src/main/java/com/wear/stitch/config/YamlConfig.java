package com.wear.stitch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "wear-stitch")
public class YamlConfig {
    private SystemConfig system = new SystemConfig();
    private StitchingConfig stitching = new StitchingConfig();
    private CaptureConfig capture = new CaptureConfig();

    @Data
    public static class SystemConfig {
        private String dataDir = "data";
        private boolean saveLocal = true;
    }

    @Data
    public static class StitchingConfig {
        private boolean round = true;          // 圆形屏幕（内切圆以外视为屏外）
        private boolean transparency = false;  // 边缘无像素时填充透明
        private boolean parallel = false;      // 行内并行计算
    }

    @Data
    public static class CaptureConfig {
        private String outDir = ".";
        private String filePrefix = "stitch";
        private String adbArgs = "";
        private long interCaptureDelay = 1000; // ms，等待滚动条消失
        private int maxCaptures = 50;
        private boolean keepCaptures = false;
    }
}
