package com.wear.stitch.service;

import com.wear.stitch.config.YamlConfig;
import com.wear.stitch.core.capture.CaptureException;
import com.wear.stitch.core.capture.CaptureFiles;
import com.wear.stitch.core.capture.CaptureSession;
import com.wear.stitch.core.capture.CaptureSource;
import com.wear.stitch.core.capture.CaptureSourceFactory;
import com.wear.stitch.dto.SessionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 截屏采集服务：解析会话文件布局、驱动 adb 截屏、清理截屏文件
 */
@Service
public class CaptureService {
    private static final Logger logger = LoggerFactory.getLogger(CaptureService.class);

    // 自动生成输出文件名时的序号上限
    static final int MAX_OUTPUT_FILES = 1000;

    @Autowired
    private YamlConfig yamlConfig;

    @Autowired
    private CaptureSourceFactory captureSourceFactory;

    /**
     * 解析输出文件与截屏文件位置
     * <p>
     * - 指定 fileName：输出到 outDir/fileName（覆盖）
     * - 采集模式未指定 fileName：outDir/filePrefix + 下一个可用序号
     * - 非采集模式必须指定 fileName，且 outDir 必须存在
     * - outDir 只能位于 wear-stitch.capture.out-dir 之下，fileName / filePrefix 不能带目录
     */
    public CaptureLayout prepare(SessionRequest request) {
        YamlConfig.CaptureConfig defaults = yamlConfig.getCapture();
        boolean capture = request.getCapture() == null || request.getCapture();
        Path root = Paths.get(defaults.getOutDir()).toAbsolutePath().normalize();
        String outDirValue = StringUtils.hasText(request.getOutDir()) ? request.getOutDir() : defaults.getOutDir();
        int maxCaptures = request.getMaxCaptures() != null ? request.getMaxCaptures() : defaults.getMaxCaptures();

        if (maxCaptures <= 0) {
            throw new IllegalArgumentException("maxCaptures must be positive: " + maxCaptures);
        }
        if (StringUtils.hasText(request.getFileName()) && StringUtils.hasText(request.getFilePrefix())) {
            throw new IllegalArgumentException("fileName and filePrefix are mutually exclusive");
        }

        Path outDir = root.resolve(outDirValue).normalize();
        if (!outDir.startsWith(root)) {
            throw new IllegalArgumentException("Output directory must be inside " + root + ": " + outDirValue);
        }
        requirePlainName(request.getFileName(), "fileName");
        requirePlainName(request.getFilePrefix(), "filePrefix");

        if (!Files.isDirectory(outDir)) {
            if (!capture) {
                throw new CaptureException("Capture directory does not exist. Cannot stitch.");
            }
            try {
                Files.createDirectories(outDir);
                logger.info("Created output directory: {}", outDir.toAbsolutePath());
            } catch (IOException e) {
                throw new CaptureException("Failed to create output directory " + outDir, e);
            }
        }

        Path outFile;
        if (StringUtils.hasText(request.getFileName())) {
            outFile = outDir.resolve(request.getFileName());
        } else if (capture) {
            String prefix = StringUtils.hasText(request.getFilePrefix()) ? request.getFilePrefix() : defaults.getFilePrefix();
            outFile = CaptureFiles.nextFileName(outDir, prefix, MAX_OUTPUT_FILES);
        } else {
            throw new IllegalArgumentException("Must specify file-name in no-capture mode");
        }

        outFile = outFile.normalize();
        if (!outDir.equals(outFile.getParent())) {
            throw new IllegalArgumentException("Output file must be inside " + outDir + ": " + outFile);
        }

        String baseName = stripExtension(outFile.getFileName().toString());
        if (baseName.isEmpty()) {
            throw new IllegalArgumentException("Invalid path, prefix, or file provided: "
                    + outDirValue + ", " + request.getFilePrefix() + ", " + request.getFileName());
        }
        Path captureDir = outFile.toAbsolutePath().getParent();
        String capturePrefix = baseName + "_";

        int available = capture ? maxCaptures : CaptureFiles.countCaptures(captureDir, capturePrefix, maxCaptures);
        CaptureLayout layout = new CaptureLayout(outFile, captureDir, capturePrefix, maxCaptures, available);
        logger.info("Session layout: output={}, captures={}/{}*.png, capture={}, available={}",
                outFile, captureDir, capturePrefix, capture, available);
        return layout;
    }

    /**
     * 清空旧截屏后执行一次截屏会话
     * @return 有效截屏数量
     */
    public int capture(CaptureLayout layout, SessionRequest request) {
        YamlConfig.CaptureConfig defaults = yamlConfig.getCapture();
        String adbArgs = request.getAdbArgs() != null ? request.getAdbArgs() : defaults.getAdbArgs();
        long delay = request.getInterCaptureDelay() != null ? request.getInterCaptureDelay() : defaults.getInterCaptureDelay();

        cleanup(layout);

        CaptureSource source = captureSourceFactory.create(adbArgs);
        CaptureSession session = new CaptureSession(source, layout.getCaptureDir(), layout.getCapturePrefix(),
                layout.getMaxCaptures(), delay);
        int count = session.run();
        logger.info("Captured {} distinct screen(s)", count);
        return count;
    }

    public void cleanup(CaptureLayout layout) {
        int removed = CaptureFiles.removeCaptures(layout.getCaptureDir(), layout.getCapturePrefix());
        if (removed > 0) {
            logger.info("Removed {} capture file(s) {}*.png", removed, layout.getCapturePrefix());
        }
    }

    private static void requirePlainName(String value, String field) {
        if (!StringUtils.hasText(value)) {
            return;
        }
        if (value.contains("/") || value.contains("\\") || value.equals(".") || value.equals("..")) {
            throw new IllegalArgumentException(field + " must be a plain file name: " + value);
        }
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
