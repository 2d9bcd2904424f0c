package com.wear.stitch.core.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 一次滚动截屏会话
 * <p>
 * 每轮：截屏 → 下滑 → 取回。连续两张截屏 MD5 相同说明已经滚动到底，停止采集；
 * 最后那张重复的截屏不计入数量。每轮之间等待 interCaptureDelayMs，让滚动条消失。
 */
public class CaptureSession {
    private static final Logger logger = LoggerFactory.getLogger(CaptureSession.class);

    private final CaptureSource source;
    private final Path captureDir;
    private final String capturePrefix;
    private final int maxCaptures;
    private final long interCaptureDelayMs;

    public CaptureSession(CaptureSource source, Path captureDir, String capturePrefix,
                          int maxCaptures, long interCaptureDelayMs) {
        if (maxCaptures <= 0) {
            throw new IllegalArgumentException("maxCaptures must be positive: " + maxCaptures);
        }
        this.source = source;
        this.captureDir = captureDir;
        this.capturePrefix = capturePrefix;
        this.maxCaptures = maxCaptures;
        this.interCaptureDelayMs = interCaptureDelayMs;
    }

    /**
     * @return 有效截屏数量，截屏文件为 capturePath(0 .. n-1)
     */
    public int run() {
        if (!source.isOpened() && !source.open()) {
            throw new CaptureException("Failed to open capture source. Is adb installed?");
        }

        try {
            String previousDigest = "";
            for (int i = 0; i < maxCaptures; i++) {
                String name = CaptureFiles.paddedIndex(maxCaptures, i);
                Path file = CaptureFiles.capturePath(captureDir, capturePrefix, maxCaptures, i);
                logger.info("Capturing image {}", i);

                source.capture(name);
                source.scroll();
                source.fetch(name, file);
                if (!Files.exists(file)) {
                    throw new CaptureException("Failed to capture screenshot. Is your device connected?");
                }

                String digest = md5(file);
                if (digest.equals(previousDigest)) {
                    logger.info("Capture {} is identical to the previous one, reached the end of the scroll", i);
                    return i;
                }
                previousDigest = digest;
                pause();
            }
            logger.info("Reached the capture limit of {}", maxCaptures);
            return maxCaptures;
        } finally {
            source.close();
        }
    }

    private void pause() {
        if (interCaptureDelayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(interCaptureDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CaptureException("Capture interrupted", e);
        }
    }

    private static String md5(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return DigestUtils.md5DigestAsHex(in);
        } catch (IOException e) {
            throw new CaptureException("Failed to read capture " + file, e);
        }
    }
}
