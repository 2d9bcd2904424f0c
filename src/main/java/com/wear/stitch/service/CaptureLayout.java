package com.wear.stitch.service;

import com.wear.stitch.core.capture.CaptureFiles;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 一次会话的文件布局
 * <p>
 * 输出文件 out/foo.png 对应的截屏为 out/foo_00.png、out/foo_01.png ...
 */
public final class CaptureLayout {
    private final Path outputFile;
    private final Path captureDir;
    private final String capturePrefix;
    private final int maxCaptures;
    private final int availableCaptures;

    public CaptureLayout(Path outputFile, Path captureDir, String capturePrefix, int maxCaptures, int availableCaptures) {
        this.outputFile = outputFile;
        this.captureDir = captureDir;
        this.capturePrefix = capturePrefix;
        this.maxCaptures = maxCaptures;
        this.availableCaptures = availableCaptures;
    }

    public Path getOutputFile() { return outputFile; }

    public Path getCaptureDir() { return captureDir; }

    public String getCapturePrefix() { return capturePrefix; }

    public int getMaxCaptures() { return maxCaptures; }

    /**
     * 采集模式下为上限，非采集模式下为目录中已有的连续截屏数
     */
    public int getAvailableCaptures() { return availableCaptures; }

    public Path capturePath(int index) {
        return CaptureFiles.capturePath(captureDir, capturePrefix, maxCaptures, index);
    }

    public List<Path> capturePaths(int count) {
        List<Path> paths = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            paths.add(capturePath(i));
        }
        return paths;
    }
}
