package com.wear.stitch.core.capture;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 截屏文件命名
 * <p>
 * 文件名为 &lt;prefix&gt;&lt;补零序号&gt;.png，序号位数 = ceil(log10(max))。
 */
public final class CaptureFiles {
    public static final String EXTENSION = ".png";

    private CaptureFiles() {
    }

    /**
     * 按上限补零，例如 max=50 时 7 → "07"
     */
    public static String paddedIndex(int max, int num) {
        int digits = (int) Math.ceil(Math.log10(max));
        if (digits <= 0) {
            return String.valueOf(num);
        }
        return String.format("%0" + digits + "d", num);
    }

    public static Path capturePath(Path dir, String prefix, int max, int num) {
        return dir.resolve(prefix + paddedIndex(max, num) + EXTENSION);
    }

    /**
     * 第一个不存在的 &lt;base&gt;NNN.png
     */
    public static Path nextFileName(Path dir, String fileBase, int max) {
        for (int i = 0; i < max; i++) {
            Path candidate = capturePath(dir, fileBase, max, i);
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
        throw new CaptureException("Too many captures in directory. Could not generate filename.");
    }

    /**
     * 目录中从 0 开始连续存在的截屏数量
     */
    public static int countCaptures(Path dir, String prefix, int max) {
        Path next = nextFileName(dir, prefix, max);
        String name = next.getFileName().toString();
        String stem = name.substring(0, name.length() - EXTENSION.length());
        return Integer.parseInt(stem.substring(prefix.length()));
    }

    /**
     * 删除目录中所有 &lt;prefix&gt;*.png
     * @return 删除的文件数
     */
    public static int removeCaptures(Path dir, String prefix) {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob(prefix) + "*" + EXTENSION)) {
            for (Path file : stream) {
                Files.deleteIfExists(file);
                removed++;
            }
        } catch (IOException e) {
            throw new CaptureException("Failed to remove captures " + prefix + "* in " + dir, e);
        }
        return removed;
    }

    private static String glob(String literal) {
        return literal.replaceAll("([\\\\*?\\[\\]{}])", "\\\\$1");
    }
}
