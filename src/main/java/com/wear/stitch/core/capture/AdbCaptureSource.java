package com.wear.stitch.core.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 通过 adb 截取手表屏幕
 * <p>
 * 截屏保存在设备 /sdcard/&lt;name&gt;.png，滚动使用一次短距离 swipe 手势。
 * adbArgs 为附加在 adb 之后的参数，例如 "-e" 或 "-s emulator-5554"。
 */
public class AdbCaptureSource implements CaptureSource {
    private static final Logger logger = LoggerFactory.getLogger(AdbCaptureSource.class);

    static final String DEVICE_DIR = "/sdcard/";
    static final String SWIPE = "shell input swipe 50 200 50 100";

    private final List<String> adbArgs;
    private boolean opened = false;

    public AdbCaptureSource(String adbArgs) {
        this.adbArgs = splitArgs(adbArgs);
    }

    @Override
    public boolean open() {
        try {
            opened = run("version") == 0;
        } catch (CaptureException e) {
            logger.error("adb is not available: {}", e.getMessage());
            opened = false;
        }
        return opened;
    }

    @Override
    public void capture(String name) {
        run("shell screencap -p " + DEVICE_DIR + name + ".png");
    }

    @Override
    public void scroll() {
        run(SWIPE);
    }

    @Override
    public void fetch(String name, Path target) {
        List<String> command = buildCommand("pull " + DEVICE_DIR + name + ".png");
        command.add(target.toAbsolutePath().toString());
        execute(command);
    }

    @Override
    public void close() {
        opened = false;
    }

    @Override
    public boolean isOpened() {
        return opened;
    }

    List<String> buildCommand(String command) {
        List<String> cmd = new ArrayList<>();
        cmd.add("adb");
        cmd.addAll(adbArgs);
        cmd.addAll(splitArgs(command));
        return cmd;
    }

    private int run(String command) {
        return execute(buildCommand(command));
    }

    /**
     * 执行命令并等待结束；非零退出码只记录日志，由调用方根据产物判断成败
     */
    private int execute(List<String> command) {
        logger.info("Executing adb command: {}", String.join(" ", command));
        try {
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .start();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    logger.debug("adb> {}", line);
                }
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                logger.warn("adb command exited with code {}: {}", exitCode, String.join(" ", command));
            }
            return exitCode;
        } catch (IOException e) {
            throw new CaptureException("Failed to run adb: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CaptureException("Interrupted while running adb", e);
        }
    }

    static List<String> splitArgs(String args) {
        if (args == null || args.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(args.trim().split("\\s+")));
    }
}
