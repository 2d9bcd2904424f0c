package com.wear.stitch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责加载 OpenCV JNI 库（使用 openpnp 打包在 jar 中的库）
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    /**
     * 预加载 OpenCV native 库
     * 必须在任何图像编解码之前调用，重复调用无副作用；加载失败只记录日志，由 FrameCodec 在使用时报错
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        logger.info("Loading OpenCV via openpnp...");
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            logger.info("OpenCV loaded successfully via openpnp");
        } catch (Throwable e) {
            logger.warn("Failed to load OpenCV via openpnp: {}", e.getMessage());
        }
    }

    public static synchronized boolean isLoaded() {
        return loaded;
    }
}
