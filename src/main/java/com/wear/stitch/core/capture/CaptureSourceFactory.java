package com.wear.stitch.core.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CaptureSourceFactory {
    private static final Logger logger = LoggerFactory.getLogger(CaptureSourceFactory.class);

    /**
     * 创建截屏源
     * @param adbArgs 附加的 adb 参数，例如 "-e"、"-s emulator-5554"，可为空
     */
    public CaptureSource create(String adbArgs) {
        logger.debug("Creating adb capture source with args: '{}'", adbArgs == null ? "" : adbArgs);
        return new AdbCaptureSource(adbArgs);
    }
}
