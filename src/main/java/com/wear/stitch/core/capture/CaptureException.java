package com.wear.stitch.core.capture;

import com.wear.stitch.core.stitcher.StitchException;

/**
 * 截屏采集失败（设备未连接、adb 不可用、文件读写失败等）
 */
public class CaptureException extends StitchException {

    public CaptureException(String message) {
        super(message);
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
