package com.wear.stitch.core.stitcher;

/**
 * 拼接流程异常基类
 */
public class StitchException extends RuntimeException {

    public StitchException(String message) {
        super(message);
    }

    public StitchException(String message, Throwable cause) {
        super(message, cause);
    }
}
