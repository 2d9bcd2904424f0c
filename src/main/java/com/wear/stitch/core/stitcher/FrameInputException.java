package com.wear.stitch.core.stitcher;

/**
 * 输入帧不合法：没有帧、帧为空或宽度与第 0 帧不同。在计算任何哈希之前抛出。
 */
public class FrameInputException extends StitchException {

    public FrameInputException(String message) {
        super(message);
    }
}
