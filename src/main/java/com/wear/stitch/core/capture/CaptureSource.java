package com.wear.stitch.core.capture;

import java.nio.file.Path;

public interface CaptureSource {
    /**
     * 打开截屏源
     * @return 是否成功打开
     */
    boolean open();

    /**
     * 在设备上截取当前屏幕
     * @param name 截屏名称（不含扩展名）
     */
    void capture(String name);

    /**
     * 向下滚动一小段
     */
    void scroll();

    /**
     * 将截屏取回本地
     * @param name   截屏名称
     * @param target 本地文件
     */
    void fetch(String name, Path target);

    /**
     * 关闭截屏源
     */
    void close();

    /**
     * 检查截屏源是否已打开
     */
    boolean isOpened();
}
