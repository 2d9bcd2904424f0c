package com.wear.stitch.core.stitcher;

import com.wear.stitch.core.frame.Frame;

import java.util.List;

public interface StitchStrategy {
    /**
     * 拼接多个图像帧
     * @param frames 按截取顺序排列的图像帧
     * @return 拼接后的图像及对齐诊断
     */
    StitchResult stitch(List<Frame> frames);
}
