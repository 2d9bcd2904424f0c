package com.wear.stitch.dto;

import lombok.Data;

import java.util.List;

/**
 * 拼接请求：按截取顺序排列的 Base64 图像（可带 data:image/png;base64, 前缀）
 */
@Data
public class StitchFramesRequest {
    private List<String> frames;
    private Boolean round;          // 为空时使用当前配置
    private Boolean transparency;   // 为空时使用当前配置
    private boolean includeImage = true;
}
