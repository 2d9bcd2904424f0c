package com.wear.stitch.dto;

import lombok.Data;

/**
 * 修改拼接参数，未提供的字段保持不变
 */
@Data
public class StitchSettingsRequest {
    private Boolean round;
    private Boolean transparency;
    private Boolean parallel;
}
