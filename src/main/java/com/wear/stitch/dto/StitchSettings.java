package com.wear.stitch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 运行时拼接参数（持久化到 stitch-config.json）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StitchSettings {
    private boolean round;
    private boolean transparency;
    private boolean parallel;

    public StitchSettings copy() {
        return new StitchSettings(round, transparency, parallel);
    }
}
