package com.wear.stitch.model;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
public class StitchRecord {
    private String id;
    private LocalDateTime timestamp;
    private String source;          // frames / session
    private int frameCount;
    private int width;
    private int height;
    private boolean round;
    private boolean transparency;

    // 每帧相对上一帧的偏移与匹配分数（第 0 帧均为 0）
    private List<Integer> offsets;
    private List<Integer> scores;

    private List<Integer> degenerateFrames;
    private long gapPixels;
    private long elapsedMs;
    private String outputPath;
}
