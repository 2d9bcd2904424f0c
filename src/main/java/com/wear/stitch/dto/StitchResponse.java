package com.wear.stitch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wear.stitch.core.stitcher.FrameAlignment;
import lombok.Data;

import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StitchResponse {
    private String recordId;
    private int frameCount;
    private int width;
    private int height;
    private List<FrameAlignment> alignments;
    private List<Integer> degenerateFrames;
    private long gapPixels;
    private long elapsedMs;
    private String outputPath;
    private String imageUrl;
    private String image;           // Base64 PNG
}
