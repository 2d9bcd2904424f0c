package com.wear.stitch.dto;

import lombok.Data;

/**
 * 截屏会话请求，未提供的字段使用 application.yml 中 wear-stitch.capture 的默认值
 */
@Data
public class SessionRequest {
    private String outDir;          // 相对 wear-stitch.capture.out-dir，不能超出该目录
    private String filePrefix;      // 与 fileName 互斥，自动追加递增序号
    private String fileName;        // 输出文件名，会覆盖已有文件
    private Boolean capture;        // false: 只拼接已有截屏
    private Boolean round;
    private Boolean transparency;
    private Boolean keepCaptures;
    private Integer maxCaptures;
    private Long interCaptureDelay;
    private String adbArgs;
}
