package com.example.casa.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 样本媒体属性
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class MediaInfo {

    private int width;

    private int height;

    /** 帧率（图像为0） */
    private double fps;

    /** 总帧数（图像为1） */
    private long totalFrames;

    /** 时长（秒） */
    private double duration;

    private String format;

    private long fileSize;
}
