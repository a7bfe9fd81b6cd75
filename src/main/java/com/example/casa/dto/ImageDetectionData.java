package com.example.casa.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 检测服务返回的静态图像结果（无轨迹身份）
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ImageDetectionData {

    private List<SpermDetection> detections;

    private String modelVersion;
}
