package com.example.rfdetr.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 单张图片推理结果DTO
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ImageInferenceResult {

    private boolean success;

    private String error;

    private String imagePath;

    /** 绘制结果图片路径 */
    private String outputPath;

    private int width;

    private int height;

    private int resolution;

    private long processingTimeMs;

    private List<DetectionInfo> detections;
}
