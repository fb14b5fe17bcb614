package com.example.rfdetr.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个检测结果
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class DetectionInfo {

    private int classId;

    private String label;

    private float score;

    /** [x1, y1, x2, y2]，原图像素坐标 */
    private float[] bbox;

    /** 掩码像素数，检测模型为null */
    private Integer maskPixels;
}
