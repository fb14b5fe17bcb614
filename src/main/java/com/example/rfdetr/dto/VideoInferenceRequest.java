package com.example.rfdetr.dto;

import com.example.rfdetr.processing.ModelType;
import lombok.Data;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;

/**
 * 视频推理请求，未填写的字段使用 rfdetr.pipeline 配置
 */
@Data
public class VideoInferenceRequest {

    private String videoPath;

    private String modelPath;

    private String labelPath;

    private String outputPath;

    private ModelType modelType;

    /** 置信度阈值 */
    @DecimalMin(value = "0.0", message = "置信度阈值不能小于0")
    @DecimalMax(value = "1.0", message = "置信度阈值不能大于1")
    private Float threshold;

    private Float maskThreshold;

    private Integer maxDetections;

    @Min(value = 1, message = "环形缓冲区大小必须大于0")
    private Integer ringBufferSize;

    /** 是否弹出预览窗口 */
    private Boolean display;
}
