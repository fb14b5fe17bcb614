package com.example.rfdetr.dto;

import com.example.rfdetr.processing.ModelType;
import lombok.Data;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotBlank;

@Data
public class ImageInferenceRequest {

    @NotBlank(message = "图像路径不能为空")
    private String imagePath;

    private String modelPath;

    private String labelPath;

    private String outputPath;

    private ModelType modelType;

    @DecimalMin(value = "0.0", message = "置信度阈值不能小于0")
    @DecimalMax(value = "1.0", message = "置信度阈值不能大于1")
    private Float threshold;

    private Float maskThreshold;

    private Integer maxDetections;
}
