package com.example.rfdetr.processing;

import lombok.Data;

/**
 * 推理参数
 */
@Data
public class InferenceConfig {

    /** 模型输入分辨率，0表示从模型自动检测 */
    private int resolution = 0;

    private ModelType modelType = ModelType.DETECTION;

    /** 保留的最大检测数，<=0 表示不限制 */
    private int maxDetections = 300;

    /** 置信度阈值 */
    private float threshold = 0.5f;

    /** 掩码logit阈值 */
    private float maskThreshold = 0.0f;

    /** 各通道均值 (RGB) */
    private float[] means = {0.485f, 0.456f, 0.406f};

    /** 各通道标准差 (RGB) */
    private float[] stds = {0.229f, 0.224f, 0.225f};

    public InferenceConfig copy() {
        InferenceConfig copy = new InferenceConfig();
        copy.setResolution(resolution);
        copy.setModelType(modelType);
        copy.setMaxDetections(maxDetections);
        copy.setThreshold(threshold);
        copy.setMaskThreshold(maskThreshold);
        copy.setMeans(means.clone());
        copy.setStds(stds.clone());
        return copy;
    }

    public boolean isSegmentation() {
        return modelType == ModelType.SEGMENTATION;
    }
}
