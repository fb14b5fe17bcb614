package com.example.rfdetr.processing;

import com.example.rfdetr.engine.InferenceEngine;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * 推理后端 + 推理参数的组合：负责初始化、执行推理以及从后端取出输出并解码。
 * <p>
 * 输出约定：0 = 框 [1, D, 4]，1 = 类别logit [1, D, C]，2 = 掩码 [1, D, H, W]（仅分割模型）。
 * 非线程安全，由推理线程独占。
 */
@Slf4j
public class DetrInference implements AutoCloseable {

    private static final int BOXES_OUTPUT = 0;
    private static final int LOGITS_OUTPUT = 1;
    private static final int MASKS_OUTPUT = 2;

    private final InferenceEngine engine;
    private final InferenceConfig config;
    private final int resolution;
    private final long[] inputShape;

    // 输出拷贝缓冲区，按需扩容后复用
    private float[] boxBuffer = new float[0];
    private float[] logitBuffer = new float[0];
    private float[] maskBuffer = new float[0];

    public DetrInference(InferenceEngine engine, Path modelPath, InferenceConfig config) {
        if (config.getResolution() < 0) {
            throw new IllegalArgumentException("分辨率不能为负数: " + config.getResolution());
        }
        this.engine = engine;
        this.config = config;

        long[] requested = {1, 3, config.getResolution(), config.getResolution()};
        long[] resolved;
        try {
            resolved = engine.initialize(modelPath, requested);
            if (resolved.length != 4 || resolved[2] <= 0 || resolved[2] != resolved[3]) {
                throw new IllegalStateException("模型输入形状无效: " + Arrays.toString(resolved));
            }
        } catch (RuntimeException e) {
            engine.close();
            throw e;
        }
        this.inputShape = resolved;
        this.resolution = (int) resolved[2];

        log.info("推理后端 {} 初始化完成, 分辨率: {}, 模型类型: {}",
                engine.getBackendName(), resolution, config.getModelType());
    }

    public int getResolution() {
        return resolution;
    }

    public InferenceConfig getConfig() {
        return config;
    }

    public String getBackendName() {
        return engine.getBackendName();
    }

    public void runInference(float[] tensor) {
        int expected = 3 * resolution * resolution;
        if (tensor.length < expected) {
            throw new IllegalArgumentException(
                    String.format("输入张量大小不足: %d < %d", tensor.length, expected));
        }
        engine.runInference(tensor, inputShape);
    }

    /**
     * 解码最近一次推理的输出。out 会先被清空。
     */
    public void postprocess(float scaleW, float scaleH, int origH, int origW, DetectionSet out) {
        out.clear();

        int required = config.isSegmentation() ? 3 : 2;
        if (engine.getOutputCount() < required) {
            throw new IllegalStateException(String.format(
                    "模型输出数量不足: %d < %d (%s)", engine.getOutputCount(), required, config.getModelType()));
        }

        long[] boxShape = engine.getOutputShape(BOXES_OUTPUT);
        long[] logitShape = engine.getOutputShape(LOGITS_OUTPUT);
        if (boxShape.length != 3 || boxShape[2] != 4) {
            throw new IllegalStateException("框输出形状应为 [1, D, 4]: " + Arrays.toString(boxShape));
        }
        if (logitShape.length != 3 || logitShape[1] != boxShape[1]) {
            throw new IllegalStateException(String.format("类别输出形状应为 [1, %d, C]: %s",
                    boxShape[1], Arrays.toString(logitShape)));
        }

        int numQueries = (int) boxShape[1];
        int numClasses = (int) logitShape[2];

        boxBuffer = ensureCapacity(boxBuffer, numQueries * 4);
        logitBuffer = ensureCapacity(logitBuffer, numQueries * numClasses);
        engine.getOutputData(BOXES_OUTPUT, boxBuffer, numQueries * 4);
        engine.getOutputData(LOGITS_OUTPUT, logitBuffer, numQueries * numClasses);

        List<Integer> kept = DetectionDecoder.decodeDetections(boxBuffer, logitBuffer, numQueries, numClasses,
                resolution, config.getThreshold(), config.getMaxDetections(), scaleW, scaleH, out);

        if (config.isSegmentation()) {
            long[] maskShape = engine.getOutputShape(MASKS_OUTPUT);
            if (maskShape.length != 4 || maskShape[1] != numQueries) {
                throw new IllegalStateException(String.format("掩码输出形状应为 [1, %d, H, W]: %s",
                        numQueries, Arrays.toString(maskShape)));
            }
            int maskH = (int) maskShape[2];
            int maskW = (int) maskShape[3];
            int maskSize = numQueries * maskH * maskW;
            maskBuffer = ensureCapacity(maskBuffer, maskSize);
            engine.getOutputData(MASKS_OUTPUT, maskBuffer, maskSize);

            DetectionDecoder.decodeMasks(maskBuffer, numQueries, maskH, maskW, kept,
                    config.getMaskThreshold(), origW, origH, out);
        }
    }

    private static float[] ensureCapacity(float[] buffer, int size) {
        return buffer.length >= size ? buffer : new float[size];
    }

    @Override
    public void close() {
        engine.close();
    }
}
