package com.example.rfdetr.engine;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import lombok.extern.slf4j.Slf4j;

import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 基于 ONNX Runtime 的推理后端
 */
@Slf4j
public class OnnxRuntimeEngine implements InferenceEngine {

    private final OrtEnvironment env;
    private OrtSession session;
    private String inputName;
    private final List<String> outputNames = new ArrayList<>();

    // 最近一次推理的输出
    private OrtSession.Result outputs;

    public OnnxRuntimeEngine() {
        this.env = OrtEnvironment.getEnvironment();
    }

    @Override
    public long[] initialize(Path modelPath, long[] inputShape) {
        if (modelPath == null || !Files.exists(modelPath)) {
            throw new IllegalArgumentException("模型文件不存在: " + modelPath);
        }

        try (OrtSession.SessionOptions options = new OrtSession.SessionOptions()) {
            options.setIntraOpNumThreads(1);
            options.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.EXTENDED_OPT);
            session = env.createSession(modelPath.toString(), options);
        } catch (OrtException e) {
            throw new IllegalStateException("创建ONNX Runtime会话失败: " + e.getMessage(), e);
        }

        inputName = session.getInputNames().iterator().next();

        long[] resolvedShape = inputShape.clone();
        if (inputShape[2] == 0 || inputShape[3] == 0) {
            long[] modelShape = readInputShape();
            if (modelShape.length == 4 && modelShape[2] == modelShape[3] && modelShape[2] > 0) {
                resolvedShape = modelShape;
                log.info("[ONNX Runtime] 自动检测输入分辨率: {}x{}", modelShape[2], modelShape[3]);
            } else {
                throw new IllegalStateException("无法从模型自动检测有效的输入分辨率: " + Arrays.toString(modelShape));
            }
        }

        outputNames.clear();
        outputNames.addAll(session.getOutputNames());
        log.info("[ONNX Runtime] 模型输出 {} 个: {}", outputNames.size(), outputNames);

        return resolvedShape;
    }

    private long[] readInputShape() {
        try {
            NodeInfo nodeInfo = session.getInputInfo().get(inputName);
            if (nodeInfo.getInfo() instanceof TensorInfo) {
                return ((TensorInfo) nodeInfo.getInfo()).getShape();
            }
            return new long[0];
        } catch (OrtException e) {
            throw new IllegalStateException("读取模型输入信息失败: " + e.getMessage(), e);
        }
    }

    @Override
    public void runInference(float[] input, long[] inputShape) {
        ensureInitialized();
        closeOutputs();

        try (OnnxTensor tensor = OnnxTensor.createTensor(env, FloatBuffer.wrap(input), inputShape)) {
            outputs = session.run(Collections.singletonMap(inputName, tensor));
        } catch (OrtException e) {
            throw new IllegalStateException("ONNX Runtime推理失败: " + e.getMessage(), e);
        }
    }

    @Override
    public int getOutputCount() {
        return outputNames.size();
    }

    @Override
    public void getOutputData(int index, float[] destination, int expectedSize) {
        OnnxTensor tensor = outputTensor(index);

        long tensorSize = elementCount(tensor.getInfo().getShape());
        if (tensorSize != expectedSize) {
            throw new IllegalStateException(
                    String.format("输出张量大小不匹配. 期望: %d, 实际: %d", expectedSize, tensorSize));
        }

        FloatBuffer buffer = tensor.getFloatBuffer();
        if (buffer == null) {
            throw new IllegalStateException("输出张量不是float类型: " + outputNames.get(index));
        }
        buffer.get(destination, 0, expectedSize);
    }

    @Override
    public long[] getOutputShape(int index) {
        return outputTensor(index).getInfo().getShape();
    }

    @Override
    public String getBackendName() {
        return "ONNX Runtime";
    }

    private OnnxTensor outputTensor(int index) {
        if (outputs == null || index < 0 || index >= outputs.size()) {
            throw new IndexOutOfBoundsException("输出下标越界: " + index);
        }
        OnnxValue value = outputs.get(index);
        if (!(value instanceof OnnxTensor)) {
            throw new IllegalStateException("输出不是张量: " + outputNames.get(index));
        }
        return (OnnxTensor) value;
    }

    private static long elementCount(long[] shape) {
        long count = 1;
        for (long dim : shape) {
            count *= dim;
        }
        return count;
    }

    private void ensureInitialized() {
        if (session == null) {
            throw new IllegalStateException("推理后端尚未初始化");
        }
    }

    private void closeOutputs() {
        if (outputs != null) {
            outputs.close();
            outputs = null;
        }
    }

    @Override
    public void close() {
        closeOutputs();
        if (session != null) {
            try {
                session.close();
            } catch (OrtException e) {
                log.warn("关闭ONNX Runtime会话失败", e);
            }
            session = null;
        }
    }
}
