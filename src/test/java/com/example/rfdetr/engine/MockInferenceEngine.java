package com.example.rfdetr.engine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 测试用推理后端，返回预先设定的输出
 */
public class MockInferenceEngine implements InferenceEngine {

    private final int nativeResolution;
    private final int numQueries;
    private final int numClasses;

    private float[] boxes;
    private float[] logits;
    private float[] masks;
    private int maskH;
    private int maskW;

    /** 第几次推理时抛出异常，<=0 表示不失败 */
    private volatile int failOnCall;
    private volatile boolean requireModelFile = true;
    /** 只在第几次推理时输出设定的检测，其余调用全部为 -20，<=0 表示每次都输出 */
    private volatile int detectOnlyOnCall;
    private volatile int lastCall;

    private final AtomicInteger inferenceCalls = new AtomicInteger();
    private volatile boolean initialized;
    private volatile boolean closed;
    private volatile long[] lastInputShape;

    public MockInferenceEngine(int nativeResolution, int numQueries, int numClasses) {
        this.nativeResolution = nativeResolution;
        this.numQueries = numQueries;
        this.numClasses = numClasses;
        this.boxes = new float[numQueries * 4];
        this.logits = new float[numQueries * numClasses];
        Arrays.fill(logits, -20f);
    }

    /**
     * 设置某个查询的框（归一化cxcywh）和一个类别logit，其余类别保持 -20
     */
    public MockInferenceEngine withQuery(int query, float cx, float cy, float w, float h,
                                         int classIndex, float logit) {
        int b = query * 4;
        boxes[b] = cx;
        boxes[b + 1] = cy;
        boxes[b + 2] = w;
        boxes[b + 3] = h;
        logits[query * numClasses + classIndex] = logit;
        return this;
    }

    public MockInferenceEngine withMasks(int height, int width, float[] maskLogits) {
        this.maskH = height;
        this.maskW = width;
        this.masks = maskLogits;
        return this;
    }

    public MockInferenceEngine failOnCall(int call) {
        this.failOnCall = call;
        return this;
    }

    public MockInferenceEngine detectOnlyOnCall(int call) {
        this.detectOnlyOnCall = call;
        return this;
    }

    public MockInferenceEngine withoutModelFileCheck() {
        this.requireModelFile = false;
        return this;
    }

    @Override
    public long[] initialize(Path modelPath, long[] inputShape) {
        if (requireModelFile && (modelPath == null || !Files.exists(modelPath))) {
            throw new IllegalArgumentException("模型文件不存在: " + modelPath);
        }
        long h = inputShape[2] > 0 ? inputShape[2] : nativeResolution;
        long w = inputShape[3] > 0 ? inputShape[3] : nativeResolution;
        initialized = true;
        return new long[]{1, 3, h, w};
    }

    @Override
    public void runInference(float[] input, long[] inputShape) {
        if (!initialized) {
            throw new IllegalStateException("推理后端未初始化");
        }
        int call = inferenceCalls.incrementAndGet();
        if (failOnCall > 0 && call == failOnCall) {
            throw new IllegalStateException("模拟推理失败: 第 " + call + " 次");
        }
        lastCall = call;
        lastInputShape = inputShape.clone();
    }

    @Override
    public int getOutputCount() {
        return masks != null ? 3 : 2;
    }

    @Override
    public void getOutputData(int index, float[] destination, int expectedSize) {
        float[] source;
        switch (index) {
            case 0:
                source = boxes;
                break;
            case 1:
                source = detectOnlyOnCall > 0 && lastCall != detectOnlyOnCall
                        ? filled(logits.length, -20f) : logits;
                break;
            case 2:
                if (masks == null) {
                    throw new IndexOutOfBoundsException("输出下标越界: " + index);
                }
                source = masks;
                break;
            default:
                throw new IndexOutOfBoundsException("输出下标越界: " + index);
        }
        if (source.length != expectedSize) {
            throw new IllegalStateException(String.format("输出 %d 大小不匹配: %d != %d",
                    index, source.length, expectedSize));
        }
        System.arraycopy(source, 0, destination, 0, expectedSize);
    }

    private static float[] filled(int size, float value) {
        float[] array = new float[size];
        Arrays.fill(array, value);
        return array;
    }

    @Override
    public long[] getOutputShape(int index) {
        switch (index) {
            case 0:
                return new long[]{1, numQueries, 4};
            case 1:
                return new long[]{1, numQueries, numClasses};
            case 2:
                return new long[]{1, numQueries, maskH, maskW};
            default:
                throw new IndexOutOfBoundsException("输出下标越界: " + index);
        }
    }

    @Override
    public String getBackendName() {
        return "Mock";
    }

    @Override
    public void close() {
        closed = true;
    }

    public int getInferenceCalls() {
        return inferenceCalls.get();
    }

    public boolean isClosed() {
        return closed;
    }

    public long[] getLastInputShape() {
        return lastInputShape;
    }
}
