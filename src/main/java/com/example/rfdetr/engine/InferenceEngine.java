package com.example.rfdetr.engine;

import java.nio.file.Path;

/**
 * 推理后端。流水线只通过这个接口访问模型，不关心具体运行时。
 * <p>
 * 输出通过 {@link #getOutputData} 复制到调用方的缓冲区，不共享后端内部内存。
 * 一个实例只能由一个线程使用。
 */
public interface InferenceEngine extends AutoCloseable {

    /**
     * 加载模型。inputShape 为 {1, 3, H, W}，H 或 W 为0时从模型自动检测。
     *
     * @return 实际使用的输入形状
     * @throws IllegalArgumentException 模型文件不存在
     * @throws IllegalStateException    无法自动检测分辨率
     */
    long[] initialize(Path modelPath, long[] inputShape);

    void runInference(float[] input, long[] inputShape);

    int getOutputCount();

    /**
     * 将第 index 个输出复制到 destination
     *
     * @throws IndexOutOfBoundsException index 越界
     * @throws IllegalStateException     输出元素个数与 expectedSize 不一致
     */
    void getOutputData(int index, float[] destination, int expectedSize);

    long[] getOutputShape(int index);

    String getBackendName();

    @Override
    void close();
}
