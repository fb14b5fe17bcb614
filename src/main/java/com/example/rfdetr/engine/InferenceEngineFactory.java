package com.example.rfdetr.engine;

/**
 * 创建未初始化的推理后端。推理阶段在自己的线程里创建并独占一个实例。
 */
@FunctionalInterface
public interface InferenceEngineFactory {

    InferenceEngine create();
}
