package com.example.rfdetr.pipeline;

/**
 * 流水线某个阶段失败，整个运行终止
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
