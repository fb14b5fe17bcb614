package com.example.rfdetr.processing;

import java.awt.Color;

/**
 * 数值处理工具：激活函数、归一化、边界框转换
 */
public final class ProcessingUtils {

    private ProcessingUtils() {
    }

    /**
     * Sigmoid激活，将logit映射到 [0, 1]
     */
    public static float sigmoid(float x) {
        return 1.0f / (1.0f + (float) Math.exp(-x));
    }

    /**
     * 对CHW数据原地做 (pixel - mean) / std
     */
    public static void normalizeImage(float[] data, int channelSize, float[] means, float[] stds) {
        for (int c = 0; c < 3; c++) {
            float mean = means[c];
            float std = stds[c];
            int offset = c * channelSize;
            for (int i = 0; i < channelSize; i++) {
                data[offset + i] = (data[offset + i] - mean) / std;
            }
        }
    }

    /**
     * 中心格式 (cx, cy, w, h) 转角点格式
     */
    public static BoundingBox cxcywhToXyxy(float cx, float cy, float w, float h) {
        return new BoundingBox(cx - w / 2.0f, cy - h / 2.0f, cx + w / 2.0f, cy + h / 2.0f);
    }

    /**
     * 角点格式转回中心格式，返回 {cx, cy, w, h}
     */
    public static float[] xyxyToCxcywh(BoundingBox box) {
        return new float[]{
                (box.getXMin() + box.getXMax()) / 2.0f,
                (box.getYMin() + box.getYMax()) / 2.0f,
                box.getXMax() - box.getXMin(),
                box.getYMax() - box.getYMin()
        };
    }

    /**
     * 宽高方向分别缩放
     */
    public static BoundingBox scaleBox(BoundingBox box, float scaleW, float scaleH) {
        return new BoundingBox(box.getXMin() * scaleW, box.getYMin() * scaleH,
                box.getXMax() * scaleW, box.getYMax() * scaleH);
    }

    /**
     * 按类别生成固定颜色（黄金角分布色相）
     */
    public static Color colorForClass(int classId) {
        int hue = Math.floorMod(classId * 137, 180);
        return Color.getHSBColor(hue / 180.0f, 200 / 255.0f, 200 / 255.0f);
    }
}
