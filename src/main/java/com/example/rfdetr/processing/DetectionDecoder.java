package com.example.rfdetr.processing;

import java.util.ArrayList;
import java.util.List;

/**
 * RF-DETR 输出解码。
 * <p>
 * 输入为归一化中心格式框 [1, D, 4] 和类别logit [1, D, C]，第0列为背景。
 * 输出顺序与查询顺序一致，不重新排序，也不做NMS。所有计算使用float。
 */
public final class DetectionDecoder {

    private DetectionDecoder() {
    }

    /**
     * 解码检测结果并写入 out
     *
     * @return 被保留的查询下标，与 out 中新增的条目一一对应
     */
    public static List<Integer> decodeDetections(float[] boxes, float[] logits, int numQueries, int numClasses,
                                                 int resolution, float threshold, int maxDetections,
                                                 float scaleW, float scaleH, DetectionSet out) {
        if (numClasses < 2) {
            throw new IllegalStateException("类别数至少为2（含背景）: " + numClasses);
        }
        if (boxes.length < numQueries * 4 || logits.length < numQueries * numClasses) {
            throw new IllegalStateException(String.format(
                    "输出张量长度不足: boxes=%d, logits=%d, D=%d, C=%d",
                    boxes.length, logits.length, numQueries, numClasses));
        }

        float res = (float) resolution;
        List<Integer> kept = new ArrayList<>();

        for (int d = 0; d < numQueries; d++) {
            if (maxDetections > 0 && kept.size() >= maxDetections) {
                break;
            }

            int row = d * numClasses;
            float bestScore = ProcessingUtils.sigmoid(logits[row + 1]);
            int bestIndex = 1;
            for (int c = 2; c < numClasses; c++) {
                float score = ProcessingUtils.sigmoid(logits[row + c]);
                if (score > bestScore) {
                    bestScore = score;
                    bestIndex = c;
                }
            }

            if (bestScore <= threshold) {
                continue;
            }

            int b = d * 4;
            BoundingBox box = ProcessingUtils.cxcywhToXyxy(
                    boxes[b] * res, boxes[b + 1] * res, boxes[b + 2] * res, boxes[b + 3] * res);
            out.add(bestScore, bestIndex - 1, ProcessingUtils.scaleBox(box, scaleW, scaleH));
            kept.add(d);
        }

        return kept;
    }

    /**
     * 为保留的检测生成掩码：先按 maskThreshold 二值化，再最近邻缩放到原图尺寸
     *
     * @param maskLogits 形状 [1, D, maskH, maskW]
     */
    public static void decodeMasks(float[] maskLogits, int numQueries, int maskH, int maskW, List<Integer> kept,
                                   float maskThreshold, int origW, int origH, DetectionSet out) {
        int maskSize = maskH * maskW;
        if (maskLogits.length < numQueries * maskSize) {
            throw new IllegalStateException(String.format(
                    "掩码张量长度不足: %d < %d x %dx%d", maskLogits.length, numQueries, maskH, maskW));
        }

        for (int d : kept) {
            byte[] binary = new byte[maskSize];
            int offset = d * maskSize;
            for (int i = 0; i < maskSize; i++) {
                binary[i] = maskLogits[offset + i] > maskThreshold ? (byte) 1 : (byte) 0;
            }
            out.addMask(resizeNearest(new BinaryMask(maskW, maskH, binary), origW, origH));
        }
    }

    static BinaryMask resizeNearest(BinaryMask src, int width, int height) {
        if (src.getWidth() == width && src.getHeight() == height) {
            return src;
        }
        byte[] dst = new byte[width * height];
        byte[] data = src.getData();
        float sx = (float) src.getWidth() / width;
        float sy = (float) src.getHeight() / height;
        for (int y = 0; y < height; y++) {
            int srcY = Math.min((int) (y * sy), src.getHeight() - 1);
            int srcRow = srcY * src.getWidth();
            int dstRow = y * width;
            for (int x = 0; x < width; x++) {
                int srcX = Math.min((int) (x * sx), src.getWidth() - 1);
                dst[dstRow + x] = data[srcRow + srcX];
            }
        }
        return new BinaryMask(width, height, dst);
    }
}
