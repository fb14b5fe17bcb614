package com.example.rfdetr.processing;

import lombok.Getter;

/**
 * 单个实例的二值掩码，按行优先存储，1表示前景
 */
@Getter
public class BinaryMask {

    private final int width;
    private final int height;
    private final byte[] data;

    public BinaryMask(int width, int height) {
        this(width, height, new byte[width * height]);
    }

    public BinaryMask(int width, int height, byte[] data) {
        if (data.length != width * height) {
            throw new IllegalArgumentException(
                    String.format("掩码数据长度不匹配: %d != %dx%d", data.length, width, height));
        }
        this.width = width;
        this.height = height;
        this.data = data;
    }

    public boolean isSet(int x, int y) {
        return data[y * width + x] != 0;
    }

    public int countNonZero() {
        int count = 0;
        for (byte b : data) {
            if (b != 0) {
                count++;
            }
        }
        return count;
    }
}
