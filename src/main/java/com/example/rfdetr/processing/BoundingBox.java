package com.example.rfdetr.processing;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 角点格式边界框 (x_min, y_min, x_max, y_max)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBox {

    /** 左上角X坐标 */
    private float xMin;

    /** 左上角Y坐标 */
    private float yMin;

    /** 右下角X坐标 */
    private float xMax;

    /** 右下角Y坐标 */
    private float yMax;

    public float getWidth() {
        return xMax - xMin;
    }

    public float getHeight() {
        return yMax - yMin;
    }

    public float[] toArray() {
        return new float[]{xMin, yMin, xMax, yMax};
    }
}
