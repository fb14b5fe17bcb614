package com.example.rfdetr.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 固定数量的帧槽位，构造时一次性分配，流水线运行期间不再扩容或重建
 */
public class SlotPool {

    private final FrameSlot[] slots;
    private final int resolution;

    public SlotPool(int count, int resolution) {
        if (count <= 0) {
            throw new IllegalArgumentException("槽位数量必须大于0: " + count);
        }
        if (resolution <= 0) {
            throw new IllegalArgumentException("分辨率必须大于0: " + resolution);
        }
        this.resolution = resolution;
        this.slots = new FrameSlot[count];
        for (int i = 0; i < count; i++) {
            slots[i] = new FrameSlot(i, resolution);
        }
    }

    public FrameSlot get(int index) {
        return slots[index];
    }

    public int size() {
        return slots.length;
    }

    public int getResolution() {
        return resolution;
    }

    /**
     * 全部槽位索引 [0, count)，用于初始化空闲队列
     */
    public List<Integer> indices() {
        List<Integer> indices = new ArrayList<>(slots.length);
        for (int i = 0; i < slots.length; i++) {
            indices.add(i);
        }
        return Collections.unmodifiableList(indices);
    }
}
