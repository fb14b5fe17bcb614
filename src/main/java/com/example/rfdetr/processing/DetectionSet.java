package com.example.rfdetr.processing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一帧的解码结果。scores / classIds / boxes（分割模式下还有masks）按下标一一对应。
 */
public class DetectionSet {

    private final List<Float> scores = new ArrayList<>();
    private final List<Integer> classIds = new ArrayList<>();
    private final List<BoundingBox> boxes = new ArrayList<>();
    private final List<BinaryMask> masks = new ArrayList<>();

    public void add(float score, int classId, BoundingBox box) {
        scores.add(score);
        classIds.add(classId);
        boxes.add(box);
    }

    public void addMask(BinaryMask mask) {
        masks.add(mask);
    }

    /**
     * 清空上一帧遗留的结果
     */
    public void clear() {
        scores.clear();
        classIds.clear();
        boxes.clear();
        masks.clear();
    }

    public int size() {
        return scores.size();
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    public float getScore(int i) {
        return scores.get(i);
    }

    public int getClassId(int i) {
        return classIds.get(i);
    }

    public BoundingBox getBox(int i) {
        return boxes.get(i);
    }

    public List<Float> getScores() {
        return Collections.unmodifiableList(scores);
    }

    public List<Integer> getClassIds() {
        return Collections.unmodifiableList(classIds);
    }

    public List<BoundingBox> getBoxes() {
        return Collections.unmodifiableList(boxes);
    }

    public List<BinaryMask> getMasks() {
        return Collections.unmodifiableList(masks);
    }

    public boolean hasMasks() {
        return !masks.isEmpty();
    }
}
