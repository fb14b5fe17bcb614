package com.example.rfdetr.processing;

public enum ModelType {
    DETECTION,
    SEGMENTATION
}
