package com.example.rfdetr.processing;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 标签文件加载，每行一个类别名，忽略空行
 */
@Slf4j
public final class LabelLoader {

    private LabelLoader() {
    }

    public static List<String> load(Path path) {
        if (path == null || !Files.exists(path)) {
            throw new IllegalArgumentException("标签文件不存在: " + path);
        }

        List<String> labels;
        try {
            labels = Files.readAllLines(path, StandardCharsets.UTF_8).stream()
                    .filter(line -> !line.isEmpty())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new IllegalArgumentException("读取标签文件失败: " + path, e);
        }

        if (labels.isEmpty()) {
            throw new IllegalArgumentException("标签文件中没有标签: " + path);
        }

        log.info("加载标签 {} 个: {}", labels.size(), path);
        return labels;
    }

    /**
     * 取类别名，越界时返回 "class N"
     */
    public static String labelFor(List<String> labels, int classId) {
        if (classId >= 0 && classId < labels.size()) {
            return labels.get(classId);
        }
        return "class " + classId;
    }
}
