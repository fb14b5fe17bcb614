package com.example.rfdetr.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

public final class MediaFileUtil {

    private static final Set<String> VIDEO_EXTENSIONS =
            Set.of("mp4", "avi", "mov", "mkv", "webm", "flv", "wmv");

    private MediaFileUtil() {
    }

    public static Set<String> getVideoExtensions() {
        return VIDEO_EXTENSIONS;
    }

    /**
     * 按扩展名判断是否为视频文件（不区分大小写）
     */
    public static boolean isVideoFile(String path) {
        String extension = getExtension(path);
        return extension != null && VIDEO_EXTENSIONS.contains(extension);
    }

    /**
     * 小写扩展名，不含点；没有扩展名时返回null
     */
    public static String getExtension(String path) {
        if (path == null) {
            return null;
        }
        Path fileNamePath = Path.of(path).getFileName();
        if (fileNamePath == null) {
            return null;
        }
        String fileName = fileNamePath.toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return null;
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * 创建输出文件所在目录
     */
    public static void ensureParentDirectory(Path file) throws IOException {
        Path outputDir = file.toAbsolutePath().getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            Files.createDirectories(outputDir);
        }
    }
}
