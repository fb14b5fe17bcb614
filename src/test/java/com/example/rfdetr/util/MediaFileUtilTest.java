package com.example.rfdetr.util;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class MediaFileUtilTest {

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    @Test
    public void testVideoExtensions() {
        assertTrue(MediaFileUtil.isVideoFile("a.mp4"));
        assertTrue(MediaFileUtil.isVideoFile("/data/clip.MKV"));
        assertTrue(MediaFileUtil.isVideoFile("x.webm"));
        assertTrue(MediaFileUtil.isVideoFile("x.wmv"));
        assertFalse(MediaFileUtil.isVideoFile("photo.jpg"));
        assertFalse(MediaFileUtil.isVideoFile("noext"));
        assertFalse(MediaFileUtil.isVideoFile("trailing."));
        assertFalse(MediaFileUtil.isVideoFile(null));
    }

    @Test
    public void testGetExtension() {
        assertEquals("png", MediaFileUtil.getExtension("dir.v2/out.PNG"));
        assertNull(MediaFileUtil.getExtension("dir.v2/out"));
    }

    @Test
    public void testEnsureParentDirectory() throws IOException {
        Path target = tempFolder.getRoot().toPath().resolve("a/b/out.jpg");

        MediaFileUtil.ensureParentDirectory(target);

        assertTrue(Files.isDirectory(target.getParent()));
        assertFalse(Files.exists(target));
    }
}
