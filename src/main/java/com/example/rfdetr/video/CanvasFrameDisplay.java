package com.example.rfdetr.video;

import com.example.rfdetr.pipeline.FrameDisplay;
import org.bytedeco.javacv.CanvasFrame;

import javax.swing.WindowConstants;
import java.awt.event.KeyEvent;
import java.awt.image.BufferedImage;

/**
 * JavaCV CanvasFrame 预览窗口，按ESC或关闭窗口停止
 */
public class CanvasFrameDisplay implements FrameDisplay {

    private final CanvasFrame canvas;

    public CanvasFrameDisplay(String title) {
        this.canvas = new CanvasFrame(title);
        this.canvas.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
    }

    @Override
    public boolean show(BufferedImage frame) throws InterruptedException {
        if (!canvas.isVisible()) {
            return false;
        }
        canvas.showImage(frame);
        KeyEvent key = canvas.waitKey(1);
        return key == null || key.getKeyCode() != KeyEvent.VK_ESCAPE;
    }

    @Override
    public void close() {
        canvas.dispose();
    }
}
