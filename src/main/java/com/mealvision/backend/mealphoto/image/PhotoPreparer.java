package com.mealvision.backend.mealphoto.image;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * 送進 vision 模型前的照片整理：
 * 透明底補白、轉 RGB、長邊超過上限就等比縮小，最後一律輸出 JPEG。
 */
@Slf4j
public class PhotoPreparer {

    private static final float JPEG_QUALITY = 0.85f;

    private final int maxDimension;

    public PhotoPreparer(int maxDimension) {
        if (maxDimension <= 0) throw new IllegalArgumentException("maxDimension must be > 0");
        this.maxDimension = maxDimension;
    }

    public record PreparedPhoto(byte[] bytes, String mimeType, int width, int height) {}

    /**
     * @throws IllegalArgumentException 格式不支援或檔案壞掉
     * @throws IOException 讀寫失敗
     */
    public PreparedPhoto prepare(byte[] original) throws IOException {
        if (original == null || original.length == 0) throw new IllegalArgumentException("EMPTY_IMAGE");

        byte[] head = new byte[Math.min(16, original.length)];
        System.arraycopy(original, 0, head, 0, head.length);
        if (ImageSniffer.detect(head).isEmpty()) {
            throw new IllegalArgumentException("UNSUPPORTED_IMAGE_FORMAT");
        }

        BufferedImage src = ImageIO.read(new ByteArrayInputStream(original));
        if (src == null) throw new IllegalArgumentException("CORRUPTED_IMAGE");

        int w = src.getWidth();
        int h = src.getHeight();
        int tw = w;
        int th = h;
        if (w > maxDimension || h > maxDimension) {
            double ratio = Math.min((double) maxDimension / w, (double) maxDimension / h);
            tw = Math.max(1, (int) Math.round(w * ratio));
            th = Math.max(1, (int) Math.round(h * ratio));
            log.info("photo_resized from={}x{} to={}x{}", w, h, tw, th);
        }

        BufferedImage rgb = new BufferedImage(tw, th, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, tw, th);
            g.drawImage(src, 0, 0, tw, th, null);
        } finally {
            g.dispose();
        }

        return new PreparedPhoto(writeJpeg(rgb), "image/jpeg", tw, th);
    }

    private static byte[] writeJpeg(BufferedImage img) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) throw new IOException("JPEG_WRITER_UNAVAILABLE");
        ImageWriter writer = writers.next();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(JPEG_QUALITY);
            writer.write(null, new IIOImage(img, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }
}
