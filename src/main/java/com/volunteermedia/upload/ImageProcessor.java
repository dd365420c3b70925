package com.volunteermedia.upload;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

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
import java.io.UncheckedIOException;
import java.util.Iterator;

/**
 * Downscales and re-encodes uploaded images.
 *
 * Formats ImageIO can decode (JPEG, PNG, GIF, BMP) are scaled so the longest side is at most
 * {@link #MAX_DIMENSION} and written as JPEG. Anything else (WEBP, HEIC) is stored unchanged.
 */
@Component
@Slf4j
public class ImageProcessor {

    public static final int MAX_DIMENSION = 1200;
    static final float JPEG_QUALITY = 0.85f;

    public ProcessedImage process(byte[] data, String detectedType) {
        BufferedImage source;
        try {
            source = ImageIO.read(new ByteArrayInputStream(data));
        } catch (IOException e) {
            log.debug("ImageIO could not decode upload ({}): {}", detectedType, e.getMessage());
            source = null;
        }

        if (source == null) {
            return new ProcessedImage(data, detectedType, 0, 0);
        }

        BufferedImage scaled = scale(source);
        byte[] jpeg = encodeJpeg(scaled);
        return new ProcessedImage(jpeg, "image/jpeg", scaled.getWidth(), scaled.getHeight());
    }

    static BufferedImage scale(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        int longest = Math.max(width, height);

        int targetWidth = width;
        int targetHeight = height;
        if (longest > MAX_DIMENSION) {
            double ratio = (double) MAX_DIMENSION / longest;
            targetWidth = Math.max(1, (int) Math.round(width * ratio));
            targetHeight = Math.max(1, (int) Math.round(height * ratio));
        }

        // JPEG has no alpha channel; transparent pixels become white
        BufferedImage target = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, targetWidth, targetHeight);
            g.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    static byte[] encodeJpeg(BufferedImage image) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IllegalStateException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(stream);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(JPEG_QUALITY);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode JPEG", e);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }
}
