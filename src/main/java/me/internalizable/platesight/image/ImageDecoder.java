package me.internalizable.platesight.image;

import me.internalizable.platesight.model.CapturedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Clock;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Turns a base64 payload (raw or {@code data:image/...;base64,} URL) into a {@link CapturedImage}.
 */
@Component
public class ImageDecoder {

    private static final Logger logger = LoggerFactory.getLogger(ImageDecoder.class);

    private static final Pattern DATA_URL_PREFIX = Pattern.compile("^data:image/[^;]+;base64,");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Clock clock;

    public ImageDecoder(Clock clock) {
        this.clock = clock;
    }

    public CapturedImage decode(String payload) {
        byte[] bytes = decodeBase64(payload);
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw new InvalidImageException("Unable to read image data", e);
        }
        if (image == null) {
            throw new InvalidImageException("Unsupported image format");
        }
        logger.debug("Decoded {}x{} image ({} bytes)", image.getWidth(), image.getHeight(), bytes.length);
        return CapturedImage.fromBufferedImage(bytes, image, clock.instant());
    }

    public static byte[] decodeBase64(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new InvalidImageException("Image data is required");
        }
        String base64 = WHITESPACE.matcher(stripDataUrlPrefix(payload.trim())).replaceAll("");
        try {
            byte[] bytes = Base64.getDecoder().decode(base64);
            if (bytes.length == 0) {
                throw new InvalidImageException("Image data is empty");
            }
            return bytes;
        } catch (IllegalArgumentException e) {
            throw new InvalidImageException("Image data is not valid base64", e);
        }
    }

    public static String stripDataUrlPrefix(String payload) {
        return DATA_URL_PREFIX.matcher(payload).replaceFirst("");
    }
}
