package com.sitesmith.core.asset;

import com.sitesmith.core.error.ValidationException;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Reads image dimensions from the header without decoding the pixel data.
 * WebP support comes from the TwelveMonkeys ImageIO plugin on the classpath.
 */
@Component
public class ImageInspector {

    public ImageGeometry inspect(byte[] bytes) {
        try (var input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            var readers = input == null ? null : ImageIO.getImageReaders(input);
            if (readers == null || !readers.hasNext()) {
                throw new ValidationException("Failed to read image metadata: unrecognized image data");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return ImageGeometry.of(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new ValidationException("Failed to read image metadata: " + e.getMessage(), e);
        }
    }
}
