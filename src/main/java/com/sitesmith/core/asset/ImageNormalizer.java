package com.sitesmith.core.asset;

import com.sitesmith.core.error.ValidationException;
import org.springframework.stereotype.Component;
import org.w3c.dom.Node;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;

/**
 * Re-encodes uploads as PNG with the asset description embedded as an
 * {@code iTXt} chunk under the {@code Description} keyword. iTXt is UTF-8, so
 * captions in any language survive.
 */
@Component
public class ImageNormalizer {

    static final String CANONICAL_CONTENT_TYPE = "image/png";
    static final String DESCRIPTION_KEYWORD = "Description";
    private static final String PNG_METADATA_FORMAT = "javax_imageio_png_1.0";

    public NormalizedImage normalize(byte[] source, SupportedImageType sourceType, String filename, String description) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(source));
        } catch (IOException e) {
            throw new ValidationException("Failed to decode image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ValidationException("Failed to decode image: no reader for " + sourceType.contentType());
        }

        String targetName = sourceType == SupportedImageType.PNG ? filename : withExtension(filename, "png");
        return new NormalizedImage(encodePng(image, description), targetName, CANONICAL_CONTENT_TYPE);
    }

    static String withExtension(String filename, String extension) {
        int dot = filename.lastIndexOf('.');
        String stem = dot > 0 ? filename.substring(0, dot) : filename;
        return stem + "." + extension;
    }

    /**
     * Reads back the embedded description of a PNG produced by
     * {@link #normalize}.
     */
    public static Optional<String> embeddedDescription(byte[] png) {
        try (var input = ImageIO.createImageInputStream(new ByteArrayInputStream(png))) {
            var readers = ImageIO.getImageReadersByFormatName("png");
            if (!readers.hasNext()) return Optional.empty();
            var reader = readers.next();
            try {
                reader.setInput(input, true, false);
                Node root = reader.getImageMetadata(0).getAsTree(PNG_METADATA_FORMAT);
                for (Node chunk = root.getFirstChild(); chunk != null; chunk = chunk.getNextSibling()) {
                    if (!"iTXt".equals(chunk.getNodeName())) continue;
                    for (Node entry = chunk.getFirstChild(); entry != null; entry = entry.getNextSibling()) {
                        var element = (IIOMetadataNode) entry;
                        if (DESCRIPTION_KEYWORD.equals(element.getAttribute("keyword"))) {
                            return Optional.of(element.getAttribute("text"));
                        }
                    }
                }
                return Optional.empty();
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new ValidationException("Failed to read PNG metadata: " + e.getMessage(), e);
        }
    }

    private byte[] encodePng(BufferedImage image, String description) {
        ImageWriter writer = ImageIO.getImageWritersByFormatName("png").next();
        try (var out = new ByteArrayOutputStream();
             var imageOut = ImageIO.createImageOutputStream(out)) {
            var param = writer.getDefaultWriteParam();
            IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param);
            metadata.mergeTree(PNG_METADATA_FORMAT, descriptionTree(description));

            writer.setOutput(imageOut);
            writer.write(null, new IIOImage(image, null, metadata), param);
            imageOut.flush();
            return out.toByteArray();
        } catch (IIOInvalidTreeException e) {
            throw new IllegalStateException("PNG writer rejected description metadata", e);
        } catch (IOException e) {
            throw new ValidationException("Failed to encode image: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
    }

    private static IIOMetadataNode descriptionTree(String description) {
        var entry = new IIOMetadataNode("iTXtEntry");
        entry.setAttribute("keyword", DESCRIPTION_KEYWORD);
        entry.setAttribute("compressionFlag", "FALSE");
        entry.setAttribute("compressionMethod", "0");
        entry.setAttribute("languageTag", "");
        entry.setAttribute("translatedKeyword", "");
        entry.setAttribute("text", description == null ? "" : description);

        var chunk = new IIOMetadataNode("iTXt");
        chunk.appendChild(entry);
        var root = new IIOMetadataNode(PNG_METADATA_FORMAT);
        root.appendChild(chunk);
        return root;
    }
}
