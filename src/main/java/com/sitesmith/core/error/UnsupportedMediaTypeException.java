package com.sitesmith.core.error;

/**
 * Raised when an uploaded file is not one of the accepted raster image types.
 */
public class UnsupportedMediaTypeException extends ValidationException {

    private final String contentType;

    public UnsupportedMediaTypeException(String contentType) {
        super(ErrorKind.UNSUPPORTED_MEDIA_TYPE,
                "Only PNG, JPEG, GIF, and WebP images are allowed (got " + contentType + ")");
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }
}
