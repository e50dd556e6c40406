package com.propgate.backend.modules.intercom.application;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Iterator;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

import com.propgate.backend.global.error.ProblemException;
import com.propgate.backend.modules.intercom.domain.FacePayload;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Validates base64 face images and derives their content hashes. Image bytes never leave
 * this class; callers only see hashes and detected mime types.
 */
@Component
public class FaceImageProcessor {

    static final String MIME_JPEG = "image/jpeg";
    static final String MIME_PNG = "image/png";
    static final String MIME_GIF = "image/gif";
    static final String MIME_BMP = "image/bmp";
    static final String MIME_WEBP = "image/webp";

    private final int maxImageBytes;
    private final int maxDimension;

    public FaceImageProcessor(
            @Value("${app.access.face.max-image-bytes:5242880}") int maxImageBytes,
            @Value("${app.access.face.max-dimension:2048}") int maxDimension
    ) {
        this.maxImageBytes = maxImageBytes;
        this.maxDimension = maxDimension;
    }

    public FaceHashes processAll(FacePayload payload) {
        if (payload == null) {
            throw ProblemException.invalid("INVALID_IMAGE", "face images are required");
        }
        return new FaceHashes(
                process(payload.frontImage(), "frontImage"),
                process(payload.leftImage(), "leftImage"),
                process(payload.rightImage(), "rightImage")
        );
    }

    public ProcessedImage process(String encodedImage, String fieldName) {
        if (encodedImage == null || encodedImage.isBlank()) {
            throw ProblemException.invalid("INVALID_IMAGE", fieldName + " is required");
        }
        String base64 = stripDataUrlPrefix(encodedImage).replaceAll("\\s", "");
        if ((long) base64.length() * 3 / 4 > maxImageBytes + 2L) {
            throw ProblemException.invalid("INVALID_IMAGE", fieldName + " exceeds " + maxImageBytes + " bytes");
        }

        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(base64.getBytes(StandardCharsets.US_ASCII));
        } catch (IllegalArgumentException ex) {
            throw ProblemException.invalid("INVALID_IMAGE", fieldName + " is not valid base64");
        }
        if (bytes.length == 0) {
            throw ProblemException.invalid("INVALID_IMAGE", fieldName + " is empty");
        }
        if (bytes.length > maxImageBytes) {
            throw ProblemException.invalid("INVALID_IMAGE", fieldName + " exceeds " + maxImageBytes + " bytes");
        }

        String mimeType = detectMimeType(bytes);
        if (mimeType == null) {
            throw ProblemException.invalid("INVALID_IMAGE", fieldName + " has an unsupported image format");
        }
        checkDimensions(bytes, mimeType, fieldName);
        return new ProcessedImage(sha256Hex(bytes), mimeType, bytes.length);
    }

    static String detectMimeType(byte[] bytes) {
        if (startsWith(bytes, 0xFF, 0xD8, 0xFF)) {
            return MIME_JPEG;
        }
        if (startsWith(bytes, 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A)) {
            return MIME_PNG;
        }
        if (startsWith(bytes, 0x47, 0x49, 0x46, 0x38)) {
            return MIME_GIF;
        }
        if (startsWith(bytes, 0x42, 0x4D)) {
            return MIME_BMP;
        }
        // RIFF....WEBP
        if (bytes.length >= 12
                && startsWith(bytes, 0x52, 0x49, 0x46, 0x46)
                && bytes[8] == 'W' && bytes[9] == 'E' && bytes[10] == 'B' && bytes[11] == 'P') {
            return MIME_WEBP;
        }
        return null;
    }

    public static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    /**
     * Reads the declared size from the image header and rejects oversized images before any
     * pixel data is decoded. Decoding failures of any kind are reported as INVALID_IMAGE.
     */
    private void checkDimensions(byte[] bytes, String mimeType, String fieldName) {
        // the JDK ships no WebP reader
        if (MIME_WEBP.equals(mimeType)) {
            return;
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            if (input == null) {
                throw corrupted(fieldName);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw corrupted(fieldName);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width > maxDimension || height > maxDimension) {
                    throw ProblemException.invalid(
                            "INVALID_IMAGE",
                            fieldName + " exceeds " + maxDimension + "x" + maxDimension + " pixels"
                    );
                }
                if (reader.read(0) == null) {
                    throw corrupted(fieldName);
                }
            } finally {
                reader.dispose();
            }
        } catch (ProblemException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            throw corrupted(fieldName);
        }
    }

    private static ProblemException corrupted(String fieldName) {
        return ProblemException.invalid("INVALID_IMAGE", fieldName + " is corrupted");
    }

    private static String stripDataUrlPrefix(String value) {
        String trimmed = value.trim();
        if (trimmed.startsWith("data:")) {
            int comma = trimmed.indexOf(',');
            return comma >= 0 ? trimmed.substring(comma + 1) : "";
        }
        return trimmed;
    }

    private static boolean startsWith(byte[] bytes, int... signature) {
        if (bytes.length < signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if ((bytes[i] & 0xFF) != signature[i]) {
                return false;
            }
        }
        return true;
    }

    public record ProcessedImage(String sha256, String mimeType, int sizeBytes) {
    }

    public record FaceHashes(ProcessedImage front, ProcessedImage left, ProcessedImage right) {
    }
}
