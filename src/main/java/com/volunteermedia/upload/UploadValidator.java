package com.volunteermedia.upload;

import com.volunteermedia.exception.BadRequestException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Size, extension and magic-byte checks for uploaded images and protocol documents.
 *
 * The extension is only trusted once the leading bytes agree with it. Every failure is a
 * {@link BadRequestException} whose message is returned to the client as-is.
 */
public final class UploadValidator {

    public static final long MAX_IMAGE_SIZE = 10L * 1024 * 1024;
    public static final long MAX_HERO_IMAGE_SIZE = 5L * 1024 * 1024;
    public static final long MAX_DOCUMENT_SIZE = 20L * 1024 * 1024;

    public static final String PDF_TYPE = "application/pdf";
    public static final String DOCX_TYPE = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    static final Set<String> IMAGE_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".gif", ".webp", ".heic", ".heif");

    static final Map<String, String> DOCUMENT_TYPES = Map.of(
            ".pdf", PDF_TYPE,
            ".docx", DOCX_TYPE);

    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] PNG = {(byte) 0x89, 0x50, 0x4E, 0x47};
    private static final byte[] GIF = {0x47, 0x49, 0x46};
    private static final byte[] RIFF = {0x52, 0x49, 0x46, 0x46};
    private static final byte[] WEBP = {0x57, 0x45, 0x42, 0x50};
    private static final byte[] FTYP = {0x66, 0x74, 0x79, 0x70};
    private static final byte[] PDF = {0x25, 0x50, 0x44, 0x46};
    private static final byte[] ZIP = {0x50, 0x4B, 0x03, 0x04};

    private UploadValidator() {
    }

    /**
     * Validate an image upload.
     *
     * @return the content type implied by the file's leading bytes
     */
    public static String validateImage(String fileName, byte[] data, long maxSize) {
        checkSize(data, maxSize);

        String ext = extension(fileName);
        if (!IMAGE_EXTENSIONS.contains(ext)) {
            throw new BadRequestException("extension " + displayExtension(ext) + " is not allowed");
        }

        String detected = detectImageType(data);
        if (detected == null) {
            throw new BadRequestException("file does not appear to be a valid image");
        }
        return detected;
    }

    /**
     * Validate a protocol document (PDF or DOCX).
     *
     * @return the MIME type for the document's extension
     */
    public static String validateDocument(String fileName, byte[] data) {
        checkSize(data, MAX_DOCUMENT_SIZE);

        String ext = extension(fileName);
        String type = DOCUMENT_TYPES.get(ext);
        if (type == null) {
            throw new BadRequestException("extension " + displayExtension(ext) + " is not allowed");
        }

        if (".pdf".equals(ext) && !startsWith(data, PDF)) {
            throw new BadRequestException("file does not appear to be a valid PDF document");
        }
        if (".docx".equals(ext) && !startsWith(data, ZIP)) {
            throw new BadRequestException("file does not appear to be a valid DOCX document");
        }
        return type;
    }

    /**
     * Content type for the image format recognised from the leading bytes, or {@code null}.
     */
    static String detectImageType(byte[] data) {
        if (startsWith(data, JPEG)) {
            return "image/jpeg";
        }
        if (startsWith(data, PNG)) {
            return "image/png";
        }
        if (startsWith(data, GIF)) {
            return "image/gif";
        }
        if (startsWith(data, RIFF) && data.length >= 12
                && Arrays.equals(Arrays.copyOfRange(data, 8, 12), WEBP)) {
            return "image/webp";
        }
        // ISO base media file: 4-byte box size, then "ftyp"
        if (data.length >= 12 && Arrays.equals(Arrays.copyOfRange(data, 4, 8), FTYP)) {
            return "image/heic";
        }
        return null;
    }

    /**
     * Keep letters, digits, dash, underscore and space in the base name; cap it at 100 chars.
     */
    public static String sanitizeFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "upload";
        }
        String name = fileName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);

        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";

        StringBuilder cleaned = new StringBuilder(base.length());
        for (char c : base.toCharArray()) {
            boolean allowed = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '_' || c == ' ';
            cleaned.append(allowed ? c : '-');
        }
        String safeBase = cleaned.length() > 100 ? cleaned.substring(0, 100) : cleaned.toString();
        if (!ext.matches("\\.[a-z0-9]{1,10}")) {
            ext = "";
        }
        return safeBase + ext;
    }

    static String extension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static String displayExtension(String ext) {
        return ext.isEmpty() ? "(none)" : ext;
    }

    private static void checkSize(byte[] data, long maxSize) {
        if (data == null || data.length == 0) {
            throw new BadRequestException("file is empty");
        }
        if (data.length > maxSize) {
            throw new BadRequestException("file size exceeds maximum limit");
        }
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
