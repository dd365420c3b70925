package com.volunteermedia.upload;

import com.volunteermedia.exception.BadRequestException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadValidatorTest {

    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 0x10};
    private static final byte[] PNG = {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A};

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.ISO_8859_1);
    }

    @Test
    void recognisesImageFormatsByMagicBytes() {
        assertThat(UploadValidator.validateImage("dog.jpg", JPEG, UploadValidator.MAX_IMAGE_SIZE))
                .isEqualTo("image/jpeg");
        assertThat(UploadValidator.validateImage("dog.PNG", PNG, UploadValidator.MAX_IMAGE_SIZE))
                .isEqualTo("image/png");
        assertThat(UploadValidator.validateImage("dog.gif", ascii("GIF89a"), UploadValidator.MAX_IMAGE_SIZE))
                .isEqualTo("image/gif");
        assertThat(UploadValidator.validateImage("dog.webp", ascii("RIFF\0\0\0\0WEBPVP8 "), UploadValidator.MAX_IMAGE_SIZE))
                .isEqualTo("image/webp");
        assertThat(UploadValidator.validateImage("dog.heic", ascii("\0\0\0\u0018ftypheic"), UploadValidator.MAX_IMAGE_SIZE))
                .isEqualTo("image/heic");
    }

    @Test
    void rejectsImageWhoseBytesDoNotMatch() {
        assertThatThrownBy(() -> UploadValidator.validateImage("dog.jpg", ascii("<html></html>"),
                UploadValidator.MAX_IMAGE_SIZE))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("file does not appear to be a valid image");
    }

    @Test
    void rejectsDisallowedExtension() {
        assertThatThrownBy(() -> UploadValidator.validateImage("script.exe", JPEG, UploadValidator.MAX_IMAGE_SIZE))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("extension .exe is not allowed");
    }

    @Test
    void rejectsEmptyAndOversizedFiles() {
        assertThatThrownBy(() -> UploadValidator.validateImage("dog.jpg", new byte[0], UploadValidator.MAX_IMAGE_SIZE))
                .hasMessage("file is empty");

        byte[] big = new byte[(int) UploadValidator.MAX_HERO_IMAGE_SIZE + 1];
        big[0] = (byte) 0xFF;
        big[1] = (byte) 0xD8;
        big[2] = (byte) 0xFF;
        assertThatThrownBy(() -> UploadValidator.validateImage("hero.jpg", big, UploadValidator.MAX_HERO_IMAGE_SIZE))
                .hasMessage("file size exceeds maximum limit");
        assertThat(UploadValidator.validateImage("hero.jpg", big, UploadValidator.MAX_IMAGE_SIZE))
                .isEqualTo("image/jpeg");
    }

    @Test
    void acceptsPdfAndDocx() {
        assertThat(UploadValidator.validateDocument("plan.pdf", ascii("%PDF-1.7\n")))
                .isEqualTo(UploadValidator.PDF_TYPE);
        assertThat(UploadValidator.validateDocument("plan.docx", new byte[]{0x50, 0x4B, 0x03, 0x04, 0x14}))
                .isEqualTo(UploadValidator.DOCX_TYPE);
    }

    @Test
    void rejectsDocumentsWithWrongSignature() {
        assertThatThrownBy(() -> UploadValidator.validateDocument("plan.pdf", ascii("hello")))
                .hasMessage("file does not appear to be a valid PDF document");
        assertThatThrownBy(() -> UploadValidator.validateDocument("plan.docx", ascii("%PDF-1.7")))
                .hasMessage("file does not appear to be a valid DOCX document");
        assertThatThrownBy(() -> UploadValidator.validateDocument("plan.doc", ascii("%PDF-1.7")))
                .hasMessage("extension .doc is not allowed");
    }

    @Test
    void sanitizesFileNames() {
        assertThat(UploadValidator.sanitizeFileName("../../etc/passwd")).isEqualTo("passwd");
        assertThat(UploadValidator.sanitizeFileName("C:\\Users\\me\\Buddy's plan.PDF")).isEqualTo("Buddy-s plan.pdf");
        assertThat(UploadValidator.sanitizeFileName("  ")).isEqualTo("upload");
        assertThat(UploadValidator.sanitizeFileName("x".repeat(150) + ".png")).hasSize(104);
    }
}
