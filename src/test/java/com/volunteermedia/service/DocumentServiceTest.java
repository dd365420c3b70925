package com.volunteermedia.service;

import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.exception.NotFoundException;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.StoredFile;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.StoredFileRepository;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.upload.UploadValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentServiceTest {

    private static final AuthenticatedUser VOLUNTEER = new AuthenticatedUser(8L, false);
    private static final byte[] DOCX = {0x50, 0x4B, 0x03, 0x04, 0x14, 0x00};

    @Mock
    private StoredFileRepository storedFileRepository;
    @Mock
    private AnimalRepository animalRepository;
    @Mock
    private GroupAccessService groupAccessService;

    @InjectMocks
    private DocumentService documentService;

    private Animal animal;

    @BeforeEach
    void setUp() {
        animal = new Animal();
        animal.setId(4L);
        animal.setGroupId(2L);
        animal.setName("Rex");
    }

    @Test
    void nonMembersCannotReadDocuments() {
        animal.setProtocolDocumentUrl("/api/documents/doc-1");
        when(animalRepository.findByProtocolDocumentUrlAndDeletedAtIsNull("/api/documents/doc-1"))
                .thenReturn(Optional.of(animal));
        when(groupAccessService.canAccess(VOLUNTEER, 2L)).thenReturn(false);

        assertThatThrownBy(() -> documentService.getDocument(VOLUNTEER, "doc-1"))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Access denied: You must be a member of this group to view this document");
        verify(storedFileRepository, never()).findByIdAndKind(anyString(), any());
    }

    @Test
    void membersGetTheStoredBytes() {
        StoredFile file = new StoredFile();
        file.setId("doc-1");
        file.setKind(StoredFile.Kind.DOCUMENT);
        when(animalRepository.findByProtocolDocumentUrlAndDeletedAtIsNull("/api/documents/doc-1"))
                .thenReturn(Optional.of(animal));
        when(groupAccessService.canAccess(VOLUNTEER, 2L)).thenReturn(true);
        when(storedFileRepository.findByIdAndKind("doc-1", StoredFile.Kind.DOCUMENT)).thenReturn(Optional.of(file));

        assertThat(documentService.getDocument(VOLUNTEER, "doc-1")).isSameAs(file);
    }

    @Test
    void unknownDocumentIsNotFound() {
        when(animalRepository.findByProtocolDocumentUrlAndDeletedAtIsNull("/api/documents/missing"))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> documentService.getDocument(VOLUNTEER, "missing"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Document not found");
    }

    @Test
    void pdfWithWrongSignatureIsRejected() {
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(4L, 2L)).thenReturn(Optional.of(animal));
        MockMultipartFile upload = new MockMultipartFile("document", "plan.pdf", "application/pdf",
                "<html>not a pdf</html>".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> documentService.uploadProtocolDocument(VOLUNTEER, 2L, 4L, upload))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("file does not appear to be a valid PDF document");
        verify(storedFileRepository, never()).save(any());
        verify(animalRepository, never()).save(any());
    }

    @Test
    void docxWithWrongSignatureIsRejected() {
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(4L, 2L)).thenReturn(Optional.of(animal));
        MockMultipartFile upload = new MockMultipartFile("document", "plan.docx", null,
                "%PDF-1.7".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> documentService.uploadProtocolDocument(VOLUNTEER, 2L, 4L, upload))
                .hasMessage("file does not appear to be a valid DOCX document");
    }

    @Test
    void newDocumentReplacesThePreviousOne() {
        animal.setProtocolDocumentUrl("/api/documents/old-doc");
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(4L, 2L)).thenReturn(Optional.of(animal));
        MockMultipartFile upload = new MockMultipartFile("document", "Rex plan.docx", null, DOCX);

        Map<String, Object> body = documentService.uploadProtocolDocument(VOLUNTEER, 2L, 4L, upload);

        ArgumentCaptor<StoredFile> stored = ArgumentCaptor.forClass(StoredFile.class);
        verify(storedFileRepository).save(stored.capture());
        assertThat(stored.getValue().getKind()).isEqualTo(StoredFile.Kind.DOCUMENT);
        assertThat(stored.getValue().getContentType()).isEqualTo(UploadValidator.DOCX_TYPE);

        assertThat(animal.getProtocolDocumentUrl()).isEqualTo("/api/documents/" + stored.getValue().getId());
        assertThat(animal.getProtocolDocumentName()).isEqualTo("Rex plan.docx");
        assertThat(animal.getProtocolDocumentUserId()).isEqualTo(8L);
        assertThat(body).containsEntry("type", UploadValidator.DOCX_TYPE).containsEntry("size", DOCX.length);
        verify(storedFileRepository).deleteById("old-doc");
    }

    @Test
    void deletingAMissingDocumentIsNotFound() {
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(4L, 2L)).thenReturn(Optional.of(animal));

        assertThatThrownBy(() -> documentService.deleteProtocolDocument(VOLUNTEER, 2L, 4L))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Animal has no protocol document");
    }
}
