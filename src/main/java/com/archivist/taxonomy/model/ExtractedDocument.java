package com.archivist.taxonomy.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ExtractedDocument(
    UUID id,
    UUID sessionId,
    String fileName,
    String storagePath,
    String extractedText,
    String emailSubject,
    String emailSender,
    OffsetDateTime emailDate,
    String folderPath,
    String contentHash,
    TriageStatus triageStatus,
    Double triageConfidence,
    String triageReason,
    UUID duplicateGroupId,
    boolean canonical,
    boolean embedded,
    String embeddingError,
    UUID clusterId,
    Double clusterConfidence,
    ValidationStatus validationStatus,
    String reclassificationNote,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    public static ExtractedDocument newDocument(UUID sessionId, String fileName, String extractedText,
                                                String emailSubject, String emailSender) {
        return new ExtractedDocument(
            null, sessionId, fileName, null, extractedText, emailSubject, emailSender, null, null,
            null, null, null, null, null, false, false, null, null, null,
            ValidationStatus.PENDING, null, null, null
        );
    }

    public int metadataCompleteness() {
        int score = 0;
        if (fileName != null && !fileName.isBlank()) score++;
        if (emailSubject != null && !emailSubject.isBlank()) score++;
        if (emailSender != null && !emailSender.isBlank()) score++;
        if (emailDate != null) score++;
        if (folderPath != null && !folderPath.isBlank()) score++;
        return score;
    }

    public boolean hasText() {
        return extractedText != null && !extractedText.isBlank();
    }
}
