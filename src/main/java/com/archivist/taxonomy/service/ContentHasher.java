package com.archivist.taxonomy.service;

import lombok.SneakyThrows;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

@Component
public class ContentHasher {

    private static final Pattern INVISIBLE = Pattern.compile("[\\u200B\\u200C\\u200D\\u2060\\uFEFF]");
    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String normalize(String text) {
        if (text == null) {
            return "";
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC);
        normalized = INVISIBLE.matcher(normalized).replaceAll("");
        normalized = LINE_BREAKS.matcher(normalized).replaceAll("\n");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        return normalized.strip();
    }

    public Optional<String> hash(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(sha256(normalized));
    }

    public UUID groupId(UUID sessionId, String contentHash) {
        return UUID.nameUUIDFromBytes((sessionId + "|" + contentHash).getBytes(StandardCharsets.UTF_8));
    }

    @SneakyThrows
    private static String sha256(String value) {
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    }
}
