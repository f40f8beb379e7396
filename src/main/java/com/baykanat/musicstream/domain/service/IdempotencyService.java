package com.baykanat.musicstream.domain.service;

import com.baykanat.musicstream.api.dto.PlayEventRequest;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** event_id gelmeyen payload'lar için user_id + track_id + timestamp + device'tan SHA-256 event id üretir. */
@Service
public class IdempotencyService {

    private static final String SEPARATOR = "|";

    /** 64 karakterlik hex event id; aynı payload tekrar gönderilirse aynı id çıkar. */
    public String generateEventId(PlayEventRequest event) {
        String raw = event.getUserId() + SEPARATOR
                + event.getTrackId() + SEPARATOR
                + event.getTimestamp() + SEPARATOR
                + (event.getDevice() != null ? event.getDevice() : "");

        return sha256(raw);
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
