package com.supplyplanner.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.supplyplanner.domain.InputSnapshot;
import com.supplyplanner.exception.InternalSolverException;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content hash of an input snapshot: SHA-256 over canonical JSON (sorted properties and map keys).
 * Equal snapshots always hash equal, which makes the hash usable as a cache key and random seed.
 */
@Component
public class SnapshotFingerprinter {

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public String fingerprint(InputSnapshot snapshot) {
        try {
            byte[] canonical = canonicalMapper.writeValueAsBytes(snapshot);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException | NoSuchAlgorithmException ex) {
            throw new InternalSolverException("Unable to fingerprint snapshot '" + snapshot.getLabel() + "'", ex);
        }
    }

    /** First 64 bits of the fingerprint. */
    public long seed(String fingerprint) {
        return Long.parseUnsignedLong(fingerprint.substring(0, 16), 16);
    }
}
