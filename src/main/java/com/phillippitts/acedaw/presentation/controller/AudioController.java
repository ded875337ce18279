package com.phillippitts.acedaw.presentation.controller;

import com.phillippitts.acedaw.exception.AudioBlobNotFoundException;
import com.phillippitts.acedaw.service.audio.AudioBlobKey;
import com.phillippitts.acedaw.service.audio.AudioBlobStore;
import com.phillippitts.acedaw.service.audio.AudioVariant;
import com.phillippitts.acedaw.service.isolation.TrackIsolationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

import static com.phillippitts.acedaw.util.FutureUtils.await;

/**
 * Per-clip audio blob endpoints and track isolation.
 */
@RestController
@RequestMapping("/api/projects/{projectId}/clips/{clipId}")
class AudioController {

    private final AudioBlobStore blobs;
    private final TrackIsolationService isolation;

    AudioController(AudioBlobStore blobs, TrackIsolationService isolation) {
        this.blobs = blobs;
        this.isolation = isolation;
    }

    @PutMapping(value = "/audio/{variant}", consumes = MediaType.ALL_VALUE)
    ResponseEntity<Map<String, String>> put(@PathVariable String projectId,
                                            @PathVariable String clipId,
                                            @PathVariable String variant,
                                            @RequestBody byte[] payload) {
        String key = await(blobs.save(projectId, clipId, parseVariant(variant), payload));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("key", key));
    }

    @GetMapping("/audio/{variant}")
    ResponseEntity<byte[]> get(@PathVariable String projectId,
                               @PathVariable String clipId,
                               @PathVariable String variant) {
        AudioVariant v = parseVariant(variant);
        byte[] payload = await(blobs.load(projectId, clipId, v))
                .orElseThrow(() -> new AudioBlobNotFoundException(new AudioBlobKey(projectId, clipId, v).toKey()));
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(payload);
    }

    @DeleteMapping("/audio/{variant}")
    ResponseEntity<Void> delete(@PathVariable String projectId,
                                @PathVariable String clipId,
                                @PathVariable String variant) {
        await(blobs.delete(projectId, clipId, parseVariant(variant)));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/isolate")
    Map<String, String> isolate(@PathVariable String projectId,
                                @PathVariable String clipId,
                                @RequestParam(required = false) String previousClipId) {
        return Map.of("key", await(isolation.isolateClip(projectId, clipId, previousClipId)));
    }

    private static AudioVariant parseVariant(String segment) {
        return AudioVariant.fromKeySegment(segment)
                .orElseThrow(() -> new IllegalArgumentException("Unknown audio variant: " + segment));
    }
}
