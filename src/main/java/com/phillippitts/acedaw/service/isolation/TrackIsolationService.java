package com.phillippitts.acedaw.service.isolation;

import com.phillippitts.acedaw.exception.AudioBlobNotFoundException;
import com.phillippitts.acedaw.service.audio.AudioBlobKey;
import com.phillippitts.acedaw.service.audio.AudioBlobStore;
import com.phillippitts.acedaw.service.audio.AudioVariant;
import com.phillippitts.acedaw.service.audio.SampleBuffer;
import com.phillippitts.acedaw.service.audio.WavDecoder;
import com.phillippitts.acedaw.service.audio.WavEncoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Produces the {@link AudioVariant#ISOLATED} blob of a clip from stored cumulative mixes.
 *
 * <p>Runs after a generation job stores a new cumulative mix. The isolated blob is always
 * recomputed from scratch and overwrites any earlier one.
 */
@Service
public class TrackIsolationService {

    private static final Logger LOG = LogManager.getLogger(TrackIsolationService.class);

    private final AudioBlobStore blobStore;

    public TrackIsolationService(AudioBlobStore blobStore) {
        this.blobStore = Objects.requireNonNull(blobStore);
    }

    /**
     * Isolates a clip's layer and stores it.
     *
     * <p>When {@code previousClipId} is null, or that clip has no stored cumulative mix, the
     * clip is the bottom layer and its cumulative payload is stored unchanged as the isolated one.
     *
     * @param projectId      owning project
     * @param clipId         clip whose layer to isolate
     * @param previousClipId clip holding the cumulative mix of the layers below, may be null
     * @return future of the isolated blob's key; fails with {@link AudioBlobNotFoundException}
     *         when the clip has no cumulative mix, or with
     *         {@link com.phillippitts.acedaw.exception.InvalidAudioException} when a mix is not
     *         decodable WAV
     */
    public CompletableFuture<String> isolateClip(String projectId, String clipId, String previousClipId) {
        AudioBlobKey currentKey = new AudioBlobKey(projectId, clipId, AudioVariant.CUMULATIVE);
        CompletableFuture<Optional<byte[]>> previousLoad = previousClipId == null
                ? CompletableFuture.completedFuture(Optional.empty())
                : blobStore.load(projectId, previousClipId, AudioVariant.CUMULATIVE);

        return blobStore.load(projectId, clipId, AudioVariant.CUMULATIVE)
                .thenCombine(previousLoad, (current, previous) -> {
                    byte[] currentWav = current.orElseThrow(
                            () -> new AudioBlobNotFoundException(currentKey.toKey()));
                    if (previous.isEmpty()) {
                        if (previousClipId != null) {
                            LOG.warn("No cumulative mix for previous clip {} of project {}; treating {} as bottom layer",
                                    previousClipId, projectId, clipId);
                        }
                        return currentWav;
                    }
                    return subtract(currentWav, previous.get());
                })
                .thenCompose(isolated -> blobStore.save(projectId, clipId, AudioVariant.ISOLATED, isolated))
                .thenApply(key -> {
                    LOG.info("Isolated clip {} of project {} -> {}", clipId, projectId, key);
                    return key;
                });
    }

    private static byte[] subtract(byte[] currentWav, byte[] previousWav) {
        SampleBuffer current = WavDecoder.decode(currentWav);
        SampleBuffer previous = WavDecoder.decode(previousWav);
        if (current.sampleRate() != previous.sampleRate()) {
            LOG.warn("Sample rate mismatch ({} Hz vs {} Hz); subtracting frame by frame without resampling",
                    current.sampleRate(), previous.sampleRate());
        }
        return WavEncoder.encodePcm16(TrackIsolator.isolate(current, previous));
    }
}
