/**
 * Audio payload storage and WAV handling.
 *
 * <p>Blobs are addressed by {@link com.phillippitts.acedaw.service.audio.AudioBlobKey}; the
 * {@link com.phillippitts.acedaw.service.audio.AudioBlobStore} treats them as opaque bytes.
 * {@link com.phillippitts.acedaw.service.audio.WavDecoder} and
 * {@link com.phillippitts.acedaw.service.audio.WavEncoder} convert between WAV payloads and
 * {@link com.phillippitts.acedaw.service.audio.SampleBuffer}s for track isolation.
 *
 * @since 1.0
 */
package com.phillippitts.acedaw.service.audio;
