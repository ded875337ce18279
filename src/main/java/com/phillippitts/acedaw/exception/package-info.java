/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.acedaw.exception.AceDawException} so the
 * HTTP boundary can translate them in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.acedaw.exception.StorageException} - the key-value substrate failed</li>
 *   <li>{@link com.phillippitts.acedaw.exception.CorruptProjectRecordException} - a stored project
 *       record cannot be parsed</li>
 *   <li>{@link com.phillippitts.acedaw.exception.ProjectNotFoundException} and
 *       {@link com.phillippitts.acedaw.exception.AudioBlobNotFoundException} - a workflow needs a
 *       record that is not stored</li>
 *   <li>{@link com.phillippitts.acedaw.exception.InvalidAudioException} - a WAV payload cannot be
 *       decoded</li>
 *   <li>{@link com.phillippitts.acedaw.exception.ArchiveTooLargeException} - import size guard</li>
 *   <li>{@link com.phillippitts.acedaw.exception.ArchiveDecodeException} - archive decoding failed,
 *       with subclasses {@code InvalidArchiveFormatException}, {@code InvalidManifestException}
 *       and {@code TruncatedArchiveException}</li>
 * </ul>
 *
 * <p>Absent records are not exceptional: lookups return an empty {@link java.util.Optional}.
 *
 * @see com.phillippitts.acedaw.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.acedaw.exception;
