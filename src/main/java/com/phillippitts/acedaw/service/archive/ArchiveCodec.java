package com.phillippitts.acedaw.service.archive;

import com.phillippitts.acedaw.domain.Project;
import com.phillippitts.acedaw.exception.InvalidArchiveFormatException;
import com.phillippitts.acedaw.exception.InvalidManifestException;
import com.phillippitts.acedaw.exception.TruncatedArchiveException;
import com.phillippitts.acedaw.service.project.ProjectJsonMapper;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Encodes a project and its audio payloads into one {@code .acedaw} buffer and back.
 *
 * <p>Pure transform: no storage access, no side effects. The layout is described on
 * {@link ArchiveFormat}. Decoding validates every structural layer before returning and never
 * reads outside the buffer; failures are reported as
 * {@link com.phillippitts.acedaw.exception.ArchiveDecodeException} subclasses.
 */
public final class ArchiveCodec {

    static final String VERSION = "version";
    static final String PROJECT = "project";
    static final String FILES = "files";
    static final String KEY = "key";
    static final String OFFSET = "offset";
    static final String SIZE = "size";

    private ArchiveCodec() {}

    /**
     * Builds an archive. Entries keep their order (and duplicates) in both the file table and
     * the payload region.
     *
     * @param project project snapshot to embed
     * @param entries payloads with their keys
     * @return the complete archive, with no trailing bytes
     * @throws IllegalArgumentException if the archive would exceed the 2 GiB array limit
     */
    public static byte[] encode(Project project, List<ArchiveEntry> entries) {
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(entries, "entries");
        ArchiveManifest manifest = ArchiveManifest.of(project, entries);
        byte[] manifestBytes = manifestToJson(manifest).toString().getBytes(StandardCharsets.UTF_8);

        long total = (long) ArchiveFormat.HEADER_SIZE + manifestBytes.length + manifest.payloadSize();
        if (total > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Archive too large to encode: " + total + " bytes");
        }

        ByteBuffer out = ByteBuffer.allocate((int) total).order(ByteOrder.LITTLE_ENDIAN);
        out.put(ArchiveFormat.MAGIC);
        out.putInt(manifestBytes.length);
        out.put(manifestBytes);
        for (ArchiveEntry entry : entries) {
            out.put(entry.payload());
        }
        return out.array();
    }

    /**
     * Parses an archive without writing anything.
     *
     * @param archive complete archive bytes
     * @return embedded project and payloads in file-table order
     * @throws InvalidArchiveFormatException if the magic is wrong or the manifest is not UTF-8 JSON
     * @throws InvalidManifestException if the manifest content is unusable
     * @throws TruncatedArchiveException if the header or file table points past the buffer
     */
    public static DecodedArchive decode(byte[] archive) {
        Objects.requireNonNull(archive, "archive");
        if (archive.length < ArchiveFormat.MAGIC_SIZE
                || !Arrays.equals(archive, 0, ArchiveFormat.MAGIC_SIZE, ArchiveFormat.MAGIC, 0, ArchiveFormat.MAGIC_SIZE)) {
            throw new InvalidArchiveFormatException("Not an .acedaw archive: magic token mismatch");
        }
        if (archive.length < ArchiveFormat.HEADER_SIZE) {
            throw new TruncatedArchiveException("Archive header is incomplete",
                    ArchiveFormat.HEADER_SIZE, archive.length);
        }

        long manifestLength = Integer.toUnsignedLong(readLEInt(archive, ArchiveFormat.MAGIC_SIZE));
        long manifestEnd = ArchiveFormat.HEADER_SIZE + manifestLength;
        if (manifestEnd > archive.length) {
            throw new TruncatedArchiveException("Manifest extends past end of archive",
                    manifestEnd, archive.length);
        }

        JSONObject json = parseManifestJson(archive, (int) manifestLength);
        ArchiveManifest manifest = manifestFromJson(json);

        int payloadStart = (int) manifestEnd;
        long payloadLength = archive.length - manifestEnd;
        List<ArchiveEntry> entries = new ArrayList<>(manifest.files().size());
        for (ArchiveFileEntry file : manifest.files()) {
            long end = file.end();
            if (end > payloadLength) {
                throw new TruncatedArchiveException("Payload of '" + file.key() + "' extends past end of archive",
                        end, payloadLength);
            }
            int from = payloadStart + (int) file.offset();
            entries.add(new ArchiveEntry(file.key(), Arrays.copyOfRange(archive, from, from + (int) file.size())));
        }
        return new DecodedArchive(manifest.project(), entries);
    }

    private static JSONObject parseManifestJson(byte[] archive, int length) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(archive, ArchiveFormat.HEADER_SIZE, length))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidArchiveFormatException("Manifest is not valid UTF-8", e);
        }
        try {
            return new JSONObject(text);
        } catch (JSONException e) {
            throw new InvalidArchiveFormatException("Manifest is not a JSON object: " + e.getMessage(), e);
        }
    }

    static JSONObject manifestToJson(ArchiveManifest manifest) {
        JSONArray files = new JSONArray();
        for (ArchiveFileEntry file : manifest.files()) {
            files.put(new JSONObject()
                    .put(KEY, file.key())
                    .put(OFFSET, file.offset())
                    .put(SIZE, file.size()));
        }
        return new JSONObject()
                .put(VERSION, manifest.version())
                .put(PROJECT, ProjectJsonMapper.toJson(manifest.project()))
                .put(FILES, files);
    }

    static ArchiveManifest manifestFromJson(JSONObject json) {
        // Version first: nothing else is interpreted for an unknown version.
        if (!json.has(VERSION)) {
            throw new InvalidManifestException("Manifest has no version");
        }
        long version = readWholeNumber(json.opt(VERSION), "version");
        if (version != ArchiveFormat.VERSION) {
            throw new InvalidManifestException("Unsupported archive version: " + json.opt(VERSION)
                    + " (supported: " + ArchiveFormat.VERSION + ")");
        }

        JSONObject projectJson = json.optJSONObject(PROJECT);
        if (projectJson == null) {
            throw new InvalidManifestException("Manifest has no project object");
        }
        Project project;
        try {
            project = ProjectJsonMapper.fromJson(projectJson);
        } catch (IllegalArgumentException | JSONException e) {
            throw new InvalidManifestException("Invalid project in manifest: " + e.getMessage(), e);
        }

        JSONArray filesJson = json.optJSONArray(FILES);
        if (filesJson == null) {
            throw new InvalidManifestException("Manifest has no files array");
        }
        List<ArchiveFileEntry> files = new ArrayList<>(filesJson.length());
        for (int i = 0; i < filesJson.length(); i++) {
            JSONObject entry = filesJson.optJSONObject(i);
            if (entry == null) {
                throw new InvalidManifestException("File entry " + i + " is not an object");
            }
            Object key = entry.opt(KEY);
            if (!(key instanceof String keyText) || keyText.isEmpty()) {
                throw new InvalidManifestException("File entry " + i + " has no key");
            }
            long offset = readWholeNumber(entry.opt(OFFSET), "files[" + i + "]." + OFFSET);
            long size = readWholeNumber(entry.opt(SIZE), "files[" + i + "]." + SIZE);
            if (offset < 0 || size < 0) {
                throw new InvalidManifestException("File entry " + i + " has a negative offset or size");
            }
            files.add(new ArchiveFileEntry(keyText, offset, size));
        }
        return new ArchiveManifest((int) version, project, files);
    }

    private static long readWholeNumber(Object value, String field) {
        if (!(value instanceof Number number)) {
            throw new InvalidManifestException("Manifest field '" + field + "' is not a number: " + value);
        }
        try {
            return new BigDecimal(number.toString()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidManifestException("Manifest field '" + field + "' is not a whole number: " + value, e);
        }
    }

    private static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
             | ((a[off + 1] & 0xFF) << 8)
             | ((a[off + 2] & 0xFF) << 16)
             | ((a[off + 3] & 0xFF) << 24);
    }
}
