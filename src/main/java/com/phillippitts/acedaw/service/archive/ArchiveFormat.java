package com.phillippitts.acedaw.service.archive;

import java.nio.charset.StandardCharsets;

/**
 * Wire constants of the {@code .acedaw} archive.
 *
 * <pre>
 * offset 0   : 4 bytes  magic "ACED"
 * offset 4   : 4 bytes  little-endian unsigned manifest length L
 * offset 8   : L bytes  UTF-8 JSON manifest {version, project, files:[{key, offset, size}]}
 * offset 8+L : payloads concatenated in file-table order, no padding
 * </pre>
 *
 * <p>The layout is a compatibility contract: encoder and decoder must not diverge.
 */
public final class ArchiveFormat {

    /** ASCII "ACED". */
    public static final byte[] MAGIC = "ACED".getBytes(StandardCharsets.US_ASCII);

    public static final int MAGIC_SIZE = 4;

    /** Magic plus manifest length. */
    public static final int HEADER_SIZE = 8;

    /** The only manifest version this codec reads or writes. */
    public static final int VERSION = 1;

    public static final String FILE_EXTENSION = ".acedaw";

    public static final String CONTENT_TYPE = "application/octet-stream";

    private ArchiveFormat() {
        // Utility class - prevent instantiation
    }
}
