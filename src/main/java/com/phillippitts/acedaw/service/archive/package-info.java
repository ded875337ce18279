/**
 * The {@code .acedaw} project archive.
 *
 * <p>Layout, all integers little-endian:
 * <pre>
 * offset 0   "ACED"                      4 bytes, ASCII
 * offset 4   manifest length L           uint32
 * offset 8   manifest                    L bytes, UTF-8 JSON
 *            {"version":1,"project":{...},"files":[{"key","offset","size"}...]}
 * offset 8+L payloads                    concatenated in file-table order
 * </pre>
 * File offsets are relative to the start of the payload region.
 *
 * @since 1.0
 */
package com.phillippitts.acedaw.service.archive;
