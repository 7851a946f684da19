/**
 * DXF Scanning
 * =============================================================================
 *
 * <p>The lowest layer of the codec: it turns DXF text into typed groups and
 * typed groups back into text lines.</p>
 *
 * <p>A DXF text stream is a sequence of line pairs. The first line of a pair is
 * an integer group code; the second is the value, whose type is fixed by the
 * range the code falls in ({@link com.questrail.dxf.scan.GroupCodes}).</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   String text
 *        → DxfLines.split          (CRLF / CR / LF, even line count)
 *            → GroupScanner        (cursor: next, peek, rewind, lastRead)
 *                → Group           (code + typed GroupValue)
 *                    → codec layer (records, sections, document)
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Code lines are trimmed; value lines lose only their leading whitespace.</li>
 *   <li>The scanner knows nothing about sections or records. A code-0 group is
 *       just a group here.</li>
 *   <li>Reading past {@code EOF} is an error; running out of lines before it is
 *       a different one.</li>
 * </ul>
 */
package com.questrail.dxf.scan;
