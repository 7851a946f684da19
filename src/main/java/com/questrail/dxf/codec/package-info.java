/**
 * DXF Record Codecs
 * =============================================================================
 *
 * <p>Shared machinery for reading and writing records on top of the scanner:</p>
 *
 * <ul>
 *   <li>Structural helpers for values that span several groups: points
 *       ({@link com.questrail.dxf.codec.Points}), 4x4 matrices
 *       ({@link com.questrail.dxf.codec.Matrices}) and chunked long text
 *       ({@link com.questrail.dxf.codec.ChunkedText}).</li>
 *   <li>{@link com.questrail.dxf.codec.RecordSchema}, the ordered code/field
 *       table each record kind declares once and uses in both directions.</li>
 *   <li>{@link com.questrail.dxf.codec.ParseContext}, the read loop plus the
 *       diagnostics helpers, and {@link com.questrail.dxf.codec.GroupWriter},
 *       its write-side counterpart.</li>
 *   <li>The {@link com.questrail.dxf.codec.EntityCodec} extension seam and the
 *       per-codec {@link com.questrail.dxf.codec.EntityCodecRegistry}.</li>
 * </ul>
 *
 * <h2>Reading Convention</h2>
 * <p>A record reader is entered with the record's code-0 group already read,
 * and returns with the next code-0 group read, available as
 * {@code scanner.lastRead()}. Every loop in the section layer relies on this.</p>
 *
 * <p>Groups a record does not recognize are reported through the diagnostics
 * sink and skipped. Malformed structure (a point without its Y, a matrix with
 * a gap) is fatal.</p>
 */
package com.questrail.dxf.codec;
