/**
 * Top-level DXF sections and the document reader and writer that drive them.
 *
 * <pre>
 *   0 SECTION / 2 name
 *        → SectionCodec.read   (one per known section; unknown ones are skipped)
 *   0 ENDSEC
 *   ...
 *   0 EOF
 * </pre>
 *
 * <p>Writing is lazy: {@link com.questrail.dxf.codec.section.DocumentWriter}
 * renders each record only when its lines are pulled.</p>
 */
package com.questrail.dxf.codec.section;
