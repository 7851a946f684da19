package com.questrail.dxf.config;

import com.questrail.dxf.codec.EntityCodecRegistry;
import com.questrail.dxf.observability.DxfDiagnosticsSink;
import com.questrail.dxf.observability.Slf4jDiagnosticsSink;

import java.util.Objects;

/**
 * Configuration of a {@link com.questrail.dxf.DxfCodec}.
 *
 * <ul>
 *   <li>{@code diagnostics}: default sink for parse and serialize calls</li>
 *   <li>{@code entityCodecs}: entity kinds the codec reads and writes</li>
 *   <li>{@code headerCatalog}: codes of header variables set by name</li>
 * </ul>
 */
public record DxfCodecConfig(
    DxfDiagnosticsSink diagnostics,
    EntityCodecRegistry entityCodecs,
    HeaderVariableCatalog headerCatalog
) {
    public DxfCodecConfig {
        Objects.requireNonNull(diagnostics, "diagnostics");
        Objects.requireNonNull(entityCodecs, "entityCodecs");
        Objects.requireNonNull(headerCatalog, "headerCatalog");
    }

    public static DxfCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DxfDiagnosticsSink diagnostics = new Slf4jDiagnosticsSink();
        private EntityCodecRegistry entityCodecs;
        private HeaderVariableCatalog headerCatalog = HeaderVariableCatalog.defaults();

        public Builder withDiagnostics(DxfDiagnosticsSink diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        public Builder withEntityCodecs(EntityCodecRegistry entityCodecs) {
            this.entityCodecs = entityCodecs;
            return this;
        }

        public Builder withHeaderCatalog(HeaderVariableCatalog headerCatalog) {
            this.headerCatalog = headerCatalog;
            return this;
        }

        public DxfCodecConfig build() {
            return new DxfCodecConfig(
                diagnostics,
                entityCodecs != null ? entityCodecs : EntityCodecRegistry.withBuiltIns(),
                headerCatalog);
        }
    }
}
