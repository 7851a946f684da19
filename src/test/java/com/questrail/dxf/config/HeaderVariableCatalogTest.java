package com.questrail.dxf.config;

import com.questrail.dxf.model.HeaderValue;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.scan.Group;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class HeaderVariableCatalogTest
{
    @Test
    void defaultsCarryTheCommonVariables() {
        HeaderVariableCatalog catalog = HeaderVariableCatalog.defaults();

        assertEquals(OptionalInt.of(1), catalog.codeOf("$ACADVER"));
        assertEquals(OptionalInt.of(10), catalog.codeOf("$INSBASE"));
        assertEquals(OptionalInt.of(40), catalog.codeOf("$TDCREATE"));
        assertEquals(OptionalInt.of(70), catalog.codeOf("$ORTHOMODE"));
        assertTrue(catalog.codeOf("$NOT_A_VARIABLE").isEmpty());
        assertTrue(catalog.codes().size() > 200);
    }

    @Test
    void buildsValuesTypedByTheVariablesCode() {
        HeaderVariableCatalog catalog = HeaderVariableCatalog.defaults();

        assertEquals(HeaderValue.of(Group.text(1, "AC1015")), catalog.valueOf("$ACADVER", "AC1015"));
        assertEquals(HeaderValue.of(Group.real(40, 2.0)), catalog.valueOf("$LTSCALE", 2));
        assertEquals(HeaderValue.of(Group.integer(70, 1)), catalog.valueOf("$ORTHOMODE", true));
        assertEquals(HeaderValue.point(10, Point.of(1.0, 2.0, 0.0)),
            catalog.valueOf("$INSBASE", Point.of(1.0, 2.0, 0.0)));
    }

    @Test
    void rejectsUnknownVariablesAndMismatchedValues() {
        HeaderVariableCatalog catalog = HeaderVariableCatalog.defaults();

        assertThrows(IllegalArgumentException.class, () -> catalog.valueOf("$NOT_A_VARIABLE", "x"));
        assertThrows(IllegalArgumentException.class, () -> catalog.valueOf("$LTSCALE", "large"));
        assertThrows(IllegalArgumentException.class, () -> catalog.valueOf("$ACADVER", 15));
    }

    @Test
    void customCatalogsAreImmutableCopies() {
        HeaderVariableCatalog base = HeaderVariableCatalog.of(Map.of("$CUSTOM", 1));
        HeaderVariableCatalog extended = base.with("$FLAG", 290);

        assertTrue(base.codeOf("$FLAG").isEmpty());
        assertEquals(HeaderValue.of(Group.bool(290, true)), extended.valueOf("$FLAG", true));
        assertTrue(HeaderVariableCatalog.empty().codes().isEmpty());
    }
}
