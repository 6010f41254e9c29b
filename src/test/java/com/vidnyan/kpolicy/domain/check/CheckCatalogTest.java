package com.vidnyan.kpolicy.domain.check;

import com.vidnyan.kpolicy.domain.config.Configuration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CheckCatalogTest {

    private static CheckDefinition check(String id, String category) {
        return CheckDefinition.builder()
                .id(id)
                .category(category)
                .target(TargetScope.POD)
                .predicate(fragment -> true)
                .build();
    }

    @Test
    void customCheck_ShouldShadowBuiltIn() {
        CheckCatalog catalog = CheckCatalog.of(List.of(check("hostIPCSet", "Security"), check("hostPIDSet", "Security")));
        Configuration conf = Configuration.builder()
                .customCheck(check("hostIPCSet", "Custom"))
                .build();

        assertEquals("Custom", catalog.resolve("hostIPCSet", conf).orElseThrow().category());
        assertEquals("Security", catalog.resolve("hostPIDSet", conf).orElseThrow().category());
        assertEquals("Security", catalog.builtIn("hostIPCSet").orElseThrow().category());
    }

    @Test
    void resolve_ShouldReturnEmptyForUnknownId() {
        CheckCatalog catalog = CheckCatalog.of(List.of(check("a", "A")));

        assertTrue(catalog.resolve("missing", Configuration.builder().build()).isEmpty());
    }

    @Test
    void builtInIds_ShouldKeepDeclaredOrder() {
        CheckCatalog catalog = CheckCatalog.of(List.of(check("zeta", "Z"), check("alpha", "A"), check("mid", "M")));

        assertEquals(List.of("zeta", "alpha", "mid"), catalog.builtInIds());
        assertEquals(3, catalog.size());
    }

    @Test
    void duplicateBuiltIn_ShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CheckCatalog.of(List.of(check("a", "A"), check("a", "B"))));
    }

    @Test
    void definition_ShouldRejectIncompatibleSchemaTarget() {
        assertThrows(IllegalArgumentException.class, () -> CheckDefinition.builder()
                .id("bad").target(TargetScope.POD).schemaTarget(TargetScope.CONTAINER)
                .predicate(f -> true).build());

        CheckDefinition podShaped = CheckDefinition.builder()
                .id("ok").target(TargetScope.CONTAINER).schemaTarget(TargetScope.POD)
                .predicate(f -> true).build();
        assertEquals(TargetScope.POD, podShaped.schemaTarget());
    }

    @Test
    void definition_ShouldDefaultSchemaTargetToTarget() {
        assertEquals(TargetScope.CONTAINER, CheckDefinition.builder()
                .id("c").target(TargetScope.CONTAINER).predicate(f -> true).build().schemaTarget());
    }
}
