package com.vidnyan.kpolicy.domain.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.kpolicy.domain.check.CheckDefinition;
import com.vidnyan.kpolicy.domain.check.TargetScope;
import com.vidnyan.kpolicy.domain.error.MalformedCheckException;
import com.vidnyan.kpolicy.domain.manifest.Workload;
import com.vidnyan.kpolicy.support.Manifests;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CheckEvaluatorTest {

    private final CheckEvaluator evaluator = new CheckEvaluator();

    private final Workload workload = Manifests.workload("""
            apiVersion: apps/v1
            kind: StatefulSet
            metadata:
              name: db
              namespace: data
            spec:
              replicas: 3
              template:
                spec:
                  hostIPC: false
                  initContainers:
                    - name: init
                      image: busybox:1.36
                  containers:
                    - name: db
                      image: postgres:16
                    - name: exporter
                      image: exporter:0.15
            """);

    private static CheckDefinition capturing(String id, TargetScope target, TargetScope schemaTarget,
                                             AtomicReference<JsonNode> seen) {
        return CheckDefinition.builder()
                .id(id)
                .category("Test")
                .target(target)
                .schemaTarget(schemaTarget)
                .predicate(fragment -> {
                    seen.set(fragment);
                    return true;
                })
                .build();
    }

    @Test
    void podShapedCheck_ShouldSeePodSpec() {
        AtomicReference<JsonNode> seen = new AtomicReference<>();

        assertTrue(evaluator.evaluate(capturing("pod", TargetScope.POD, null, seen), workload, "id"));

        assertEquals(workload.podSpec(), seen.get());
    }

    @Test
    void controllerShapedCheck_ShouldSeeOriginalObject() {
        AtomicReference<JsonNode> seen = new AtomicReference<>();

        evaluator.evaluate(capturing("ctrl", TargetScope.CONTROLLER, null, seen), workload, "id");

        assertEquals("StatefulSet", seen.get().path("kind").asText());
        assertEquals(3, seen.get().at("/spec/replicas").asInt());
    }

    @Test
    void containerShapedCheck_ShouldSeeSingleContainer() {
        AtomicReference<JsonNode> seen = new AtomicReference<>();
        JsonNode exporter = Manifests.container(workload, "exporter");

        evaluator.evaluate(capturing("c", TargetScope.CONTAINER, null, seen), workload, exporter, "id");

        assertSame(exporter, seen.get());
    }

    @Test
    void podShapedContainerCheck_ShouldSeeSyntheticPod() {
        AtomicReference<JsonNode> seen = new AtomicReference<>();
        JsonNode exporter = Manifests.container(workload, "exporter");

        evaluator.evaluate(capturing("c", TargetScope.CONTAINER, TargetScope.POD, seen), workload, exporter, "id");

        JsonNode pod = seen.get();
        assertEquals(1, pod.path("containers").size());
        assertEquals("exporter", pod.path("containers").get(0).path("name").asText());
        assertTrue(pod.path("initContainers").isArray());
        assertEquals(0, pod.path("initContainers").size());
        assertFalse(pod.path("hostIPC").asBoolean(true));
    }

    @Test
    void syntheticPod_ShouldNotMutateOriginal() {
        JsonNode before = workload.podSpec().deepCopy();

        CheckEvaluator.syntheticPod(workload.podSpec(), Manifests.container(workload, "db"));

        assertEquals(before, workload.podSpec());
        assertEquals(2, workload.containers().size());
        assertEquals(1, workload.initContainers().size());
    }

    @Test
    void predicateError_ShouldBeTaggedWithCheckId() {
        CheckDefinition broken = CheckDefinition.builder()
                .id("brokenCheck").category("Test").target(TargetScope.POD)
                .predicate(fragment -> {
                    throw new MalformedCheckException("no such field", null);
                })
                .build();

        MalformedCheckException e = assertThrows(MalformedCheckException.class,
                () -> evaluator.evaluate(broken, workload, "StatefulSet data/db"));

        assertEquals("brokenCheck", e.getCheckId());
        assertEquals("StatefulSet data/db", e.getObjectIdentity());
        assertEquals("no such field", e.getDetail());
    }

    @Test
    void unexpectedPredicateFailure_ShouldSurfaceAsMalformedCheck() {
        CheckDefinition broken = CheckDefinition.builder()
                .id("npe").category("Test").target(TargetScope.POD)
                .predicate(fragment -> {
                    throw new IllegalStateException("boom");
                })
                .build();

        MalformedCheckException e = assertThrows(MalformedCheckException.class,
                () -> evaluator.evaluate(broken, workload, "id"));

        assertEquals("npe", e.getCheckId());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void missingFragment_ShouldBeMalformed() {
        Workload noSpec = Manifests.workload("""
                kind: Deployment
                metadata: {name: empty}
                """);
        AtomicReference<JsonNode> seen = new AtomicReference<>();

        assertThrows(MalformedCheckException.class,
                () -> evaluator.evaluate(capturing("pod", TargetScope.POD, null, seen), noSpec, "id"));
        assertNull(seen.get());
    }

    @Test
    void checkInWrongPass_ShouldBeMalformed() {
        JsonNode db = Manifests.container(workload, "db");
        CheckDefinition containerCheck = capturing("c", TargetScope.CONTAINER, null, new AtomicReference<>());
        CheckDefinition otherCheck = capturing("o", TargetScope.OTHER, null, new AtomicReference<>());

        MalformedCheckException e = assertThrows(MalformedCheckException.class,
                () -> evaluator.evaluate(containerCheck, workload, "id"));
        assertEquals("c", e.getCheckId());
        assertThrows(MalformedCheckException.class,
                () -> evaluator.evaluate(otherCheck, workload, db, "id"));
        assertThrows(MalformedCheckException.class,
                () -> evaluator.evaluate(otherCheck, workload, "id"));
    }
}
