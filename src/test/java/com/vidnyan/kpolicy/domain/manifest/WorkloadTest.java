package com.vidnyan.kpolicy.domain.manifest;

import com.vidnyan.kpolicy.support.Manifests;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkloadTest {

    @Test
    void from_ShouldLocatePodSpecByKind() {
        Workload pod = Workload.from(Manifests.yaml("""
                kind: Pod
                metadata: {name: p, namespace: ns, annotations: {team: core}}
                spec: {containers: [{name: a}]}
                """)).orElseThrow();
        Workload cron = Workload.from(Manifests.yaml("""
                kind: CronJob
                metadata: {name: c}
                spec: {jobTemplate: {spec: {template: {spec: {initContainers: [{name: i}], containers: [{name: b}]}}}}}
                """)).orElseThrow();

        assertEquals("a", pod.containers().get(0).path("name").asText());
        assertEquals("ns", pod.meta().namespace());
        assertEquals("core", pod.meta().annotations().get("team"));
        assertEquals("Pod ns/p", pod.identity());
        assertEquals("b", cron.containers().get(0).path("name").asText());
        assertEquals("i", cron.initContainers().get(0).path("name").asText());
        assertEquals("CronJob c", cron.identity());
    }

    @Test
    void from_ShouldRejectKindsWithoutPodTemplate() {
        assertTrue(Workload.from(Manifests.yaml("{kind: Service, metadata: {name: s}}")).isEmpty());
        assertFalse(Workload.isWorkloadKind("Ingress"));
        assertTrue(Workload.isWorkloadKind("StatefulSet"));
    }

    @Test
    void resource_ShouldExposeApiGroup() {
        KubernetesResource pdb = KubernetesResource.from(Manifests.yaml("""
                apiVersion: policy/v1
                kind: PodDisruptionBudget
                metadata: {name: pdb, namespace: web}
                """));
        KubernetesResource service = KubernetesResource.from(Manifests.yaml("{apiVersion: v1, kind: Service}"));

        assertEquals("policy", pdb.group());
        assertEquals("", service.group());
        assertEquals("PodDisruptionBudget web/pdb", pdb.identity());
    }
}
