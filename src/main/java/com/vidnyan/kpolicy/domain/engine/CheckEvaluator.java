package com.vidnyan.kpolicy.domain.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vidnyan.kpolicy.domain.check.CheckDefinition;
import com.vidnyan.kpolicy.domain.error.MalformedCheckException;
import com.vidnyan.kpolicy.domain.manifest.KubernetesResource;
import com.vidnyan.kpolicy.domain.manifest.Workload;

/**
 * Runs a check's predicate against the fragment shaped for its schema target.
 * Pure: never mutates the manifest or the check.
 */
public class CheckEvaluator {

    /**
     * Pod and controller passes. Pod-shaped checks see the pod spec, controller-shaped checks
     * the original object.
     */
    public boolean evaluate(CheckDefinition check, Workload workload, String identity) {
        JsonNode fragment = switch (check.schemaTarget()) {
            case POD -> workload.podSpec();
            case CONTROLLER -> workload.originalObject();
            default -> throw wrongPass(check, identity, "workload");
        };
        return evaluate(check, fragment, identity);
    }

    /**
     * Container pass. Pod-shaped checks see a pod holding only this container.
     */
    public boolean evaluate(CheckDefinition check, Workload workload, JsonNode container, String identity) {
        JsonNode fragment = switch (check.schemaTarget()) {
            case POD -> syntheticPod(workload.podSpec(), container);
            case CONTAINER -> container;
            default -> throw wrongPass(check, identity, "container");
        };
        return evaluate(check, fragment, identity);
    }

    public boolean evaluate(CheckDefinition check, KubernetesResource resource) {
        return evaluate(check, resource.object(), resource.identity());
    }

    /**
     * Evaluate against an already-shaped fragment.
     *
     * @throws MalformedCheckException tagged with the check ID
     */
    public boolean evaluate(CheckDefinition check, JsonNode fragment, String identity) {
        if (fragment == null || fragment.isMissingNode() || fragment.isNull()) {
            throw new MalformedCheckException(check.id(), identity,
                    "no " + check.schemaTarget().value() + " fragment to evaluate", null);
        }
        try {
            return check.predicate().test(fragment);
        } catch (MalformedCheckException e) {
            throw e.tagged(check.id(), identity);
        } catch (RuntimeException e) {
            throw new MalformedCheckException(check.id(), identity, e.getMessage(), e);
        }
    }

    // Only a container check may be evaluated in a form other than its target (pod)
    private static MalformedCheckException wrongPass(CheckDefinition check, String identity, String pass) {
        return new MalformedCheckException(check.id(), identity,
                check.schemaTarget().value() + "-shaped check cannot run in a " + pass + " pass", null);
    }

    /**
     * Copy of {@code podSpec} whose only container is {@code container} and whose init container list is empty.
     */
    public static JsonNode syntheticPod(JsonNode podSpec, JsonNode container) {
        ObjectNode pod = podSpec != null && podSpec.isObject()
                ? ((ObjectNode) podSpec).deepCopy()
                : JsonNodeFactory.instance.objectNode();
        pod.putArray("initContainers");
        pod.putArray("containers").add(container.deepCopy());
        return pod;
    }
}
