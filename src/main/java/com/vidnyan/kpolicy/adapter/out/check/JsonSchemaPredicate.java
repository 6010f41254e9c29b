package com.vidnyan.kpolicy.adapter.out.check;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import com.vidnyan.kpolicy.domain.check.CheckPredicate;
import com.vidnyan.kpolicy.domain.error.MalformedCheckException;

import java.util.Set;

/**
 * Check predicate backed by a compiled JSON schema (draft 7).
 * A fragment passes when it validates without errors.
 */
public class JsonSchemaPredicate implements CheckPredicate {

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    private final JsonSchema schema;

    private JsonSchemaPredicate(JsonSchema schema) {
        this.schema = schema;
    }

    /**
     * Compile a schema. Validators are initialized eagerly so the predicate can be shared across threads.
     *
     * @throws JsonSchemaException if the schema cannot be compiled
     */
    public static JsonSchemaPredicate compile(JsonNode schemaNode) {
        JsonSchema schema = SCHEMA_FACTORY.getSchema(schemaNode);
        schema.initializeValidators();
        return new JsonSchemaPredicate(schema);
    }

    @Override
    public boolean test(JsonNode fragment) {
        try {
            Set<ValidationMessage> errors = schema.validate(fragment);
            return errors.isEmpty();
        } catch (JsonSchemaException e) {
            throw new MalformedCheckException(e.getMessage(), e);
        }
    }
}
