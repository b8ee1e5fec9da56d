package com.recordplatform.schemashift.exception;

public class SchemaNotFoundException extends RuntimeException {

    public SchemaNotFoundException(String schemaId, String organizationId) {
        super("Schema " + schemaId + " not found in organization " + organizationId);
    }
}
