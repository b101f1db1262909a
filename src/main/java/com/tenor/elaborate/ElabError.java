package com.tenor.elaborate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A single elaboration diagnostic.
 *
 * The JSON form always carries all seven keys; absent values are written as null.
 */
public final class ElabError {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public final int pass;
    public final String constructKind;
    public final String constructId;
    public final String field;
    public final String file;
    public final int line;
    public final String message;

    public ElabError(int pass, String constructKind, String constructId, String field,
                     String file, int line, String message) {
        this.pass = pass;
        this.constructKind = constructKind;
        this.constructId = constructId;
        this.field = field;
        this.file = file;
        this.line = line;
        this.message = message;
    }

    /** Pass 0 diagnostics carry only location and message. */
    public static ElabError lexical(String file, int line, String message) {
        return new ElabError(0, null, null, null, file, line, message);
    }

    public ObjectNode toJson() {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("construct_id", constructId);
        n.put("construct_kind", constructKind);
        n.put("field", field);
        n.put("file", file);
        n.put("line", line);
        n.put("message", message);
        n.put("pass", pass);
        return n;
    }

    @Override
    public String toString() {
        return file + ":" + line + ": [pass " + pass + "] " + message;
    }
}
