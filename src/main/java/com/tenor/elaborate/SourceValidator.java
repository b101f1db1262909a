package com.tenor.elaborate;

import java.util.List;
import java.util.regex.Pattern;

import com.tenor.elaborate.parser.RawConstruct;

/** Source protocol tags and their required fields; structured fact sources. */
final class SourceValidator {

    private static final Pattern EXTENSION_TAG = Pattern.compile("x_[a-z][a-z0-9_]*(\\.[a-z][a-z0-9_]*)*");

    private SourceValidator() {}

    static void validate(ConstructIndex index, List<ElabError> errors) {
        for (RawConstruct.Source src : index.sources.values()) {
            String required = null;
            switch (src.protocol) {
                case "http":
                    required = "base_url";
                    break;
                case "database":
                    required = "dialect";
                    break;
                case "graphql":
                case "grpc":
                    required = "endpoint";
                    break;
                case "static":
                case "manual":
                    break;
                default:
                    if (src.protocol.startsWith("x_")) {
                        if (!EXTENSION_TAG.matcher(src.protocol).matches()) {
                            errors.add(error(src, "invalid extension protocol tag '" + src.protocol + "'"));
                        }
                    } else {
                        errors.add(error(src, "unknown protocol tag '" + src.protocol + "'"));
                    }
            }
            if (required != null && !src.fields.containsKey(required)) {
                errors.add(error(src, "source '" + src.id + "' with protocol '" + src.protocol
                        + "' is missing required field '" + required + "'"));
            }
        }

        for (RawConstruct.Fact fact : index.facts.values()) {
            if (fact.source != null && fact.source.isStructured() && !index.sources.containsKey(fact.source.sourceId)) {
                errors.add(new ElabError(5, "Fact", fact.id, "source", fact.file, fact.line,
                        "fact '" + fact.id + "' references undeclared source '" + fact.source.sourceId + "'"));
            }
        }
    }

    private static ElabError error(RawConstruct.Source src, String message) {
        return new ElabError(5, "Source", src.id, "protocol", src.file, src.line, message);
    }
}
