package com.tenor.elaborate;

import java.util.Collections;
import java.util.List;

/**
 * Raised when a pass fails. {@link #error()} is the reported diagnostic;
 * {@link #all()} holds every violation the failing pass collected.
 */
public class ElaborationException extends RuntimeException {

    private final ElabError primary;
    private final List<ElabError> all;

    public ElaborationException(ElabError primary) {
        this(primary, List.of(primary));
    }

    public ElaborationException(ElabError primary, List<ElabError> all) {
        super(primary.toString());
        this.primary = primary;
        this.all = Collections.unmodifiableList(all);
    }

    public ElabError error() {
        return primary;
    }

    public List<ElabError> all() {
        return all;
    }

    public static ElaborationException of(List<ElabError> errors) {
        return new ElaborationException(errors.get(0), errors);
    }
}
