package com.soundbank.generator.registry;

import com.soundbank.generator.model.NodeRef;

/**
 * Source data a construction contract cannot interpret. Fatal for the run.
 */
public class MalformedNodeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient NodeRef ref;

    public MalformedNodeException(NodeRef ref, String message) {
        super(ref == null ? message : message + " (object " + ref + ")");
        this.ref = ref;
    }

    public MalformedNodeException(NodeRef ref, String message, Throwable cause) {
        super(ref == null ? message : message + " (object " + ref + ")", cause);
        this.ref = ref;
    }

    public NodeRef getRef() {
        return ref;
    }
}
