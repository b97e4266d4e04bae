package work.vaultlogic.sandbox.helpers;

import work.vaultlogic.sandbox.api.ErrorTag;
import work.vaultlogic.sandbox.error.ScriptFailure;

/**
 * Lookup of a namespace or member the library does not provide.
 */
public final class UnknownHelperException extends ScriptFailure {
    private final String namespace;
    private final String member;

    public UnknownHelperException(String namespace, String member) {
        super(ErrorTag.RUNTIME_ERROR, "TypeError: helpers." + namespace + "." + member + " is not a function");
        this.namespace = namespace;
        this.member = member;
    }

    public String namespace() {
        return namespace;
    }

    public String member() {
        return member;
    }
}
