package work.vaultlogic.sandbox.helpers;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from namespace to a fixed set of helper functions. Built once and shared by reference.
 */
public final class HelperLibrary {
    private static final HelperLibrary STANDARD = standard(Clock.systemUTC());

    private final Map<HelperNamespace, Map<String, HelperFunction>> namespaces;

    private HelperLibrary(Map<HelperNamespace, Map<String, HelperFunction>> namespaces) {
        var copy = new EnumMap<HelperNamespace, Map<String, HelperFunction>>(HelperNamespace.class);
        namespaces.forEach((ns, members) -> copy.put(ns, Collections.unmodifiableMap(new LinkedHashMap<>(members))));
        this.namespaces = Collections.unmodifiableMap(copy);
    }

    /** The stock library: string, number, array, object, math and date helpers. */
    public static HelperLibrary standard() {
        return STANDARD;
    }

    public static HelperLibrary standard(Clock clock) {
        Builder builder = builder();
        StringHelpers.register(builder);
        NumberHelpers.register(builder);
        ArrayHelpers.register(builder);
        ObjectHelpers.register(builder);
        MathHelpers.register(builder);
        DateHelpers.register(builder, clock);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public HelperFunction lookup(HelperNamespace namespace, String member) {
        Map<String, HelperFunction> members = namespaces.get(namespace);
        HelperFunction fn = members == null ? null : members.get(member);
        if (fn == null) {
            throw new UnknownHelperException(namespace.key(), member);
        }
        return fn;
    }

    public Optional<HelperFunction> find(String namespace, String member) {
        return HelperNamespace.fromKey(namespace)
            .map(namespaces::get)
            .map(members -> members.get(member));
    }

    public Set<HelperNamespace> namespaces() {
        return namespaces.keySet();
    }

    public Set<String> members(HelperNamespace namespace) {
        Map<String, HelperFunction> members = namespaces.get(namespace);
        return members == null ? Set.of() : members.keySet();
    }

    public static final class Builder {
        private final Map<HelperNamespace, Map<String, HelperFunction>> namespaces = new EnumMap<>(HelperNamespace.class);

        public Builder register(HelperNamespace namespace, String member, HelperFunction fn) {
            if (namespace == HelperNamespace.CONSOLE) {
                throw new IllegalArgumentException("console helpers are bound per invocation");
            }
            if (member == null || member.isBlank()) {
                throw new IllegalArgumentException("helper member name must not be blank");
            }
            if (fn == null) {
                throw new IllegalArgumentException("helper " + namespace.key() + "." + member + " has no implementation");
            }
            namespaces.computeIfAbsent(namespace, ns -> new LinkedHashMap<>()).put(member, fn);
            return this;
        }

        public HelperLibrary build() {
            return new HelperLibrary(namespaces);
        }
    }
}
