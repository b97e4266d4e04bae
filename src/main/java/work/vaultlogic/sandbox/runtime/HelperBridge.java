package work.vaultlogic.sandbox.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import work.vaultlogic.sandbox.api.ConsoleLevel;
import work.vaultlogic.sandbox.helpers.HelperFunction;
import work.vaultlogic.sandbox.helpers.HelperLibrary;
import work.vaultlogic.sandbox.helpers.HelperNamespace;
import work.vaultlogic.sandbox.marshal.MarshallingException;
import work.vaultlogic.sandbox.marshal.ValueMarshaller;

/**
 * Builds the frozen {@code helpers} capability object inside a context from a {@link HelperLibrary}.
 *
 * <p>Every member is a guest arrow function over a host proxy. Arguments are copied out through the
 * marshaller; list and map results are copied back in through the captured {@code JSON.parse}.</p>
 */
final class HelperBridge {
    private final Value kit;

    HelperBridge(Value kit) {
        this.kit = kit;
    }

    Value build(HelperLibrary library, ConsoleBuffer console, boolean consoleEnabled) {
        Value helpers = newObject();
        for (HelperNamespace namespace : library.namespaces()) {
            Value members = newObject();
            for (String member : library.members(namespace)) {
                members.putMember(member, wrap(invoker(library.lookup(namespace, member))));
            }
            helpers.putMember(namespace.key(), members);
        }
        Value consoleObject = newObject();
        for (ConsoleLevel level : ConsoleLevel.values()) {
            consoleObject.putMember(level.memberName(), wrap(consoleWriter(console, level, consoleEnabled)));
        }
        helpers.putMember(HelperNamespace.CONSOLE.key(), consoleObject);
        kit.getMember("deepFreeze").execute(helpers);
        kit.getMember("defineConsole").execute(consoleObject);
        return helpers;
    }

    private ProxyExecutable invoker(HelperFunction fn) {
        Value parse = kit.getMember("parse");
        return arguments -> {
            List<Object> args = new ArrayList<>(arguments.length);
            for (Value argument : arguments) {
                args.add(ValueMarshaller.marshalOut(argument));
            }
            Object result = fn.apply(args);
            if (result instanceof List<?> || result instanceof Map<?, ?>) {
                return ValueMarshaller.marshalIn(parse, result);
            }
            return result;
        };
    }

    private static ProxyExecutable consoleWriter(ConsoleBuffer console, ConsoleLevel level, boolean enabled) {
        return arguments -> {
            if (!enabled) {
                return null;
            }
            List<Object> args = new ArrayList<>(arguments.length);
            for (Value argument : arguments) {
                args.add(printable(argument));
            }
            console.append(level, args);
            return null;
        };
    }

    // console accepts anything a script can print; values that cannot be copied are logged as their string form
    private static Object printable(Value argument) {
        try {
            return ValueMarshaller.marshalOut(argument);
        } catch (MarshallingException ex) {
            return argument.toString();
        }
    }

    private Value wrap(ProxyExecutable proxy) {
        return kit.getMember("wrap").execute(proxy);
    }

    private Value newObject() {
        return kit.getMember("object").execute();
    }
}
