package work.vaultlogic.sandbox.helpers;

import java.util.List;

/**
 * Host implementation of one helper member. Arguments arrive already marshalled out of the sandbox.
 */
@FunctionalInterface
public interface HelperFunction {
    Object apply(List<Object> args);
}
