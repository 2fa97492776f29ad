package com.gridfeed.core.envelope;

/**
 * One mutation argument: the variable carrying it, the argument name on the mutation field,
 * and its GraphQL input type.
 */
public record Argument(String variable, String name, String type) {

    public static Argument of(String name, String type) {
        return new Argument(name, name, type);
    }
}
