package com.sanguo.engine.resolution;

import java.util.function.Function;

/**
 * One step of a resolution chain. Resolvers may push further resolvers onto
 * the context's stack; those run before anything pushed earlier.
 */
public interface Resolver {

    ResolutionResult resolve(ResolutionContext context);

    /**
     * Short name recorded in the stack history, e.g. "damage".
     */
    String kind();

    static Resolver of(String kind, Function<ResolutionContext, ResolutionResult> body) {
        return new Resolver() {
            @Override
            public ResolutionResult resolve(ResolutionContext context) {
                return body.apply(context);
            }

            @Override
            public String kind() {
                return kind;
            }

            @Override
            public String toString() {
                return "Resolver[" + kind + "]";
            }
        };
    }
}
