package com.schemaid.identity;

import com.schemaid.model.Identifier;

/**
 * Static entry point backed by one process-wide engine with default settings.
 */
public final class SchemaIdentity {

    private SchemaIdentity() {}

    private static final class Holder {
        private static final SchemaIdentityEngine ENGINE = new SchemaIdentityEngine();
    }

    public static SchemaIdentityEngine engine() {
        return Holder.ENGINE;
    }

    public static Identifier identifierFor(Class<?> model) {
        return engine().identifierFor(model);
    }

    public static boolean sameSchema(Class<?> a, Class<?> b) {
        return engine().sameSchema(a, b);
    }

    public static SchemaIdentityReport reportFor(Class<?> model) {
        return engine().reportFor(model);
    }

    public static Identifier rebuild(Class<?> model) {
        return engine().rebuild(model);
    }
}
