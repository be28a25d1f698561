package eu.virtualparadox.ctxstore.util;

import java.util.UUID;

public class Ids {

    private Ids() {
        // prevent instantiation
    }

    /**
     * Generates a new identifier: a random UUID with dashes removed.
     *
     * @return 32 character hex identifier
     */
    public static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
