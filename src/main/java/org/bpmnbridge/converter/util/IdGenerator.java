package org.bpmnbridge.converter.util;

import java.util.UUID;

public class IdGenerator {

    /**
     * Creates an id like {@code Flow_0a1b2c3}: the prefix plus seven random hex digits.
     */
    public static String randomId(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 7);
    }
}
