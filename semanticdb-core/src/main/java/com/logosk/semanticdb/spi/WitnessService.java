package com.logosk.semanticdb.spi;

import java.util.List;

public interface WitnessService {

    WitnessRecord createWitness(String artifactId, Object content, List<String> participants);

    /**
     * @return {@code true} when {@code content} still hashes to the witnessed digest
     */
    boolean verify(WitnessRecord witness, Object content);
}
