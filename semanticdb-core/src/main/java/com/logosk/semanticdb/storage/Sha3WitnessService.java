package com.logosk.semanticdb.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.logosk.semanticdb.spi.WitnessRecord;
import com.logosk.semanticdb.spi.WitnessService;
import com.logosk.semanticdb.util.CommonUtils;
import com.logosk.semanticdb.util.JsonUtils;
import org.jboss.logging.Logger;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;

/**
 * Witnesses artifacts with a SHA3-256 digest of their canonical JSON form, so the same
 * content hashes identically regardless of map insertion order.
 */
public class Sha3WitnessService implements WitnessService {

    private static final Logger LOG = Logger.getLogger(Sha3WitnessService.class);
    public static final String ALGORITHM = "SHA3-256";

    private final Clock clock;

    public Sha3WitnessService() {
        this(Clock.systemUTC());
    }

    public Sha3WitnessService(Clock clock) {
        this.clock = clock;
    }

    @Override
    public WitnessRecord createWitness(String artifactId, Object content, List<String> participants) {
        String hash = hash(content);
        WitnessRecord witness = WitnessRecord.builder()
                .witnessId(CommonUtils.shortId("W_", 12))
                .artifactId(artifactId)
                .algorithm(ALGORITHM)
                .contentHash(hash)
                .participants(participants != null ? List.copyOf(participants) : List.of())
                .createdAt(clock.instant())
                .build();
        LOG.debugf("Witness %s for %s: %s", witness.getWitnessId(), artifactId, hash);
        return witness;
    }

    @Override
    public boolean verify(WitnessRecord witness, Object content) {
        if (witness == null || witness.getContentHash() == null) {
            return false;
        }
        return witness.getContentHash().equals(hash(content));
    }

    String hash(Object content) {
        try {
            return CommonUtils.digestHex(ALGORITHM, JsonUtils.instance().toCanonicalJson(content));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialise witnessed content", e);
        }
    }
}
