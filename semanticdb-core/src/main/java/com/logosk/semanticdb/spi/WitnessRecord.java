package com.logosk.semanticdb.spi;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Tamper evidence for one exported artifact: the digest of its content at the time the
 * witness was created.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WitnessRecord {

    private String witnessId;
    private String artifactId;
    private String algorithm;
    private String contentHash;
    @Builder.Default
    private List<String> participants = new ArrayList<>();
    private Instant createdAt;
}
