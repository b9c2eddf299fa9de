package com.logosk.semanticdb.spi;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Dialogue {

    private String id;
    private String context;
    @Builder.Default
    private List<String> participants = new ArrayList<>();
    private Instant startedAt;
    @Builder.Default
    private String status = "open";
}
