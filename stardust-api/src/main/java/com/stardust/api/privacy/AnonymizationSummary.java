package com.stardust.api.privacy;

import java.time.Instant;
import java.util.UUID;

public record AnonymizationSummary(
        UUID requestId,
        String anonymousId,
        int recordsProcessed,
        Instant anonymizedAt
) {}
