package com.dexrouter.backend.service.venue;

import com.dexrouter.backend.model.Venue;

public record VenueSelection(Venue venue, String reason, double outputDiffPct) {
}
