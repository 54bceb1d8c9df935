package com.dexrouter.backend.service.venue;

import com.dexrouter.backend.model.Venue;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Picks the venue for an order from the two quotes.
 * <p>
 * Estimated outputs that differ by less than {@link #SIMILAR_OUTPUT_PCT} percent of their mean count as the
 * same price, and the deeper pool wins. Otherwise the larger estimated output wins. Equal liquidity in the
 * similar-price case goes to {@link #TIE_PREFERENCE}, whatever order the quotes are passed in.
 */
@Component
public class VenueSelector {

    public static final double SIMILAR_OUTPUT_PCT = 0.1;
    public static final Venue TIE_PREFERENCE = Venue.METEORA;

    public VenueSelection select(QuotePair quotes) {
        return select(quotes.raydium(), quotes.meteora());
    }

    public VenueSelection select(Quote first, Quote second) {
        double outFirst = first.estimatedOutput();
        double outSecond = second.estimatedOutput();
        double mean = (outFirst + outSecond) / 2;
        double diffPct = mean > 0 ? Math.abs(outFirst - outSecond) / mean * 100 : 0.0;

        if (diffPct < SIMILAR_OUTPUT_PCT) {
            Quote winner = deeper(first, second);
            Quote loser = winner == first ? second : first;
            String reason = String.format(Locale.ROOT,
                    "Similar prices, %s has higher liquidity ($%.2fM vs $%.2fM)",
                    winner.venue().getDisplayName(),
                    winner.liquidity() / 1_000_000,
                    loser.liquidity() / 1_000_000);
            return new VenueSelection(winner.venue(), reason, diffPct);
        }

        Quote winner = outFirst > outSecond ? first : second;
        Quote loser = winner == first ? second : first;
        double advantage = (winner.estimatedOutput() - loser.estimatedOutput()) / loser.estimatedOutput() * 100;
        String reason = String.format(Locale.ROOT,
                "%s offers %.3f%% better output (%.2f vs %.2f)",
                winner.venue().getDisplayName(),
                advantage,
                winner.estimatedOutput(),
                loser.estimatedOutput());
        return new VenueSelection(winner.venue(), reason, diffPct);
    }

    private Quote deeper(Quote first, Quote second) {
        if (first.liquidity() > second.liquidity()) {
            return first;
        }
        if (second.liquidity() > first.liquidity()) {
            return second;
        }
        return second.venue() == TIE_PREFERENCE ? second : first;
    }
}
