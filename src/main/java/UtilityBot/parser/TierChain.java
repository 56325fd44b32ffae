package UtilityBot.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Geordnete Liste von Suchstufen, die erste Stufe mit Treffer gewinnt.
 * Spätere Stufen werden danach nicht mehr ausgewertet.
 *
 * Ordered list of matching tiers; the first tier that yields a value wins.
 */
public final class TierChain {

    /**
     * Eine benannte Suchstufe.
     */
    public record Tier(String name, Function<String, Optional<String>> matcher) { }

    /**
     * Treffer inklusive der Stufe, die ihn geliefert hat.
     */
    public record TierMatch(String tier, String value) { }

    private final List<Tier> tiers;

    private TierChain(List<Tier> tiers) {
        this.tiers = Collections.unmodifiableList(new ArrayList<>(tiers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> firstMatch(String text) {
        return firstMatchWithTier(text).map(TierMatch::value);
    }

    public Optional<TierMatch> firstMatchWithTier(String text) {
        for (Tier tier : tiers) {
            Optional<String> value = tier.matcher().apply(text);
            if (value.isPresent()) {
                return Optional.of(new TierMatch(tier.name(), value.get()));
            }
        }
        return Optional.empty();
    }

    public List<String> tierNames() {
        return tiers.stream().map(Tier::name).toList();
    }

    public static final class Builder {

        private final List<Tier> tiers = new ArrayList<>();

        private Builder() {
        }

        public Builder tier(String name, Function<String, Optional<String>> matcher) {
            tiers.add(new Tier(name, matcher));
            return this;
        }

        public TierChain build() {
            if (tiers.isEmpty()) {
                throw new IllegalStateException("TierChain ohne Stufen");
            }
            return new TierChain(tiers);
        }
    }
}
