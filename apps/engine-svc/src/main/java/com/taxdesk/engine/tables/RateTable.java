package com.taxdesk.engine.tables;

import com.taxdesk.engine.error.CalculationException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable progressive rate table. Brackets are contiguous, sorted ascending, start at zero and
 * end with a single unbounded band. Bases are derived from the lower bands when the table is built,
 * so the closed-form evaluation always agrees with the band-by-band sum.
 */
public final class RateTable {

    private final String name;
    private final List<Bracket> brackets;

    private RateTable(String name, List<Bracket> brackets) {
        this.name = name;
        this.brackets = List.copyOf(brackets);
    }

    public static RateTable of(String name, List<Band> bands) {
        if (bands == null || bands.isEmpty()) {
            throw CalculationException.configuration("Rate table " + name + " has no brackets");
        }
        List<Bracket> brackets = new ArrayList<>(bands.size());
        BigDecimal base = BigDecimal.ZERO;
        BigDecimal expectedMin = BigDecimal.ZERO;
        for (int i = 0; i < bands.size(); i++) {
            Band band = bands.get(i);
            boolean last = i == bands.size() - 1;
            if (band.min() == null || band.rate() == null) {
                throw CalculationException.configuration("Rate table " + name + " bracket " + i + " is incomplete");
            }
            if (band.min().compareTo(expectedMin) != 0) {
                throw CalculationException.configuration("Rate table " + name + " bracket " + i
                        + " starts at " + band.min() + " but previous bracket ends at " + expectedMin);
            }
            if (band.rate().signum() < 0 || band.rate().compareTo(BigDecimal.ONE) > 0) {
                throw CalculationException.configuration("Rate table " + name + " bracket " + i + " rate out of range: " + band.rate());
            }
            if (last && band.max() != null) {
                throw CalculationException.configuration("Rate table " + name + " must end with an unbounded bracket");
            }
            if (!last && (band.max() == null || band.max().compareTo(band.min()) <= 0)) {
                throw CalculationException.configuration("Rate table " + name + " bracket " + i + " bounds are not ascending");
            }
            brackets.add(new Bracket(band.min(), band.max(), band.rate(), base));
            if (!last) {
                base = base.add(band.max().subtract(band.min()).multiply(band.rate()));
                expectedMin = band.max();
            }
        }
        return new RateTable(name, brackets);
    }

    public String name() {
        return name;
    }

    public List<Bracket> brackets() {
        return brackets;
    }

    /**
     * Bracket whose half-open interval contains {@code income}; income on a boundary belongs to the upper band.
     */
    public Bracket bracketFor(BigDecimal income) {
        for (Bracket bracket : brackets) {
            if (bracket.contains(income)) {
                return bracket;
            }
        }
        return brackets.get(brackets.size() - 1);
    }

    public record Band(BigDecimal min, BigDecimal max, BigDecimal rate) {
    }
}
