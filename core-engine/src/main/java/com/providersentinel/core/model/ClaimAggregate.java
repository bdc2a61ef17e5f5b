package com.providersentinel.core.model;

import java.time.YearMonth;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per-provider roll-up of every claim billed under one identifier.
 *
 * <p>
 * All monthly series are ordered by month and unmodifiable. A provider that
 * appears only in the registry carries {@link #EMPTY}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClaimAggregate {

    /** Aggregate of a provider with no claims. */
    public static final ClaimAggregate EMPTY = new ClaimAggregate(
            new TreeMap<>(), new TreeMap<>(), new TreeMap<>(), 0);

    private final SortedMap<YearMonth, Double> monthlyPaid;
    private final SortedMap<YearMonth, Integer> monthlyClaimCount;
    private final SortedMap<YearMonth, Integer> monthlyBeneficiaries;
    private final double totalPaid;
    private final long totalClaims;
    private final long totalUniqueBeneficiaries;

    /**
     * @param monthlyPaid          paid amount per service month
     * @param monthlyClaimCount    number of claims per service month
     * @param monthlyBeneficiaries distinct beneficiaries per service month
     * @param totalUniqueBeneficiaries distinct beneficiaries across all months
     */
    public ClaimAggregate(Map<YearMonth, Double> monthlyPaid,
            Map<YearMonth, Integer> monthlyClaimCount,
            Map<YearMonth, Integer> monthlyBeneficiaries,
            long totalUniqueBeneficiaries) {
        this.monthlyPaid = Collections.unmodifiableSortedMap(
                new TreeMap<>(Objects.requireNonNull(monthlyPaid, "monthlyPaid must not be null")));
        this.monthlyClaimCount = Collections.unmodifiableSortedMap(
                new TreeMap<>(Objects.requireNonNull(monthlyClaimCount, "monthlyClaimCount must not be null")));
        this.monthlyBeneficiaries = Collections.unmodifiableSortedMap(
                new TreeMap<>(Objects.requireNonNull(monthlyBeneficiaries, "monthlyBeneficiaries must not be null")));

        double paid = 0;
        for (double v : this.monthlyPaid.values()) {
            paid += v;
        }
        long claims = 0;
        for (int c : this.monthlyClaimCount.values()) {
            claims += c;
        }
        this.totalPaid = paid;
        this.totalClaims = claims;
        this.totalUniqueBeneficiaries = totalUniqueBeneficiaries;
    }

    public double getTotalPaid() {
        return totalPaid;
    }

    public long getTotalClaims() {
        return totalClaims;
    }

    /**
     * A beneficiary seen in several months counts once, so this is at most
     * the sum of {@link #getMonthlyBeneficiaries()}.
     */
    public long getTotalUniqueBeneficiaries() {
        return totalUniqueBeneficiaries;
    }

    public boolean hasClaims() {
        return totalClaims > 0;
    }

    public SortedMap<YearMonth, Double> getMonthlyPaid() {
        return monthlyPaid;
    }

    public SortedMap<YearMonth, Integer> getMonthlyClaimCount() {
        return monthlyClaimCount;
    }

    public SortedMap<YearMonth, Integer> getMonthlyBeneficiaries() {
        return monthlyBeneficiaries;
    }

    /**
     * Month with the highest claim count; the earliest such month on ties.
     *
     * @return peak month, empty when there are no claims
     */
    public Optional<YearMonth> getPeakClaimMonth() {
        YearMonth peak = null;
        int peakCount = -1;
        for (Map.Entry<YearMonth, Integer> e : monthlyClaimCount.entrySet()) {
            if (e.getValue() > peakCount) {
                peak = e.getKey();
                peakCount = e.getValue();
            }
        }
        return Optional.ofNullable(peak);
    }

    @Override
    public String toString() {
        return "ClaimAggregate{" +
                "totalPaid=" + totalPaid +
                ", totalClaims=" + totalClaims +
                ", totalUniqueBeneficiaries=" + totalUniqueBeneficiaries +
                ", months=" + monthlyPaid.size() +
                '}';
    }
}
