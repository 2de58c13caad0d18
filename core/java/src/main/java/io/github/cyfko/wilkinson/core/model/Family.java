package io.github.cyfko.wilkinson.core.model;

import java.util.Optional;

/**
 * Response distribution families accepted by {@code family = ...}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Family {
    GAUSSIAN("gaussian", true),
    STUDENT("student", true),
    BINOMIAL("binomial", true),
    BERNOULLI("bernoulli", true),
    POISSON("poisson", true),
    NEGBINOMIAL("negbinomial", true),
    GEOMETRIC("geometric", true),
    GAMMA("gamma", true),
    LOGNORMAL("lognormal", true),
    WEIBULL("weibull", true),
    EXPONENTIAL("exponential", true),
    BETA("beta", true),
    CATEGORICAL("categorical", true),
    // ordinal families estimate thresholds instead of an intercept
    CUMULATIVE("cumulative", false),
    SRATIO("sratio", false),
    CRATIO("cratio", false),
    ACAT("acat", false);

    private final String familyName;
    private final boolean supportsIntercept;

    Family(String familyName, boolean supportsIntercept) {
        this.familyName = familyName;
        this.supportsIntercept = supportsIntercept;
    }

    /**
     * @return the name used in formulas and in the output, e.g. {@code "gaussian"}
     */
    public String familyName() {
        return familyName;
    }

    /**
     * @return whether a population-level intercept is part of the model by default
     */
    public boolean supportsIntercept() {
        return supportsIntercept;
    }

    /**
     * Resolves a family by its formula name.
     *
     * @param name family name as written, case-sensitive
     * @return the family, or empty when unknown
     */
    public static Optional<Family> fromName(String name) {
        for (Family family : values()) {
            if (family.familyName.equals(name)) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return familyName;
    }
}
