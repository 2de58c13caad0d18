package io.github.cyfko.wilkinson.core.config;

/**
 * Configuration of the parse-result cache of {@code DefaultFormulaParser}.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>cacheEnabled</strong>: keep built metadata keyed by formula text (default: true)</li>
 *   <li><strong>cacheSize</strong>: maximum number of cached formulas (default: 1000)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CachePolicy.defaults();   // enabled, 1000 entries
 * CachePolicy.strict();     // enabled, 500 entries
 * CachePolicy.relaxed();    // enabled, 2000 entries
 * CachePolicy.none();       // disabled
 * CachePolicy.custom(50);   // enabled, 50 entries
 * }</pre>
 *
 * @param cacheEnabled whether results are cached
 * @param cacheSize    maximum number of entries, positive even when disabled
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(boolean cacheEnabled, int cacheSize) {

    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    /**
     * @return enabled cache of 1000 entries
     */
    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    /**
     * Smaller cache for services parsing untrusted formulas.
     *
     * @return enabled cache of 500 entries
     */
    public static CachePolicy strict() {
        return new CachePolicy(true, 500);
    }

    /**
     * @return enabled cache of 2000 entries
     */
    public static CachePolicy relaxed() {
        return new CachePolicy(true, 2000);
    }

    /**
     * Caching disabled: every call runs the full pipeline.
     *
     * @return a disabled cache policy
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
