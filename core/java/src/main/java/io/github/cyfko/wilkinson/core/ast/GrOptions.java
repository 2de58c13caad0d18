package io.github.cyfko.wilkinson.core.ast;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options of a {@code gr(...)} grouping call. Absent options are {@code null}.
 *
 * @param cor  whether group-level effects are correlated
 * @param id   cross-parameter correlation id
 * @param by   variable splitting the group-level variance by level
 * @param cov  whether a user-defined covariance matrix is used
 * @param dist distribution of the group-level effects
 * @since 1.0.0
 */
public record GrOptions(Boolean cor, String id, String by, Boolean cov, String dist) {

    public static GrOptions none() {
        return new GrOptions(null, null, null, null, null);
    }

    /**
     * @return true unless {@code cor = FALSE} was given
     */
    public boolean correlated() {
        return cor == null || cor;
    }

    /**
     * @return the options that were given, in declaration order of the record
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (cor != null) map.put("cor", cor);
        if (id != null) map.put("id", id);
        if (by != null) map.put("by", by);
        if (cov != null) map.put("cov", cov);
        if (dist != null) map.put("dist", dist);
        return map;
    }
}
