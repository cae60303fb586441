package org.catalogsearch.ranking.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Everything the scorers may read for one request.
 *
 * <p>The reference time is part of the input so that time-of-day and seasonal signals are
 * reproducible for identical requests. A {@code null} reference time falls back to the current
 * instant, which makes the month and (without a user hour) the hour depend on the wall clock.</p>
 */
public record ScoringContext(
        QueryContext query,
        UserContext user,
        GeoContext geo,
        SessionContext session,
        Instant referenceTime
) {

    public ScoringContext {
        referenceTime = Objects.requireNonNullElseGet(referenceTime, Instant::now);
    }

    public static ScoringContext of(QueryContext query) {
        return new ScoringContext(query, null, null, null, null);
    }

    public boolean hasUser() {
        return user != null;
    }

    public boolean hasGeo() {
        return geo != null;
    }

    /**
     * Returns the hour of day of the request: the user's local hour when supplied, UTC otherwise.
     */
    public int hourOfDay() {
        if (user != null && user.getHourOfDay() != null) {
            return Math.floorMod(user.getHourOfDay(), 24);
        }
        return referenceTime.atZone(ZoneOffset.UTC).getHour();
    }

    public int month() {
        ZonedDateTime utc = referenceTime.atZone(ZoneOffset.UTC);
        return utc.getMonthValue();
    }
}
