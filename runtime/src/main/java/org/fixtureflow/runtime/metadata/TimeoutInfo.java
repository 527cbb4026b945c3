package org.fixtureflow.runtime.metadata;

import java.time.Duration;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Value;
import org.fixtureflow.api.Timeout;
import org.fixtureflow.api.TimeoutMode;

/**
 * Timeout applying to a test or a fixture method, and the strategy used to enforce it.
 */
@Value
public class TimeoutInfo {

    @Nonnull
    Duration timeout;

    boolean cooperative;

    /**
     * Timeout declared on {@code annotation}, or the default one when there is no annotation.
     * Returns {@code null} when neither applies.
     */
    @Nullable
    public static TimeoutInfo of(@Nullable Timeout annotation, @Nonnull Duration defaultTimeout,
                                 boolean cooperativeByDefault) {
        if (annotation != null) {
            boolean cooperative = annotation.mode() == TimeoutMode.DEFAULT
                    ? cooperativeByDefault
                    : annotation.mode() == TimeoutMode.COOPERATIVE;
            return new TimeoutInfo(Duration.ofMillis(annotation.value()), cooperative);
        }
        if (defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            return null;
        }
        return new TimeoutInfo(defaultTimeout, cooperativeByDefault);
    }
}
