package org.fixtureflow.runtime.model;

import com.google.common.collect.ImmutableListMultimap;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.Value;

/**
 * Identity of a discovered test, as handed over by discovery.
 *
 * <p>Elements carrying a {@link #getFixtureKind() fixture kind} are never executed. They
 * only report the outcome of that fixture once the source has finished.
 */
@Value
@Builder(toBuilder = true)
public class TestElement {

    @NonNull
    String sourceId;

    @NonNull
    String className;

    @NonNull
    String methodName;

    /**
     * Name identifying the element within its source. Defaults to {@code class.method}.
     */
    @Nullable
    String uniqueName;

    @Nullable
    String displayName;

    @Default
    @NonNull
    ImmutableListMultimap<String, String> traits = ImmutableListMultimap.of();

    boolean doNotParallelize;

    @Nullable
    FixtureKind fixtureKind;

    public String getUniqueName() {
        return uniqueName != null ? uniqueName : className + "." + methodName;
    }

    public String getDisplayName() {
        return displayName != null ? displayName : methodName;
    }

    public boolean isFixtureElement() {
        return fixtureKind != null;
    }

    public static TestElement of(String sourceId, Class<?> testClass, String methodName) {
        return TestElement.builder()
                .sourceId(sourceId)
                .className(testClass.getName())
                .methodName(methodName)
                .build();
    }
}
