package org.fixtureflow.runtime.model;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

/**
 * A container of test classes loaded through one class loader, the unit at which assembly
 * initialize and assembly cleanup run.
 */
@Builder
@Getter
@ToString(of = "id")
public class TestSource {

    @NonNull
    private final String id;

    @Default
    @NonNull
    private final ClassLoader classLoader = TestSource.class.getClassLoader();

    /** Every class of the source. Scanned for assembly fixtures and global hooks. */
    @Singular
    private final ImmutableList<String> classNames;

    @Default
    @NonNull
    private final SourceSettings settings = SourceSettings.EMPTY;

    public static TestSource of(String id, Class<?>... classes) {
        return TestSource.builder()
                .id(id)
                .classLoader(classes.length > 0
                        ? classes[0].getClassLoader() : TestSource.class.getClassLoader())
                .classNames(Arrays.stream(classes).map(Class::getName)
                        .collect(ImmutableList.toImmutableList()))
                .build();
    }
}
