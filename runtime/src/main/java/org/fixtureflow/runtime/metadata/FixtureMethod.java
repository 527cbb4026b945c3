package org.fixtureflow.runtime.metadata;

import java.lang.reflect.Method;
import javax.annotation.Nullable;
import lombok.Value;
import org.fixtureflow.api.TestContext;

/**
 * A static initialize or cleanup method of a class or a source.
 */
@Value
public class FixtureMethod {

    Method method;

    @Nullable
    TimeoutInfo timeout;

    public boolean takesContext() {
        return method.getParameterCount() == 1;
    }

    public String getClassName() {
        return method.getDeclaringClass().getName();
    }

    public String getName() {
        return method.getName();
    }

    public Object[] arguments(TestContext context) {
        return takesContext() ? new Object[] {context} : new Object[0];
    }

    @Override
    public String toString() {
        return getClassName() + "." + getName();
    }
}
