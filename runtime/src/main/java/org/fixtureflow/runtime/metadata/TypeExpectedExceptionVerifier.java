package org.fixtureflow.runtime.metadata;

import com.google.common.base.Strings;
import lombok.RequiredArgsConstructor;
import org.fixtureflow.api.ExpectedException;
import org.fixtureflow.util.ExceptionUtil;

/**
 * Accepts exceptions of the type named by {@link ExpectedException}.
 */
@RequiredArgsConstructor
public class TypeExpectedExceptionVerifier implements ExpectedExceptionVerifier {

    private final Class<? extends Throwable> expectedType;

    private final boolean allowDerivedTypes;

    private final String message;

    public static TypeExpectedExceptionVerifier of(ExpectedException annotation) {
        return new TypeExpectedExceptionVerifier(annotation.value(),
                annotation.allowDerivedTypes(), annotation.message());
    }

    @Override
    public void verify(Throwable thrown) {
        boolean matches = allowDerivedTypes
                ? expectedType.isInstance(thrown)
                : expectedType.equals(thrown.getClass());
        if (matches) {
            return;
        }
        // let inconclusive results through untouched
        if (ExceptionUtil.isInconclusive(thrown)) {
            throw (RuntimeException) thrown;
        }
        String detail = "Test method threw exception " + thrown.getClass().getName()
                + ", but exception " + expectedType.getName() + " was expected. Exception message: "
                + ExceptionUtil.formattedMessage(thrown);
        throw new AssertionError(Strings.isNullOrEmpty(message) ? detail : message + " " + detail,
                thrown);
    }

    @Override
    public String noExceptionMessage(String className, String methodName) {
        String detail = "Test method " + className + "." + methodName
                + " did not throw expected exception " + expectedType.getName() + ".";
        return Strings.isNullOrEmpty(message) ? detail : detail + " " + message;
    }
}
