package org.fixtureflow.runtime.context;

import org.fixtureflow.runtime.model.TestResult;

/**
 * Output captured while running one test or one fixture. Writes may come from the test
 * thread and from the thread running a hard timed out body, hence the synchronization.
 */
public class LogBuffer {

    private final StringBuffer out = new StringBuffer();

    private final StringBuffer err = new StringBuffer();

    private final StringBuffer messages = new StringBuffer();

    public void appendOut(String text) {
        out.append(text);
    }

    public void appendErr(String text) {
        err.append(text);
    }

    public void appendMessage(String line) {
        messages.append(line).append(System.lineSeparator());
    }

    /**
     * Moves everything captured so far into the result and clears the buffer.
     */
    public synchronized TestResult drainInto(TestResult result) {
        TestResult captured = new TestResult()
                .setStandardOut(drain(out))
                .setStandardError(drain(err))
                .setTestContextMessages(drain(messages));
        return result.appendLogs(captured);
    }

    private static String drain(StringBuffer buffer) {
        synchronized (buffer) {
            String text = buffer.toString();
            buffer.setLength(0);
            return text;
        }
    }
}
