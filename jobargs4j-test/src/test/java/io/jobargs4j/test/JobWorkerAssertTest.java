package io.jobargs4j.test;

import io.jobargs4j.InvalidArgsException;
import io.jobargs4j.JobContext;
import io.jobargs4j.JobWorker;
import io.jobargs4j.schema.Default;
import io.jobargs4j.schema.Nullable;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.jobargs4j.test.JobArgsAssertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobWorkerAssertTest {

    static class NotifyWorker implements JobWorker<NotifyWorker.Args> {

        record Args(
                long userId,
                @Default("false") boolean notify,
                @Default("[\"email\"]") List<String> channels,
                @Nullable String note
        ) {
        }

        @Override
        public Object run(JobContext<Args> context) {
            return null;
        }
    }

    static class PingWorker implements JobWorker<Void> {
    }

    @Test
    void hasArgChecksNameAndType() {
        assertThat(new NotifyWorker())
                .hasArg("userId")
                .hasArg("userId", long.class)
                .hasArg("userId", Long.class)
                .hasArg("channels", List.class);
    }

    @Test
    void hasArgReportsDefinedArguments() {
        assertThatThrownBy(() -> assertThat(new NotifyWorker()).hasArg("email"))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("NotifyWorker.Args to have argument 'email', but it was not defined")
                .hasMessageContaining("'userId', 'notify', 'channels', 'note'");

        assertThatThrownBy(() -> assertThat(new NotifyWorker()).hasArg("userId", String.class))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("to be String, but was long");
    }

    @Test
    void hasArgWithDefaultComparesDefaults() {
        assertThat(new NotifyWorker())
                .hasArgWithDefault("notify", boolean.class, false)
                .hasArgWithDefault("channels", List.class, List.of("email"))
                .hasArgWithDefault("note", String.class, null);

        assertThatThrownBy(() -> assertThat(new NotifyWorker()).hasArgWithDefault("notify", boolean.class, true))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("to have default value true, but was false");
        assertThatThrownBy(() -> assertThat(new NotifyWorker()).hasArgWithDefault("userId", long.class, 0L))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("to have a default value, but it was required");
    }

    @Test
    void hasArgsChecksSeveralAtOnce() {
        Map<String, Class<?>> expected = new LinkedHashMap<>();
        expected.put("userId", Long.class);
        expected.put("notify", Boolean.class);
        assertThat(new NotifyWorker()).hasArgs(expected);

        expected.put("missing", String.class);
        assertThatThrownBy(() -> assertThat(new NotifyWorker()).hasArgs(expected))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("'missing' is not defined");
    }

    @Test
    void hasNoArgsDistinguishesWorkers() {
        assertThat(new PingWorker()).hasNoArgs();

        assertThatThrownBy(() -> assertThat(new NotifyWorker()).hasNoArgs())
                .isInstanceOf(AssertionError.class);
        assertThatThrownBy(() -> assertThat(new PingWorker()).hasArg("anything"))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("declares none");
    }

    @Test
    void acceptsAndRejectsArgs() {
        assertThat(new NotifyWorker()).acceptsArgs(Map.of("userId", 1L, "notify", true));

        assertThat(new NotifyWorker())
                .rejectsArgs(Map.of("notify", true))
                .isInstanceOf(InvalidArgsException.class)
                .hasMessageContaining("userId");

        assertThatThrownBy(() -> assertThat(new NotifyWorker()).rejectsArgs(Map.of("userId", 1L)))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("to reject");
        assertThatThrownBy(() -> assertThat(new NotifyWorker()).acceptsArgs(Map.of("userId", "1")))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("InvalidArgsException");
    }
}
