package org.tamodel.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is covered by an
 * {@link AllowLog} or {@link ExpectLog} on the test method or class, and fails a
 * test whose {@link ExpectLog} events did not occur.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final Level FAIL_LEVEL = Level.WARN;

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(findAllowLogs(context), findExpectLogs(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingFilter.class);
        if (filter == null) return;
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        List<String> problems = new ArrayList<>();
        for (CapturedEvent event : filter.events) {
            if (event.level.isGreaterOrEqual(FAIL_LEVEL) && !filter.isCovered(event)) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (ExpectLog expected : filter.expects) {
            long count = filter.events.stream().filter(e -> matches(e, expected)).count();
            if (count < expected.occurrences()) {
                problems.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        expected.occurrences(), expected.level(), expected.loggerPattern(),
                        expected.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static AllowLog[] findAllowLogs(ExtensionContext context) {
        List<AllowLog> all = new ArrayList<>();
        context.getTestClass().ifPresent(c -> all.addAll(List.of(c.getAnnotationsByType(AllowLog.class))));
        context.getTestMethod().ifPresent(m -> all.addAll(List.of(m.getAnnotationsByType(AllowLog.class))));
        return all.toArray(new AllowLog[0]);
    }

    private static ExpectLog[] findExpectLogs(ExtensionContext context) {
        List<ExpectLog> all = new ArrayList<>();
        context.getTestClass().ifPresent(c -> all.addAll(List.of(c.getAnnotationsByType(ExpectLog.class))));
        context.getTestMethod().ifPresent(m -> all.addAll(List.of(m.getAnnotationsByType(ExpectLog.class))));
        return all.toArray(new ExpectLog[0]);
    }

    private static boolean matches(CapturedEvent event, ExpectLog expected) {
        return matches(event, expected.level(), expected.loggerPattern(), expected.messagePattern());
    }

    private static boolean matches(CapturedEvent event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.loggerName)
                && Pattern.matches(messagePattern, event.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private final AllowLog[] allows;
        private final ExpectLog[] expects;

        CapturingFilter(AllowLog[] allows, ExpectLog[] expects) {
            this.allows = allows;
            this.expects = expects;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            if (!level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            String message = format == null ? "" : MessageFormatter.arrayFormat(format, params).getMessage();
            CapturedEvent event = new CapturedEvent(logger.getName(), level, message);
            events.add(event);
            // Covered events are kept out of the test output.
            return isCovered(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        boolean isCovered(CapturedEvent event) {
            for (AllowLog allow : allows) {
                if (matches(event, allow.level(), allow.loggerPattern(), allow.messagePattern())) return true;
            }
            for (ExpectLog expect : expects) {
                if (matches(event, expect)) return true;
            }
            return false;
        }
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }
}
