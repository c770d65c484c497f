package com.ctxlog.filter;

import com.ctxlog.context.RequestContext;
import com.ctxlog.identity.UserIdentityResolver;
import com.ctxlog.logging.BoundLogger;
import com.ctxlog.logging.LogEvent;
import com.ctxlog.logging.LogLevel;
import com.ctxlog.logging.LogRecord;
import com.ctxlog.logging.LoggingConfiguration;
import com.ctxlog.logging.StructuredLoggerFactory;
import com.ctxlog.support.InMemoryLogSink;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserContextFilterTest {

    private InMemoryLogSink sink;
    private Counter completed;
    private Counter failed;
    private UserContextFilter filter;

    @BeforeEach
    void setUp() {
        sink = new InMemoryLogSink();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        completed = registry.counter("completed");
        failed = registry.counter("failed");

        filter = new UserContextFilter(
                new UserIdentityResolver("X-User-Name"),
                new StructuredLoggerFactory(new LoggingConfiguration(LogLevel.DEBUG, sink)),
                completed,
                failed
        );
    }

    @Test
    void successfulRequestEmitsStartedThenCompletedWithSameRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/hello/world");
        request.addHeader("X-User-Name", "alice");
        request.addHeader("User-Agent", "junit");
        request.setQueryString("lang=en&greeting=good%20day");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> {
            BoundLogger handlerLogger = (BoundLogger) req.getAttribute(UserContextFilter.LOGGER_ATTRIBUTE);
            handlerLogger.info("handler event", Map.of("target_name", "world"));
            response.setStatus(201);
        });

        List<LogRecord> records = sink.records();
        assertThat(records)
                .extracting(LogRecord::event)
                .containsExactly(LogEvent.REQUEST_STARTED, "handler event", LogEvent.REQUEST_COMPLETED);

        LogRecord started = records.get(0);
        LogRecord completedRecord = records.get(2);

        assertThat(started.fields())
                .containsEntry("user", "alice")
                .containsEntry("route", "/hello/world")
                .containsEntry("method", "GET")
                .containsEntry("user_agent", "junit")
                .containsEntry("query_params", Map.of("lang", "en", "greeting", "good day"));
        assertThat(started.field("request_id")).isNotNull();
        assertThat(completedRecord.field("request_id")).isEqualTo(started.field("request_id"));
        assertThat(records.get(1).field("request_id")).isEqualTo(started.field("request_id"));
        assertThat(completedRecord.field("status_code")).isEqualTo(201);
        assertThat(completedRecord.field("duration_ms")).isInstanceOf(Long.class);
        assertThat(completedRecord.level()).isEqualTo(LogLevel.INFO);

        assertThat(response.getHeader(UserContextFilter.REQUEST_ID_HEADER))
                .isEqualTo(started.field("request_id"));
        assertThat(completed.count()).isEqualTo(1.0);
        assertThat(failed.count()).isZero();
    }

    @Test
    void anonymousRequestDoesNotBindUserAndDefaultsUserAgent() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");

        filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> { });

        LogRecord started = sink.records().get(0);
        assertThat(started.fields()).doesNotContainKey("user");
        assertThat(started.field("user_agent")).isEqualTo("unknown");
        assertThat(started.field("query_params")).isEqualTo(Map.of());

        RequestContext context = (RequestContext) request.getAttribute(UserContextFilter.CONTEXT_ATTRIBUTE);
        assertThat(context.currentUser()).isEmpty();
    }

    @Test
    void failingHandlerEmitsFailedEventAndRethrowsUnchanged() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/simulate-error");
        IllegalStateException failure = new IllegalStateException("handler exploded");
        FilterChain chain = (req, res) -> {
            throw new ServletException("Request processing failed: " + failure, failure);
        };

        assertThatThrownBy(() -> filter.doFilter(request, new MockHttpServletResponse(), chain))
                .isInstanceOf(ServletException.class)
                .hasCause(failure);

        assertThat(sink.records())
                .extracting(LogRecord::event)
                .containsExactly(LogEvent.REQUEST_STARTED, LogEvent.REQUEST_FAILED);

        LogRecord failedRecord = sink.records().get(1);
        assertThat(failedRecord.level()).isEqualTo(LogLevel.ERROR);
        assertThat(failedRecord.fields())
                .containsEntry("error", "handler exploded")
                .containsEntry("error_type", "IllegalStateException")
                .containsKey("duration_ms")
                .containsKey(BoundLogger.EXCEPTION_KEY)
                .doesNotContainKey("user");
        assertThat(failedRecord.field("request_id")).isEqualTo(sink.records().get(0).field("request_id"));

        assertThat(failed.count()).isEqualTo(1.0);
        assertThat(completed.count()).isZero();
    }

    @Test
    void runtimeExceptionFromChainIsRethrownAsIs() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        RuntimeException failure = new IllegalArgumentException("bad");

        assertThatThrownBy(() -> filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> {
            throw failure;
        })).isSameAs(failure);

        assertThat(sink.byEvent(LogEvent.REQUEST_FAILED)).singleElement()
                .satisfies(record -> assertThat(record.field("error_type")).isEqualTo("IllegalArgumentException"));
        assertThat(sink.byEvent(LogEvent.REQUEST_COMPLETED)).isEmpty();
    }

    @Test
    void ioExceptionFromChainIsLoggedAndRethrown() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        IOException failure = new IOException("client went away");

        assertThatThrownBy(() -> filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> {
            throw failure;
        })).isSameAs(failure);

        assertThat(sink.byEvent(LogEvent.REQUEST_FAILED)).hasSize(1);
    }

    @Test
    void eachRequestGetsItsOwnRequestId() throws Exception {
        AtomicReference<Object> first = new AtomicReference<>();

        filter.doFilter(new MockHttpServletRequest("GET", "/"), new MockHttpServletResponse(), (req, res) ->
                first.set(((RequestContext) req.getAttribute(UserContextFilter.CONTEXT_ATTRIBUTE)).requestId()));
        filter.doFilter(new MockHttpServletRequest("GET", "/"), new MockHttpServletResponse(), (req, res) -> { });

        List<LogRecord> started = sink.byEvent(LogEvent.REQUEST_STARTED);
        assertThat(started).hasSize(2);
        assertThat(started.get(0).field("request_id")).isEqualTo(first.get());
        assertThat(started.get(1).field("request_id")).isNotEqualTo(first.get());
    }

    @Test
    void malformedPercentEscapeInQueryStillLogsAndRunsChain() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.setQueryString("q=100%zz");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicBoolean chainRan = new AtomicBoolean();

        filter.doFilter(request, response, (req, res) -> chainRan.set(true));

        assertThat(chainRan).isTrue();
        assertThat(sink.records())
                .extracting(LogRecord::event)
                .containsExactly(LogEvent.REQUEST_STARTED, LogEvent.REQUEST_COMPLETED);
        assertThat(sink.records().get(0).field("query_params")).isEqualTo(Map.of("q", "100%zz"));
        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    void queryParamsUseFormDecodingAndKeepLastRepeatedValue() {
        assertThat(UserContextFilter.queryParams("q=good+day")).containsExactly(Map.entry("q", "good day"));
        assertThat(UserContextFilter.queryParams("a=1&a=2")).containsExactly(Map.entry("a", "2"));
        assertThat(UserContextFilter.queryParams("flag&x=%41")).containsExactly(
                Map.entry("flag", ""), Map.entry("x", "A"));
        assertThat(UserContextFilter.queryParams(null)).isEmpty();
    }

    @Test
    void startedEventCarriesFormDecodedQueryParams() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.setQueryString("q=good+day&a=1&a=2");

        filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> { });

        assertThat(sink.byEvent(LogEvent.REQUEST_STARTED)).singleElement()
                .satisfies(record -> assertThat(record.field("query_params"))
                        .isEqualTo(Map.of("q", "good day", "a", "2")));
    }

    @Test
    void routeIsPercentDecoded() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/hello/j%C3%B6rg");

        filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> { });

        assertThat(sink.byEvent(LogEvent.REQUEST_STARTED)).singleElement()
                .satisfies(record -> assertThat(record.field("route")).isEqualTo("/hello/jörg"));
        RequestContext context = (RequestContext) request.getAttribute(UserContextFilter.CONTEXT_ATTRIBUTE);
        assertThat(context.route()).isEqualTo("/hello/jörg");
    }

    @Test
    void malformedRouteEscapeIsLoggedRaw() {
        assertThat(UserContextFilter.routeOf(new MockHttpServletRequest("GET", "/files/100%zz")))
                .isEqualTo("/files/100%zz");
    }

    @Test
    void failureWithoutMessageLogsEmptyError() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        IllegalStateException failure = new IllegalStateException();

        assertThatThrownBy(() -> filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> {
            throw failure;
        })).isSameAs(failure);

        assertThat(sink.byEvent(LogEvent.REQUEST_FAILED)).singleElement()
                .satisfies(record -> assertThat(record.field("error")).isEqualTo(""));
    }

    @Test
    void unwrapReturnsInnermostServletCause() {
        IllegalStateException root = new IllegalStateException("root");
        ServletException wrapped = new ServletException("outer", new ServletException("inner", root));

        assertThat(UserContextFilter.unwrap(wrapped)).isSameAs(root);
        assertThat(UserContextFilter.unwrap(root)).isSameAs(root);
    }
}
