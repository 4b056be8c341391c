package io.github.hide212131.langchain4j.agent.infra.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WorkflowTracerTest {

    private InMemorySpanExporter exporter;
    private OpenTelemetrySdk openTelemetry;
    private WorkflowTracer tracer;

    @BeforeEach
    void setUp() {
        exporter = InMemorySpanExporter.create();
        openTelemetry = OpenTelemetrySdk.builder()
                .setTracerProvider(SdkTracerProvider.builder()
                        .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                        .build())
                .build();
        tracer = WorkflowTracer.from(ObservabilityConfig.of(openTelemetry));
    }

    @AfterEach
    void tearDown() {
        openTelemetry.close();
    }

    @Test
    void trace_whenDisabled_shouldExecuteOperationWithoutTracing() {
        WorkflowTracer disabled = new WorkflowTracer(OpenTelemetry.noop().getTracer("test"), false);
        AtomicBoolean executed = new AtomicBoolean(false);

        disabled.trace("agent.run", Map.of(), () -> executed.set(true));

        assertThat(executed.get()).isTrue();
        assertThat(disabled.isEnabled()).isFalse();
        assertThat(WorkflowTracer.disabled().isEnabled()).isFalse();
    }

    @Test
    void trace_shouldRecordSpanWithAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("agent.name", "writer");
        attributes.put("agent.turn", 3);
        attributes.put("agent.finished", true);
        attributes.put("agent.cutoff", 0.7);
        attributes.put("agent.ignored", null);

        String result = tracer.trace("agent.turn", attributes, () -> "done");

        assertThat(result).isEqualTo("done");
        List<SpanData> spans = exporter.getFinishedSpanItems();
        assertThat(spans).hasSize(1);
        SpanData span = spans.get(0);
        assertThat(span.getName()).isEqualTo("agent.turn");
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("agent.name"))).isEqualTo("writer");
        assertThat(span.getAttributes().get(AttributeKey.longKey("agent.turn"))).isEqualTo(3L);
        assertThat(span.getAttributes().get(AttributeKey.booleanKey("agent.finished"))).isTrue();
        assertThat(span.getAttributes().get(AttributeKey.doubleKey("agent.cutoff"))).isEqualTo(0.7);
        assertThat(span.getAttributes().size()).isEqualTo(4);
    }

    @Test
    void trace_shouldMarkSpanFailedAndRethrow() {
        IllegalStateException failure = new IllegalStateException("tool crashed");

        assertThatThrownBy(() -> tracer.trace("agent.tool", null, () -> {
            throw failure;
        })).isSameAs(failure);

        SpanData span = exporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getStatus().getDescription()).isEqualTo("tool crashed");
        assertThat(span.getEvents()).extracting(event -> event.getName()).contains("exception");
    }

    @Test
    void addEvent_shouldAttachToCurrentSpan() {
        tracer.trace("agent.run", Map.of(), () -> {
            tracer.addEvent("context.overflow", Map.of("agent.turn", 2));
            tracer.addEvent("checkpoint", null);
        });

        SpanData span = exporter.getFinishedSpanItems().get(0);
        assertThat(span.getEvents()).extracting(event -> event.getName())
                .containsExactly("context.overflow", "checkpoint");
        assertThat(span.getEvents().get(0).getAttributes().get(AttributeKey.longKey("agent.turn"))).isEqualTo(2L);
    }

    @Test
    void addEvent_withoutSpan_shouldBeIgnored() {
        tracer.addEvent("orphan", Map.of("key", "value"));

        assertThat(exporter.getFinishedSpanItems()).isEmpty();
    }

    @Test
    void nestedTraces_shouldShareTraceAndLinkParent() {
        tracer.trace("agent.run", Map.of(), () -> tracer.trace("agent.tool", Map.of(), () -> "inner"));

        List<SpanData> spans = exporter.getFinishedSpanItems();
        assertThat(spans).extracting(SpanData::getName).containsExactly("agent.tool", "agent.run");
        assertThat(spans.get(0).getParentSpanId()).isEqualTo(spans.get(1).getSpanId());
        assertThat(spans.get(0).getTraceId()).isEqualTo(spans.get(1).getTraceId());
    }
}
