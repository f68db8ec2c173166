package com.messageworks.core.metrics;

import java.util.function.IntSupplier;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import lombok.Getter;

/**
 * 消息服务指标。
 * 指标名以上下文地址为前缀，例如 {@code messageworks./a/b.messages.sent}。
 */
public class MessagingMetrics {

    @Getter
    private final MetricRegistry metricRegistry;
    private final String prefix;

    /**
     * 消息统计
     */
    private final Meter sent;
    private final Meter received;
    private final Meter forwardedUpstream;
    private final Meter forwardedDownstream;
    private final Meter dropped;
    private final Meter responsesMatched;

    /**
     * 错误统计
     */
    private final Counter requestTimeouts;
    private final Counter dispatchErrors;

    public MessagingMetrics(MetricRegistry metricRegistry, String contextAddress) {
        this.metricRegistry = metricRegistry;
        this.prefix = MetricRegistry.name("messageworks", contextAddress);

        sent = metricRegistry.meter(MetricRegistry.name(prefix, "messages", "sent"));
        received = metricRegistry.meter(MetricRegistry.name(prefix, "messages", "received"));
        forwardedUpstream = metricRegistry.meter(MetricRegistry.name(prefix, "messages", "forwarded", "upstream"));
        forwardedDownstream = metricRegistry.meter(MetricRegistry.name(prefix, "messages", "forwarded", "downstream"));
        dropped = metricRegistry.meter(MetricRegistry.name(prefix, "messages", "dropped"));
        responsesMatched = metricRegistry.meter(MetricRegistry.name(prefix, "responses", "matched"));

        requestTimeouts = metricRegistry.counter(MetricRegistry.name(prefix, "requests", "timeouts"));
        dispatchErrors = metricRegistry.counter(MetricRegistry.name(prefix, "dispatch", "errors"));
    }

    /**
     * 注册当前待响应请求数的 Gauge。同名 Gauge 已存在时沿用已有的。
     */
    public void registerPendingGauge(IntSupplier pendingCount) {
        metricRegistry.gauge(MetricRegistry.name(prefix, "requests", "pending"),
                () -> (Gauge<Integer>) pendingCount::getAsInt);
    }

    public void recordSent() {
        sent.mark();
    }

    public void recordReceived() {
        received.mark();
    }

    public void recordForwardedUpstream() {
        forwardedUpstream.mark();
    }

    public void recordForwardedDownstream() {
        forwardedDownstream.mark();
    }

    public void recordDropped() {
        dropped.mark();
    }

    public void recordResponseMatched() {
        responsesMatched.mark();
    }

    public void recordTimeout() {
        requestTimeouts.inc();
    }

    public void recordDispatchError() {
        dispatchErrors.inc();
    }

    public long getSentCount() {
        return sent.getCount();
    }

    public long getReceivedCount() {
        return received.getCount();
    }

    public long getForwardedUpstreamCount() {
        return forwardedUpstream.getCount();
    }

    public long getForwardedDownstreamCount() {
        return forwardedDownstream.getCount();
    }

    public long getDroppedCount() {
        return dropped.getCount();
    }

    public long getResponsesMatchedCount() {
        return responsesMatched.getCount();
    }

    public long getTimeoutCount() {
        return requestTimeouts.getCount();
    }

    public long getDispatchErrorCount() {
        return dispatchErrors.getCount();
    }
}
