package com.messageworks.core.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

import com.codahale.metrics.MetricRegistry;
import com.messageworks.core.channel.ChannelAdapter;
import com.messageworks.core.channel.MessageListener;
import com.messageworks.core.config.MessagingConfig;
import com.messageworks.core.environment.ContextEnvironment;
import com.messageworks.core.id.IdGenerator;
import com.messageworks.core.id.UuidIdGenerator;
import com.messageworks.core.message.Address;
import com.messageworks.core.message.Message;
import com.messageworks.core.message.MessageType;
import com.messageworks.core.message.MessageUtils;
import com.messageworks.core.message.ResponseMessage;
import com.messageworks.core.metrics.MessagingMetrics;
import com.messageworks.core.route.ChildRoute;
import com.messageworks.core.route.RouteManager;
import com.messageworks.core.util.AddressUtils;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 执行上下文的消息路由器。
 * <p>
 * 每个执行上下文显式构造一个实例并注入给需要它的代码。路由器只知道自己的地址、上游通道和直接注册的子上下文，
 * 逐跳决定消息是本地处理、转发到上游还是分发给子上下文，并用请求 id 关联请求与响应。
 * <p>
 * 状态机：{@code UNINITIALIZED -> READY -> TORN_DOWN}。{@link #send} 和 {@link #addChild} 在未初始化时会先初始化。
 * 内部映射均为并发映射，入站回调和公共 API 可以来自不同线程。
 */
@Slf4j
public class MessagingService {

    private static final MessageListener NO_OP = message -> {
    };

    private final ContextEnvironment environment;
    private final IdGenerator idGenerator;
    @Getter
    private final MessagingConfig config;
    private final MetricRegistry metricRegistry;

    private final ConcurrentMap<String, ChildRoute> children = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, PendingResponder> pendingResponders = new ConcurrentHashMap<>();
    private final MessageListener upstreamListener = message -> handleInbound(message, true);

    private volatile MessageListener messageReceived = NO_OP;
    @Getter
    private volatile MessagingServiceState state = MessagingServiceState.UNINITIALIZED;
    private volatile Address address;
    private volatile RouteManager routeManager;
    private volatile ChannelAdapter upstreamChannel;
    @Getter
    private volatile MessagingMetrics metrics;

    private volatile Timer timer;
    private final boolean ownsTimer;

    public MessagingService(ContextEnvironment environment) {
        this(environment, MessagingConfig.defaults());
    }

    public MessagingService(ContextEnvironment environment, MessagingConfig config) {
        this(environment, new UuidIdGenerator(), config, new MetricRegistry());
    }

    public MessagingService(ContextEnvironment environment, IdGenerator idGenerator, MessagingConfig config,
            MetricRegistry metricRegistry) {
        this(environment, idGenerator, config, metricRegistry, null);
    }

    /**
     * @param timer 请求超时使用的定时器；为 null 时在首次需要时创建，并在 {@link #cleanUp()} 时停止
     */
    public MessagingService(ContextEnvironment environment, IdGenerator idGenerator, MessagingConfig config,
            MetricRegistry metricRegistry, Timer timer) {
        if (environment == null) {
            throw new IllegalArgumentException("environment must not be null");
        }
        this.environment = environment;
        this.idGenerator = idGenerator != null ? idGenerator : new UuidIdGenerator();
        this.config = config != null ? config : MessagingConfig.defaults();
        this.metricRegistry = metricRegistry != null ? metricRegistry : new MetricRegistry();
        this.timer = timer;
        this.ownsTimer = timer == null;
    }

    /**
     * 解析本上下文地址，非根上下文订阅上游通道。上游订阅失败只记录日志，服务仍进入 READY。
     */
    public synchronized void initialize() {
        if (state != MessagingServiceState.UNINITIALIZED) {
            return;
        }
        Address resolved = environment.getAddress();
        if (resolved == null) {
            throw new IllegalStateException("environment returned no address");
        }
        address = resolved;
        routeManager = new RouteManager(resolved, children);
        metrics = new MessagingMetrics(metricRegistry, resolved.toString());
        metrics.registerPendingGauge(pendingResponders::size);

        if (!environment.isRoot()) {
            Optional<ChannelAdapter> upstream = environment.getUpstreamChannel();
            if (upstream.isPresent()) {
                upstreamChannel = upstream.get();
                try {
                    upstreamChannel.subscribe(upstreamListener);
                } catch (RuntimeException e) {
                    log.error("MessagingService {}: 订阅上游通道 {} 失败，继续以其他链路运行", resolved,
                            upstreamChannel.getName(), e);
                }
            } else {
                log.warn("MessagingService {}: 非根上下文没有上游通道", resolved);
            }
        }

        state = MessagingServiceState.READY;
        log.info("MessagingService {}: 已初始化 (environment={})", resolved, environment);
    }

    /**
     * 本上下文地址。
     */
    public Address getAddress() {
        ensureInitialized();
        return address;
    }

    /**
     * 注册直接子上下文 {@code here + name}。重复注册同名子上下文会替换原有注册。
     * name 为空、不是单个分段或 channel 为 null 时只记录日志并跳过。
     */
    public void addChild(String name, ChannelAdapter channel) {
        if (name == null || name.isBlank() || channel == null) {
            log.warn("MessagingService: addChild 缺少名称或通道 (name={}, channel={})，已跳过", name, channel);
            return;
        }
        ensureInitialized();
        if (state == MessagingServiceState.TORN_DOWN) {
            log.warn("MessagingService {}: 服务已清理，忽略子上下文 {}", address, name);
            return;
        }
        List<String> segments = AddressUtils.toSegments(name);
        if (segments.size() != 1) {
            log.warn("MessagingService {}: 子上下文名称 '{}' 必须是单个地址分段，已跳过", address, name);
            return;
        }
        String childName = segments.get(0);
        Address childAddress = address.child(childName);

        MessageListener listener = message -> handleInbound(message, false);
        ChildRoute route = new ChildRoute(childName, childAddress, channel, listener);

        ChildRoute previous = children.put(childName, route);
        if (previous != null) {
            unsubscribeQuietly(previous.getChannel(), previous.getListener());
            log.info("MessagingService {}: 子上下文 {} 已被替换", address, childAddress);
        }
        try {
            channel.subscribe(listener);
        } catch (RuntimeException e) {
            log.error("MessagingService {}: 订阅子上下文 {} 的通道 {} 失败", address, childAddress, channel.getName(), e);
        }
        log.info("MessagingService {}: 已添加子上下文 {} (channel={})", address, childAddress, channel.getName());
    }

    /**
     * 移除子上下文并取消订阅其通道。未注册的名称直接忽略。
     */
    public void removeChild(String name) {
        if (name == null) {
            return;
        }
        List<String> segments = AddressUtils.toSegments(name);
        ChildRoute removed = segments.size() == 1 ? children.remove(segments.get(0)) : null;
        if (removed == null) {
            log.debug("MessagingService {}: 子上下文 {} 未注册，忽略移除", address, name);
            return;
        }
        unsubscribeQuietly(removed.getChannel(), removed.getListener());
        log.info("MessagingService {}: 已移除子上下文 {}", address, removed.getAddress());
    }

    /**
     * 当前已注册子上下文的只读视图（名称 -> 地址）。
     */
    public Map<String, Address> getChildren() {
        Map<String, Address> result = new LinkedHashMap<>();
        children.forEach((name, route) -> result.put(name, route.getAddress()));
        return Collections.unmodifiableMap(result);
    }

    public int getPendingRequestCount() {
        return pendingResponders.size();
    }

    public CompletableFuture<Optional<ResponseMessage>> send(Message message) {
        return send(message, null, null);
    }

    public CompletableFuture<Optional<ResponseMessage>> send(Message message, ChannelAdapter channelOverride) {
        return send(message, channelOverride, null);
    }

    public CompletableFuture<Optional<ResponseMessage>> send(Message message, Duration timeout) {
        return send(message, null, timeout);
    }

    /**
     * 发送消息。填写 {@code source} 为本上下文地址并分配新的 {@code id}，然后按以下优先级选择路由：
     * 指定通道 -> 上游（目标位于上游方向） -> 下游（广播则全部子上下文，否则为完全匹配或下一跳的子上下文）。
     * <p>
     * 请求消息返回的 future 在收到第一个关联响应时完成；其他消息立即以空结果完成。
     * 没有可用路由时以空结果完成，不分发也不报错。
     *
     * @param channelOverride 直接使用的通道，可为 null
     * @param timeout         请求超时，为 null 时使用配置中的默认值，零或负数表示不超时
     * @return 响应 future；服务已清理、请求无法分发或超时时异常完成
     */
    public CompletableFuture<Optional<ResponseMessage>> send(Message message, ChannelAdapter channelOverride,
            Duration timeout) {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        if (message.getDestination() == null) {
            throw new IllegalArgumentException("message destination must not be null");
        }
        ensureInitialized();
        if (state == MessagingServiceState.TORN_DOWN) {
            log.warn("MessagingService {}: 服务已清理，拒绝发送消息 {}", address, message.getName());
            return CompletableFuture.failedFuture(MessagingException.tornDown());
        }

        message.setSource(address);
        message.setId(idGenerator.nextId());

        List<ChannelAdapter> route = selectRoute(message, channelOverride);
        if (route.isEmpty()) {
            log.warn("MessagingService {}: 消息没有可用路由 {}", address, MessageUtils.toDebugString(message));
            metrics.recordDropped();
            return CompletableFuture.completedFuture(Optional.empty());
        }

        if (message.getType() != MessageType.REQUEST) {
            metrics.recordSent();
            dispatch(message, route);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        String requestId = message.getId();
        PendingResponder responder = new PendingResponder(requestId, message.getName());
        pendingResponders.put(requestId, responder);
        responder.getFuture().whenComplete((response, error) -> pendingResponders.remove(requestId, responder));
        // cleanUp 可能在状态检查之后、登记之前完成
        if (state == MessagingServiceState.TORN_DOWN) {
            if (pendingResponders.remove(requestId, responder)) {
                responder.fail(MessagingException.tornDown());
            }
            return responder.getFuture();
        }
        scheduleTimeout(responder, timeout != null ? timeout : config.getDefaultRequestTimeout());

        metrics.recordSent();
        int accepted = dispatch(message, route);
        if (accepted == 0 && pendingResponders.remove(requestId, responder)) {
            responder.fail(new MessagingException("request " + requestId + " could not be dispatched on any channel"));
        }
        return responder.getFuture();
    }

    /**
     * 设置本上下文收到非响应消息时的回调。传入 null 恢复为空操作。
     */
    public void setMessageReceived(MessageListener listener) {
        messageReceived = listener != null ? listener : NO_OP;
    }

    /**
     * 清理服务：移除所有子上下文，取消上游订阅，以 "service torn down" 拒绝所有待响应请求，重置回调，进入 TORN_DOWN。
     */
    public synchronized void cleanUp() {
        if (state == MessagingServiceState.TORN_DOWN) {
            log.debug("MessagingService {}: 已清理，忽略重复调用", address);
            return;
        }
        state = MessagingServiceState.TORN_DOWN;

        for (String name : new ArrayList<>(children.keySet())) {
            removeChild(name);
        }
        if (upstreamChannel != null) {
            unsubscribeQuietly(upstreamChannel, upstreamListener);
        }

        List<PendingResponder> pending = new ArrayList<>(pendingResponders.values());
        pendingResponders.clear();
        for (PendingResponder responder : pending) {
            responder.fail(MessagingException.tornDown());
        }
        messageReceived = NO_OP;

        Timer t = timer;
        if (ownsTimer && t != null) {
            t.stop();
        }
        log.info("MessagingService {}: 已清理，拒绝了 {} 个待响应请求", address, pending.size());
    }

    private void ensureInitialized() {
        if (state == MessagingServiceState.UNINITIALIZED) {
            initialize();
        }
    }

    private List<ChannelAdapter> selectRoute(Message message, ChannelAdapter channelOverride) {
        if (channelOverride != null) {
            return List.of(channelOverride);
        }
        if (routeManager.isUpstream(message.getDestination())) {
            ChannelAdapter upstream = upstreamChannel;
            if (upstream == null) {
                log.warn("MessagingService {}: 目标 {} 位于上游，但本上下文没有上游通道", address,
                        message.getDestination());
                return List.of();
            }
            return List.of(upstream);
        }
        List<ChannelAdapter> channels = new ArrayList<>();
        for (ChildRoute child : routeManager.resolveDownstream(message)) {
            channels.add(child.getChannel());
        }
        return channels;
    }

    /**
     * 通过各通道发送消息，单个通道失败不影响其他通道。
     *
     * @return 成功接受消息的通道数
     */
    private int dispatch(Message message, List<ChannelAdapter> channels) {
        int accepted = 0;
        for (ChannelAdapter channel : channels) {
            try {
                channel.send(message);
                accepted++;
                log.debug("MessagingService {}: 已通过 {} 发送 {}", address, channel.getName(),
                        MessageUtils.toDebugString(message));
            } catch (RuntimeException e) {
                metrics.recordDispatchError();
                log.error("MessagingService {}: 通过 {} 发送 {} 失败", address, channel.getName(),
                        MessageUtils.toDebugString(message), e);
            }
        }
        return accepted;
    }

    private void scheduleTimeout(PendingResponder responder, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return;
        }
        Timeout handle = timer().newTimeout(t -> expire(responder, timeout), timeout.toMillis(),
                TimeUnit.MILLISECONDS);
        responder.setTimeout(handle);
    }

    private void expire(PendingResponder responder, Duration timeout) {
        if (pendingResponders.remove(responder.getRequestId(), responder)) {
            metrics.recordTimeout();
            log.warn("MessagingService {}: 请求 {} ({}) 超时 {} ms", address, responder.getRequestId(),
                    responder.getRequestName(), timeout.toMillis());
            responder.fail(new RequestTimeoutException(responder.getRequestId(), timeout));
        }
    }

    private Timer timer() {
        Timer t = timer;
        if (t == null) {
            synchronized (this) {
                t = timer;
                if (t == null) {
                    t = new HashedWheelTimer(new DefaultThreadFactory("messageworks-timer", true), 10,
                            TimeUnit.MILLISECONDS);
                    timer = t;
                }
            }
        }
        return t;
    }

    /**
     * 入站处理：广播或发往本上下文的消息在本地处理，其余消息转发一跳。
     *
     * @param fromUpstream 消息是否来自上游通道
     */
    private void handleInbound(Message message, boolean fromUpstream) {
        if (message == null) {
            return;
        }
        if (state != MessagingServiceState.READY) {
            log.debug("MessagingService {}: 服务未就绪 ({})，丢弃入站消息 {}", address, state,
                    MessageUtils.toDebugString(message));
            return;
        }
        metrics.recordReceived();

        if (routeManager.isAddressedHere(message)) {
            if (message.getType() == MessageType.RESPONSE) {
                resolveResponse(message);
                return;
            }
            notifyReceived(message);
            if (message.isBroadcast() && fromUpstream && config.isPropagateBroadcasts()) {
                propagateBroadcast(message);
            }
            return;
        }
        forward(message);
    }

    private void resolveResponse(Message message) {
        if (!(message instanceof ResponseMessage)) {
            log.warn("MessagingService {}: 响应消息类型不匹配，丢弃 {}", address, MessageUtils.toDebugString(message));
            metrics.recordDropped();
            return;
        }
        ResponseMessage response = (ResponseMessage) message;
        String requestId = response.getRequestId();
        PendingResponder responder = requestId != null ? pendingResponders.remove(requestId) : null;
        if (responder == null) {
            log.debug("MessagingService {}: 没有等待中的请求，丢弃响应 {}", address, MessageUtils.toDebugString(message));
            metrics.recordDropped();
            return;
        }
        metrics.recordResponseMatched();
        responder.complete(response);
    }

    private void notifyReceived(Message message) {
        try {
            messageReceived.onMessage(message);
        } catch (RuntimeException e) {
            log.error("MessagingService {}: 消息回调处理 {} 发生异常", address, MessageUtils.toDebugString(message), e);
        }
    }

    private void propagateBroadcast(Message message) {
        List<ChannelAdapter> channels = new ArrayList<>();
        for (ChildRoute child : children.values()) {
            channels.add(child.getChannel());
        }
        if (!channels.isEmpty()) {
            metrics.recordForwardedDownstream();
            dispatch(message, channels);
        }
    }

    /**
     * 转发一跳，不改写 id 和 source。
     */
    private void forward(Message message) {
        Address destination = message.getDestination();
        if (destination == null) {
            log.warn("MessagingService {}: 入站消息缺少目标地址，丢弃 {}", address, MessageUtils.toDebugString(message));
            metrics.recordDropped();
            return;
        }
        if (routeManager.isUpstream(destination)) {
            ChannelAdapter upstream = upstreamChannel;
            if (upstream == null) {
                log.warn("MessagingService {}: 无上游通道，无法转发 {}", address, MessageUtils.toDebugString(message));
                metrics.recordDropped();
                return;
            }
            metrics.recordForwardedUpstream();
            dispatch(message, List.of(upstream));
            return;
        }
        List<ChannelAdapter> channels = new ArrayList<>();
        for (ChildRoute child : routeManager.resolveForward(destination)) {
            channels.add(child.getChannel());
        }
        if (channels.isEmpty()) {
            log.warn("MessagingService {}: 没有可转发的子上下文，丢弃 {}", address, MessageUtils.toDebugString(message));
            metrics.recordDropped();
            return;
        }
        metrics.recordForwardedDownstream();
        dispatch(message, channels);
    }

    private void unsubscribeQuietly(ChannelAdapter channel, MessageListener listener) {
        try {
            channel.unsubscribe(listener);
        } catch (RuntimeException e) {
            log.warn("MessagingService {}: 取消订阅通道 {} 失败", address, channel.getName(), e);
        }
    }
}
