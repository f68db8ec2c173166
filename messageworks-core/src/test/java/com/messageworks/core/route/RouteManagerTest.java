package com.messageworks.core.route;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.messageworks.core.message.Address;
import com.messageworks.core.message.GeneralMessage;
import com.messageworks.core.message.Message;
import com.messageworks.core.testutil.RecordingChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RouteManagerTest {

    private final Address here = Address.of("a");
    private final Map<String, ChildRoute> children = new LinkedHashMap<>();
    private RouteManager routeManager;

    @BeforeEach
    void setUp() {
        children.put("b", route("b"));
        children.put("c", route("c"));
        routeManager = new RouteManager(here, children);
    }

    private ChildRoute route(String name) {
        return new ChildRoute(name, here.child(name), new RecordingChannel(name), message -> {
        });
    }

    private static List<String> names(List<ChildRoute> routes) {
        return routes.stream().map(ChildRoute::getName).collect(Collectors.toList());
    }

    @Test
    void testAddressedHere() {
        assertTrue(routeManager.isAddressedHere(new GeneralMessage("m", Address.of("a"))));
        assertFalse(routeManager.isAddressedHere(new GeneralMessage("m", Address.of("a", "b"))));
        assertTrue(routeManager.isAddressedHere(new GeneralMessage("m", Address.of("x")).setBroadcast(true)));
    }

    @Test
    void testUpstream() {
        assertTrue(routeManager.isUpstream(Address.root()));
        assertTrue(routeManager.isUpstream(Address.of("x", "y")));
        assertFalse(routeManager.isUpstream(Address.of("a")));
        assertFalse(routeManager.isUpstream(Address.of("a", "b", "z")));
    }

    @Test
    @DisplayName("按下一跳选择子上下文")
    void testResolveForward() {
        assertEquals(List.of("b"), names(routeManager.resolveForward(Address.of("a", "b"))));
        assertEquals(List.of("c"), names(routeManager.resolveForward(Address.of("a", "c", "deep", "er"))));
        assertTrue(routeManager.resolveForward(Address.of("a", "unknown")).isEmpty());
        assertTrue(routeManager.resolveForward(null).isEmpty());
    }

    @Test
    void testResolveDownstreamBroadcast() {
        Message broadcast = new GeneralMessage("all", Address.of("a")).setBroadcast(true);
        assertEquals(List.of("b", "c"), names(routeManager.resolveDownstream(broadcast)));

        Message direct = new GeneralMessage("one", Address.of("a", "c"));
        assertEquals(List.of("c"), names(routeManager.resolveDownstream(direct)));
    }

    @Test
    @DisplayName("路由表变化立即生效")
    void testSeesLiveChildren() {
        children.remove("b");
        assertTrue(routeManager.resolveForward(Address.of("a", "b")).isEmpty());
    }
}
